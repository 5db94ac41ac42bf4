package com.demographics.anomaly.engine.credibility;

import com.demographics.anomaly.model.CredibilityRecord;
import com.demographics.anomaly.model.OverallCredibilityRecord;

import java.util.List;

public record CredibilityOutcome(List<CredibilityRecord> entityScores, List<OverallCredibilityRecord> overall) {

    public CredibilityOutcome {
        entityScores = List.copyOf(entityScores);
        overall = List.copyOf(overall);
    }
}
