package com.demographics.anomaly.engine;

import com.demographics.anomaly.model.AnomalyRecord;
import com.demographics.anomaly.model.SeriesKey;

import java.util.List;

/**
 * Merged outcome of every active detector on one series: one record per flagged
 * year, plus the detectors that skipped the series for lack of data.
 * Records carry no run id yet.
 */
public record SeriesAnalysis(SeriesKey key, List<AnomalyRecord> anomalies, List<String> skippedDetectors) {

    public SeriesAnalysis {
        anomalies = List.copyOf(anomalies);
        skippedDetectors = List.copyOf(skippedDetectors);
    }
}
