package com.demographics.anomaly.engine.credibility;

import com.demographics.anomaly.model.ScoringModel;

/**
 * Turns anomaly agreement between providers into per-provider credibility.
 * Each implementation handles one {@link ScoringModel}.
 */
public interface CredibilityScorer {

    ScoringModel getModel();

    /**
     * Score every provider in the input. Per-entity weights sum to one over the
     * providers scored for that entity; overall normalized weights sum to one
     * over all providers.
     */
    CredibilityOutcome score(CredibilityInput input);
}
