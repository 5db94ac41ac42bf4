package com.demographics.anomaly.model;

/**
 * Detection methods that can flag an observation.
 * The first four operate on a single series; MULTIVARIATE works on the
 * per-entity feature table and DISCREPANCY on a cross-provider slice.
 */
public enum AnomalyMethod {
    Z_SCORE,
    GLOBAL_YOY,
    ROLLING_YOY,
    ACCELERATION,
    MULTIVARIATE,
    DISCREPANCY;

    public boolean isSeriesMethod() {
        return this != MULTIVARIATE && this != DISCREPANCY;
    }
}
