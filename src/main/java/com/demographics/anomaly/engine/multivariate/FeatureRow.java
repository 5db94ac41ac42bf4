package com.demographics.anomaly.engine.multivariate;

/**
 * One (entity, year) feature vector.
 */
public record FeatureRow(String entityId, int year, double[] values) {

    public boolean isComplete() {
        for (double v : values) {
            if (Double.isNaN(v) || Double.isInfinite(v)) return false;
        }
        return true;
    }
}
