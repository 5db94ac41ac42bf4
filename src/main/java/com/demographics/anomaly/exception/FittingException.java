package com.demographics.anomaly.exception;

/**
 * Raised when the robust covariance estimator cannot produce a usable fit,
 * typically because there are too few complete rows for the number of features.
 */
public class FittingException extends Exception {

    private final int rows;
    private final int features;

    public FittingException(String message, int rows, int features) {
        super(message + " (rows=" + rows + ", features=" + features + ")");
        this.rows = rows;
        this.features = features;
    }

    public int getRows() {
        return rows;
    }

    public int getFeatures() {
        return features;
    }
}
