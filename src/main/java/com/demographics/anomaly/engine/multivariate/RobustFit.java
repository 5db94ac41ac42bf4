package com.demographics.anomaly.engine.multivariate;

import com.demographics.anomaly.engine.stats.LinearAlgebra;

/**
 * Robust location and scatter of a fitted sample, kept with the Cholesky factor
 * of the scatter so distances are cheap to evaluate.
 */
public record RobustFit(double[] location, double[][] covariance, double[][] cholesky, int supportSize) {

    public int dimension() {
        return location.length;
    }

    public double squaredDistance(double[] row) {
        return LinearAlgebra.squaredMahalanobis(row, location, cholesky);
    }
}
