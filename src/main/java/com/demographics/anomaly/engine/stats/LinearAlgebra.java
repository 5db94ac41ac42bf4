package com.demographics.anomaly.engine.stats;

/**
 * Dense symmetric-matrix helpers for the covariance estimator. Matrices are
 * row-major {@code double[p][p]}; nothing here mutates its arguments.
 */
public final class LinearAlgebra {

    private LinearAlgebra() {}

    /** Column means of the selected rows. */
    public static double[] columnMeans(double[][] data, int[] rows) {
        int p = data[0].length;
        double[] mean = new double[p];
        for (int r : rows) {
            for (int j = 0; j < p; j++) mean[j] += data[r][j];
        }
        for (int j = 0; j < p; j++) mean[j] /= rows.length;
        return mean;
    }

    /** Maximum-likelihood covariance (divisor n) of the selected rows around the given center. */
    public static double[][] covariance(double[][] data, int[] rows, double[] center) {
        int p = center.length;
        double[][] cov = new double[p][p];
        double[] diff = new double[p];
        for (int r : rows) {
            for (int j = 0; j < p; j++) diff[j] = data[r][j] - center[j];
            for (int a = 0; a < p; a++) {
                for (int b = 0; b <= a; b++) {
                    cov[a][b] += diff[a] * diff[b];
                }
            }
        }
        for (int a = 0; a < p; a++) {
            for (int b = 0; b <= a; b++) {
                cov[a][b] /= rows.length;
                cov[b][a] = cov[a][b];
            }
        }
        return cov;
    }

    public static double[][] scale(double[][] matrix, double factor) {
        int p = matrix.length;
        double[][] out = new double[p][p];
        for (int i = 0; i < p; i++) {
            for (int j = 0; j < p; j++) out[i][j] = matrix[i][j] * factor;
        }
        return out;
    }

    /**
     * Lower-triangular Cholesky factor, or null when the matrix is not numerically
     * positive definite.
     */
    public static double[][] cholesky(double[][] matrix) {
        int p = matrix.length;
        double[][] l = new double[p][p];
        for (int i = 0; i < p; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = matrix[i][j];
                for (int k = 0; k < j; k++) sum -= l[i][k] * l[j][k];
                if (i == j) {
                    if (!(sum > 1e-12 * Math.max(1.0, Math.abs(matrix[i][i])))) return null;
                    l[i][i] = Math.sqrt(sum);
                } else {
                    l[i][j] = sum / l[j][j];
                }
            }
        }
        return l;
    }

    /**
     * Cholesky factor of {@code matrix}, adding a growing ridge to the diagonal until
     * the factorization succeeds. Returns null only if even a large ridge fails,
     * which happens for NaN input.
     */
    public static double[][] choleskyWithRidge(double[][] matrix) {
        double[][] l = cholesky(matrix);
        if (l != null) return l;

        int p = matrix.length;
        double trace = 0.0;
        for (int i = 0; i < p; i++) trace += Math.abs(matrix[i][i]);
        double base = trace > 0 ? trace / p : 1.0;

        for (double ridge = 1e-10; ridge <= 1e-2; ridge *= 10) {
            double[][] regularized = new double[p][p];
            for (int i = 0; i < p; i++) {
                System.arraycopy(matrix[i], 0, regularized[i], 0, p);
                regularized[i][i] += ridge * base;
            }
            l = cholesky(regularized);
            if (l != null) return l;
        }
        return null;
    }

    /** log det(A) from its Cholesky factor. */
    public static double logDeterminant(double[][] cholesky) {
        double sum = 0.0;
        for (int i = 0; i < cholesky.length; i++) sum += Math.log(cholesky[i][i]);
        return 2.0 * sum;
    }

    /** Squared Mahalanobis distance (x - center)' A^-1 (x - center) given the Cholesky factor of A. */
    public static double squaredMahalanobis(double[] x, double[] center, double[][] cholesky) {
        int p = center.length;
        double[] y = new double[p];
        // Forward substitution: L y = x - center
        for (int i = 0; i < p; i++) {
            double sum = x[i] - center[i];
            for (int k = 0; k < i; k++) sum -= cholesky[i][k] * y[k];
            y[i] = sum / cholesky[i][i];
        }
        double d2 = 0.0;
        for (double v : y) d2 += v * v;
        return d2;
    }
}
