package com.demographics.anomaly.engine.multivariate;

import com.demographics.anomaly.engine.stats.ChiSquared;
import com.demographics.anomaly.engine.stats.LinearAlgebra;
import com.demographics.anomaly.engine.stats.Statistics;
import com.demographics.anomaly.exception.FittingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Minimum Covariance Determinant estimator in the FastMCD style.
 *
 * Each trial starts from a random (p + 1)-row elemental subset and runs two
 * concentration steps (keep the h rows closest under the current estimate, refit).
 * The best candidates are iterated to convergence and the one with the smallest
 * covariance determinant wins. The raw estimate is then rescaled for consistency
 * with the normal model and reweighted with the 97.5% chi-square cut-off.
 */
public class RobustCovarianceEstimator {

    private static final Logger log = LoggerFactory.getLogger(RobustCovarianceEstimator.class);

    private static final int INITIAL_STEPS = 2;
    private static final int CANDIDATES_KEPT = 10;

    private final int trials;
    private final int maxSteps;
    private final long seed;

    public RobustCovarianceEstimator(int trials, int maxSteps, long seed) {
        this.trials = Math.max(1, trials);
        this.maxSteps = Math.max(INITIAL_STEPS, maxSteps);
        this.seed = seed;
    }

    /**
     * @param data            n rows of p features, no missing values
     * @param supportFraction share of rows the raw estimate is computed from
     * @throws FittingException when n or the support size does not exceed p, or
     *                          no positive definite scatter can be formed
     */
    public RobustFit fit(double[][] data, double supportFraction) throws FittingException {
        int n = data.length;
        int p = n == 0 ? 0 : data[0].length;
        if (n == 0 || n <= p) {
            throw new FittingException("Not enough rows for a covariance fit", n, p);
        }
        int h = Math.min(n, (int) (supportFraction * n));
        if (h <= p) {
            throw new FittingException("Support subset too small", n, p);
        }

        Random random = new Random(seed);
        List<Candidate> candidates = new ArrayList<>(trials);
        for (int t = 0; t < trials; t++) {
            Candidate candidate = start(data, p, random);
            if (candidate == null) continue;
            for (int s = 0; s < INITIAL_STEPS && candidate != null; s++) {
                candidate = concentrate(data, candidate, h);
            }
            if (candidate != null) candidates.add(candidate);
        }
        if (candidates.isEmpty()) {
            throw new FittingException("No elemental subset produced a usable scatter", n, p);
        }

        candidates.sort(Comparator.comparingDouble(Candidate::logDet));
        Candidate best = null;
        for (Candidate candidate : candidates.subList(0, Math.min(CANDIDATES_KEPT, candidates.size()))) {
            Candidate refined = converge(data, candidate, h);
            if (best == null || refined.logDet < best.logDet) best = refined;
        }

        RobustFit raw = correct(data, best, p);
        RobustFit reweighted = reweight(data, raw, p);
        log.debug("MCD fit: n={}, p={}, h={}, support after reweighting={}", n, p, h, reweighted.supportSize());
        return reweighted;
    }

    private Candidate start(double[][] data, int p, Random random) {
        int n = data.length;
        int[] order = shuffled(n, random);
        // Grow the elemental subset until its scatter is non-singular
        for (int size = p + 1; size <= n; size++) {
            int[] rows = Arrays.copyOf(order, size);
            double[] center = LinearAlgebra.columnMeans(data, rows);
            double[][] cov = LinearAlgebra.covariance(data, rows, center);
            double[][] chol = LinearAlgebra.cholesky(cov);
            if (chol != null) {
                return new Candidate(rows, center, cov, chol, LinearAlgebra.logDeterminant(chol));
            }
        }
        return null;
    }

    private Candidate concentrate(double[][] data, Candidate current, int h) {
        double[] d2 = distances(data, current.center, current.cholesky);
        int[] rows = smallest(d2, h);
        double[] center = LinearAlgebra.columnMeans(data, rows);
        double[][] cov = LinearAlgebra.covariance(data, rows, center);
        double[][] chol = LinearAlgebra.choleskyWithRidge(cov);
        if (chol == null) return null;
        return new Candidate(rows, center, cov, chol, LinearAlgebra.logDeterminant(chol));
    }

    private Candidate converge(double[][] data, Candidate candidate, int h) {
        Candidate current = candidate;
        for (int step = 0; step < maxSteps; step++) {
            Candidate next = concentrate(data, current, h);
            if (next == null || next.logDet >= current.logDet - 1e-12) {
                return next != null && next.logDet < current.logDet ? next : current;
            }
            current = next;
        }
        return current;
    }

    private RobustFit correct(double[][] data, Candidate best, int p) throws FittingException {
        double[] d2 = distances(data, best.center, best.cholesky);
        double factor = Statistics.median(d2) / ChiSquared.quantile(0.5, p);
        if (!(factor > 0) || Double.isInfinite(factor)) {
            throw new FittingException("Degenerate consistency correction", data.length, p);
        }
        double[][] cov = LinearAlgebra.scale(best.covariance, factor);
        double[][] chol = LinearAlgebra.choleskyWithRidge(cov);
        if (chol == null) {
            throw new FittingException("Corrected scatter is not positive definite", data.length, p);
        }
        return new RobustFit(best.center, cov, chol, best.rows.length);
    }

    private RobustFit reweight(double[][] data, RobustFit raw, int p) {
        double cutoff = ChiSquared.quantile(0.975, p);
        int[] inliers = Arrays.stream(indices(data.length))
                .filter(i -> raw.squaredDistance(data[i]) < cutoff)
                .toArray();
        if (inliers.length <= p) {
            return raw;
        }
        double[] center = LinearAlgebra.columnMeans(data, inliers);
        double[][] cov = LinearAlgebra.covariance(data, inliers, center);
        double[][] chol = LinearAlgebra.choleskyWithRidge(cov);
        if (chol == null) {
            return raw;
        }
        return new RobustFit(center, cov, chol, inliers.length);
    }

    private static double[] distances(double[][] data, double[] center, double[][] chol) {
        double[] d2 = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            d2[i] = LinearAlgebra.squaredMahalanobis(data[i], center, chol);
        }
        return d2;
    }

    private static int[] smallest(double[] d2, int h) {
        Integer[] order = new Integer[d2.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble(i -> d2[i]));
        int[] rows = new int[h];
        for (int i = 0; i < h; i++) rows[i] = order[i];
        Arrays.sort(rows);
        return rows;
    }

    private static int[] shuffled(int n, Random random) {
        int[] order = indices(n);
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        return order;
    }

    private static int[] indices(int n) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) idx[i] = i;
        return idx;
    }

    private record Candidate(int[] rows, double[] center, double[][] covariance, double[][] cholesky, double logDet) {}
}
