package com.demographics.anomaly.engine.multivariate;

import com.demographics.anomaly.engine.stats.ChiSquared;
import com.demographics.anomaly.exception.FittingException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RobustCovarianceEstimatorTest {

    private final RobustCovarianceEstimator estimator = new RobustCovarianceEstimator(20, 30, 42L);

    @Test
    void fit_fewerRowsThanFeatures_throws() {
        double[][] data = {{1, 2, 3}, {4, 5, 6}, {7, 8, 10}};

        assertThatThrownBy(() -> estimator.fit(data, 0.8))
                .isInstanceOf(FittingException.class)
                .satisfies(e -> {
                    FittingException fe = (FittingException) e;
                    assertThat(fe.getRows()).isEqualTo(3);
                    assertThat(fe.getFeatures()).isEqualTo(3);
                });
    }

    @Test
    void fit_outlierDoesNotPullLocation() throws FittingException {
        double[][] data = MultivariateFixtures.periodicRowsWithOutlier();

        RobustFit fit = estimator.fit(data, 0.8);

        assertThat(fit.dimension()).isEqualTo(4);
        for (double coordinate : fit.location()) {
            assertThat(coordinate).isCloseTo(0.0, within(0.1));
        }
        assertThat(fit.supportSize()).isLessThan(data.length);
    }

    @Test
    void fit_distancesAreNonNegative_andCenterIsClosest() throws FittingException {
        double[][] data = MultivariateFixtures.periodicRowsWithOutlier();
        RobustFit fit = estimator.fit(data, 0.8);

        assertThat(fit.squaredDistance(fit.location())).isCloseTo(0.0, within(1e-12));
        for (double[] row : data) {
            assertThat(fit.squaredDistance(row)).isGreaterThanOrEqualTo(0.0);
        }
    }

    @Test
    void fit_rowAtRobustCenter_hasZeroDistanceAndPValueOne() throws FittingException {
        double[][] data = MultivariateFixtures.periodicRowsWithOutlier();
        RobustFit fit = estimator.fit(data, 0.8);
        double[] center = fit.location().clone();

        double squared = fit.squaredDistance(center);

        assertThat(Math.sqrt(squared)).isCloseTo(0.0, within(1e-6));
        assertThat(ChiSquared.survival(squared, fit.dimension())).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void fit_sameSeed_isDeterministic() throws FittingException {
        double[][] data = MultivariateFixtures.periodicRowsWithOutlier();

        RobustFit first = new RobustCovarianceEstimator(10, 30, 7L).fit(data, 0.75);
        RobustFit second = new RobustCovarianceEstimator(10, 30, 7L).fit(data, 0.75);

        assertThat(first.location()).containsExactly(second.location());
    }
}
