package com.demographics.anomaly.engine.detectors;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.PointResult;
import com.demographics.anomaly.model.SeriesDetectionResult;
import com.demographics.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ZScoreDetectorTest {

    private DetectionConfig config;
    private ZScoreDetector detector;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.defaultConfig();
        detector = new ZScoreDetector(config);
    }

    @Test
    void detect_singlePoint_scoresZero() {
        SeriesDetectionResult result = detector.detect(TestDataFactory.populationSeries(42.0));

        assertThat(result.skipped()).isFalse();
        assertThat(result.points()).hasSize(1);
        assertThat(result.points().get(0).getValueZScore()).isEqualTo(0.0);
        assertThat(result.flaggedCount()).isZero();
    }

    @Test
    void detect_constantSeries_noFlags() {
        SeriesDetectionResult result = detector.detect(TestDataFactory.populationSeries(5, 5, 5, 5, 5));

        assertThat(result.flaggedCount()).isZero();
        assertThat(result.points()).allSatisfy(p -> assertThat(p.getValueZScore()).isEqualTo(0.0));
    }

    @Test
    void detect_spike_flaggedWithPopulationStd() {
        // ten 10s and one 100: mean 18.18, population std 25.87, z = 3.16
        SeriesDetectionResult result = detector.detect(
                TestDataFactory.populationSeries(10, 10, 10, 10, 10, 10, 10, 10, 10, 10, 100));

        PointResult spike = result.points().get(10);
        assertThat(spike.getValueZScore()).isCloseTo(3.16, within(0.01));
        assertThat(spike.getTriggered()).containsExactly(AnomalyMethod.Z_SCORE);
        assertThat(spike.getDescription()).startsWith("Year 2010:").contains("above the series mean");
        assertThat(result.flaggedCount()).isEqualTo(1);
    }

    @Test
    void detect_thresholdIsStrict() {
        // nine 10s and one 100 give exactly z = 3.0
        SeriesDetectionResult result = detector.detect(
                TestDataFactory.populationSeries(10, 10, 10, 10, 10, 10, 10, 10, 10, 100));

        assertThat(result.points().get(9).getValueZScore()).isCloseTo(3.0, within(1e-9));
        assertThat(result.flaggedCount()).isZero();
    }

    @Test
    void isActive_onlyForPlainStrategy() {
        assertThat(detector.isActive(config)).isTrue();
        config.getZscore().setStrategy(com.demographics.anomaly.model.ZScoreStrategy.ROLLING);
        assertThat(detector.isActive(config)).isFalse();
    }
}
