package com.demographics.anomaly.engine.detectors;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.engine.SeriesDetector;
import com.demographics.anomaly.engine.stats.Statistics;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.PointResult;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesDetectionResult;
import com.demographics.anomaly.model.ZScoreStrategy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Z-score of each value against a trailing window of raw values that includes
 * the value itself. Points whose window is short or flat carry no score.
 */
@Component
public class RollingZScoreDetector implements SeriesDetector {

    public static final String NAME = "rolling_z_score";

    private final DetectionConfig config;

    public RollingZScoreDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<AnomalyMethod> getSupportedMethods() {
        return EnumSet.of(AnomalyMethod.Z_SCORE);
    }

    @Override
    public boolean isActive(DetectionConfig config) {
        return config.getZscore().getStrategy() == ZScoreStrategy.ROLLING;
    }

    @Override
    public SeriesDetectionResult detect(Series series) {
        DetectionConfig.ZScore params = config.getZscore();
        int minPeriods = Math.max(2, params.getRollingMinPeriods());
        if (series.size() < minPeriods) {
            return SeriesDetectionResult.skipped(NAME);
        }

        double[] values = series.values();
        double[] mean = Statistics.rollingMean(values, params.getRollingWindow(), minPeriods);
        double[] std = Statistics.rollingSampleStd(values, params.getRollingWindow(), minPeriods);

        List<PointResult> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            PointResult point = PointResult.builder()
                    .year(series.yearAt(i))
                    .value(values[i])
                    .build();
            if (Statistics.isFinite(std[i]) && std[i] > 0) {
                double z = (values[i] - mean[i]) / std[i];
                point.setValueZScore(z);
                if (Math.abs(z) > params.getThreshold()) {
                    point.getTriggered().add(AnomalyMethod.Z_SCORE);
                    point.setDescription(ZScoreDetector.describe(series.yearAt(i), values[i], z)
                            .replace("the series mean", "the trailing mean"));
                }
            }
            points.add(point);
        }
        return SeriesDetectionResult.of(NAME, points);
    }
}
