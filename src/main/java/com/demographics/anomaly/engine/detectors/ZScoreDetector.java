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
import java.util.Locale;
import java.util.Set;

/**
 * Static outlier check against the whole series: z = (v - mean) / std with the
 * population standard deviation. A series of one point, or a constant series,
 * scores zero everywhere.
 */
@Component
public class ZScoreDetector implements SeriesDetector {

    public static final String NAME = "z_score";

    private final DetectionConfig config;

    public ZScoreDetector(DetectionConfig config) {
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
        return config.getZscore().getStrategy() == ZScoreStrategy.PLAIN;
    }

    @Override
    public SeriesDetectionResult detect(Series series) {
        if (series.isEmpty()) {
            return SeriesDetectionResult.skipped(NAME);
        }

        double threshold = config.getZscore().getThreshold();
        double[] values = series.values();
        double mean = Statistics.mean(values);
        double std = values.length >= 2 ? Statistics.populationStd(values) : 0.0;

        List<PointResult> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double z = std > 0 ? (values[i] - mean) / std : 0.0;
            PointResult point = PointResult.builder()
                    .year(series.yearAt(i))
                    .value(values[i])
                    .valueZScore(z)
                    .build();
            if (Math.abs(z) > threshold) {
                point.getTriggered().add(AnomalyMethod.Z_SCORE);
                point.setDescription(describe(series.yearAt(i), values[i], z));
            }
            points.add(point);
        }
        return SeriesDetectionResult.of(NAME, points);
    }

    static String describe(int year, double value, double z) {
        return String.format(Locale.ROOT, "Year %d: value %.2f is %.2f standard deviations %s the series mean",
                year, value, Math.abs(z), z > 0 ? "above" : "below");
    }
}
