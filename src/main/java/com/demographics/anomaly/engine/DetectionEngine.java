package com.demographics.anomaly.engine;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.config.MetricsConfig;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.AnomalyRecord;
import com.demographics.anomaly.model.Direction;
import com.demographics.anomaly.model.PointResult;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesDetectionResult;
import com.demographics.anomaly.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Runs every active series detector on a series and merges their per-point
 * verdicts. Uses the Strategy pattern: each detector is a registered
 * {@link SeriesDetector}. Method flags from different detectors are unioned on
 * the same record, never folded into one score.
 */
@Component
public class DetectionEngine {

    private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

    private static final Set<AnomalyMethod> YOY_METHODS =
            EnumSet.of(AnomalyMethod.GLOBAL_YOY, AnomalyMethod.ROLLING_YOY, AnomalyMethod.ACCELERATION);

    private final Map<String, SeriesDetector> detectorMap;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public DetectionEngine(List<SeriesDetector> detectors, DetectionConfig config, MetricsConfig metricsConfig) {
        this.detectorMap = new LinkedHashMap<>();
        this.config = config;
        this.metricsConfig = metricsConfig;

        for (SeriesDetector detector : detectors) {
            detectorMap.put(detector.getName(), detector);
            log.info("Registered series detector: {} -> {} {}",
                    detector.getName(), detector.getClass().getSimpleName(), detector.getSupportedMethods());
        }
    }

    public SeriesAnalysis analyse(Series series) {
        SeriesKey key = series.key();
        List<String> skipped = new ArrayList<>();
        Map<Integer, List<PointResult>> byYear = new TreeMap<>();

        for (SeriesDetector detector : detectorMap.values()) {
            if (!detector.isActive(config)) continue;

            SeriesDetectionResult result;
            try {
                result = detector.detect(series);
            } catch (RuntimeException e) {
                // One failing detector must not hide the others' flags for this series
                log.error("Detector {} failed on series {}: {}", detector.getName(), key.asText(), e.getMessage(), e);
                skipped.add(detector.getName());
                continue;
            }

            if (result.skipped()) {
                skipped.add(detector.getName());
                metricsConfig.recordSeriesSkipped(detector.getName());
                continue;
            }
            for (PointResult point : result.points()) {
                byYear.computeIfAbsent(point.getYear(), y -> new ArrayList<>()).add(point);
            }
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (List<PointResult> points : byYear.values()) {
            if (points.stream().anyMatch(PointResult::isFlagged)) {
                anomalies.add(merge(key, points));
            }
        }

        if (!anomalies.isEmpty()) {
            log.debug("Series {}: {} flagged points, skipped by {}", key.asText(), anomalies.size(), skipped);
        }
        return new SeriesAnalysis(key, anomalies, skipped);
    }

    private AnomalyRecord merge(SeriesKey key, List<PointResult> points) {
        AnomalyRecord record = AnomalyRecord.builder()
                .entityId(key.entityId())
                .providerId(key.providerId())
                .indicator(key.indicator())
                .sex(key.sex())
                .ageGroup(key.ageGroup())
                .year(points.get(0).getYear())
                .value(points.get(0).getValue())
                .build();

        StringJoiner category = new StringJoiner("+");
        StringJoiner description = new StringJoiner("; ");
        for (PointResult point : points) {
            record.getMethods().addAll(point.getTriggered());
            if (point.getValueZScore() != null) record.setValueZScore(point.getValueZScore());
            if (point.getYoyChange() != null) record.setYoyChange(point.getYoyChange());
            if (point.getGlobalZScore() != null) record.setGlobalZScore(point.getGlobalZScore());
            if (point.getRollingZScore() != null) record.setRollingZScore(point.getRollingZScore());
            if (point.getSecondDerivative() != null) record.setSecondDerivative(point.getSecondDerivative());
            if (point.isFlagged()) {
                if (point.getTriggered().contains(AnomalyMethod.Z_SCORE)) category.add("z_score");
                if (point.getCategory() != null) category.add(point.getCategory());
                if (point.getDescription() != null) description.add(point.getDescription());
            }
        }

        record.setCategory(category.toString());
        record.setDescription(description.toString());
        if (record.getYoyChange() != null && record.getMethods().stream().anyMatch(YOY_METHODS::contains)) {
            record.setDirection(Direction.fromChange(record.getYoyChange()));
        }
        return record;
    }
}
