package com.demographics.anomaly.engine.detectors;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.engine.SeriesDetector;
import com.demographics.anomaly.engine.stats.Statistics;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.PointResult;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesDetectionResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Year-over-year change detector with three independent lenses on the relative
 * change r_t = (v_t - v_{t-1}) / v_{t-1}:
 *
 * global       - z of r against the mean and sample std of the whole series
 * local        - z of r against a trailing window of r (current point included)
 * acceleration - |r_t - r_{t-1}| above the configured threshold
 *
 * A point is flagged when any lens fires; the lenses that fired are kept as
 * separate methods and joined into the category label.
 */
@Component
public class YoyAdvancedDetector implements SeriesDetector {

    public static final String NAME = "yoy_advanced";

    private final DetectionConfig config;

    public YoyAdvancedDetector(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Set<AnomalyMethod> getSupportedMethods() {
        return EnumSet.of(AnomalyMethod.GLOBAL_YOY, AnomalyMethod.ROLLING_YOY, AnomalyMethod.ACCELERATION);
    }

    @Override
    public SeriesDetectionResult detect(Series series) {
        DetectionConfig.Yoy params = config.getYoy();
        if (series.size() < Math.max(3, params.getWindow())) {
            return SeriesDetectionResult.skipped(NAME);
        }

        double[] values = series.values();
        double[] change = relativeChanges(values);

        double globalMean = Statistics.mean(change);
        double globalStd = Statistics.sampleStd(change);
        boolean globalUsable = Statistics.isFinite(globalStd) && globalStd > 0;

        double[] rollingMean = Statistics.rollingMean(change, params.getWindow(), params.getMinPeriods());
        double[] rollingStd = Statistics.rollingSampleStd(change, params.getWindow(), params.getMinPeriods());

        List<PointResult> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double r = change[i];
            double globalZ = globalUsable ? (r - globalMean) / globalStd : 0.0;
            Double localZ = Statistics.isFinite(rollingStd[i]) && rollingStd[i] > 0
                    ? (r - rollingMean[i]) / rollingStd[i]
                    : null;
            double acceleration = i == 0 ? 0.0 : r - change[i - 1];

            PointResult point = PointResult.builder()
                    .year(series.yearAt(i))
                    .value(values[i])
                    .yoyChange(r)
                    .globalZScore(globalZ)
                    .rollingZScore(localZ)
                    .secondDerivative(acceleration)
                    .build();

            StringJoiner category = new StringJoiner("+");
            if (globalUsable && Math.abs(globalZ) > params.getThreshold()) {
                point.getTriggered().add(AnomalyMethod.GLOBAL_YOY);
                category.add("global");
            }
            if (localZ != null && Math.abs(localZ) > params.getThreshold()) {
                point.getTriggered().add(AnomalyMethod.ROLLING_YOY);
                category.add("local");
            }
            if (Math.abs(acceleration) > params.getSecondDerivativeThreshold()) {
                point.getTriggered().add(AnomalyMethod.ACCELERATION);
                category.add("acceleration");
            }

            if (point.isFlagged()) {
                point.setCategory(category.toString());
                point.setDescription(describe(series.yearAt(i), r, globalMean, acceleration));
            }
            points.add(point);
        }
        return SeriesDetectionResult.of(NAME, points);
    }

    /**
     * Relative change per point. The first point, a zero predecessor and any
     * non-finite ratio all yield 0.
     */
    static double[] relativeChanges(double[] values) {
        double[] change = new double[values.length];
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            double r = previous == 0 ? 0.0 : (values[i] - previous) / previous;
            change[i] = Statistics.isFinite(r) ? r : 0.0;
        }
        return change;
    }

    static String describe(int year, double change, double meanChange, double acceleration) {
        String movement = change > 0 ? "increase" : change < 0 ? "decrease" : "no change";
        double diffPct = (change - meanChange) * 100.0;
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT,
                "Year %d: %s of %.1f%% (%s average by %.1f%%)",
                year, movement, Math.abs(change * 100.0), diffPct >= 0 ? "above" : "below", Math.abs(diffPct)));
        double accelerationPct = acceleration * 100.0;
        if (Math.abs(accelerationPct) > 1.0) {
            sb.append(String.format(Locale.ROOT, ", showing %s of %.1f%%",
                    accelerationPct > 0 ? "acceleration" : "deceleration", Math.abs(accelerationPct)));
        }
        return sb.toString();
    }
}
