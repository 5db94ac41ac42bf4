package com.demographics.anomaly.engine;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesDetectionResult;

import java.util.Set;

/**
 * Interface for detectors that judge a single series on its own history.
 * Implementations hold no per-call state, so one instance may serve several
 * worker threads at once.
 */
public interface SeriesDetector {

    /**
     * Stable name used in run reports and metrics.
     */
    String getName();

    /**
     * Methods this detector can set on a point.
     */
    Set<AnomalyMethod> getSupportedMethods();

    /**
     * Whether the detector takes part under the given configuration.
     */
    default boolean isActive(DetectionConfig config) {
        return true;
    }

    /**
     * Evaluate every point of the series.
     *
     * @param series chronologically ordered values for one key
     * @return one result per point, or a skipped result when the series is too short
     */
    SeriesDetectionResult detect(Series series);
}
