package com.demographics.anomaly.model;

import java.util.List;

/**
 * Output of one detector over one series. A skipped result means the series was
 * too short for the detector's minimum sample requirement.
 */
public record SeriesDetectionResult(String detector, boolean skipped, List<PointResult> points) {

    public static SeriesDetectionResult skipped(String detector) {
        return new SeriesDetectionResult(detector, true, List.of());
    }

    public static SeriesDetectionResult of(String detector, List<PointResult> points) {
        return new SeriesDetectionResult(detector, false, List.copyOf(points));
    }

    public long flaggedCount() {
        return points.stream().filter(PointResult::isFlagged).count();
    }
}
