package com.demographics.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

/**
 * One detector's verdict for a single point of a series.
 * Diagnostic fields a detector does not compute stay null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointResult {

    private int year;
    private double value;

    @Builder.Default
    private Set<AnomalyMethod> triggered = EnumSet.noneOf(AnomalyMethod.class);

    private Double valueZScore;
    private Double yoyChange;
    private Double globalZScore;
    private Double rollingZScore;
    private Double secondDerivative;

    // '+'-joined lenses that fired, e.g. "global+acceleration"
    private String category;
    private String description;

    public boolean isFlagged() {
        return !triggered.isEmpty();
    }
}
