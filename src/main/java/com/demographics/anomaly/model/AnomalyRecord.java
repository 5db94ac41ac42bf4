package com.demographics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A series point flagged by at least one time-series detector in a given analysis run")
public class AnomalyRecord {

    @Schema(description = "Analysis run that produced this record", example = "4b0c7d0e-6a43-4a8e-9a55-0d3f3e2f8b11")
    private String runId;

    @Schema(description = "Entity identifier", example = "NPL")
    private String entityId;

    @Schema(description = "Provider identifier", example = "WORLD_BANK")
    private String providerId;

    @Schema(description = "Indicator of the flagged series", example = "POPULATION")
    private Indicator indicator;

    @Schema(description = "Sex subgroup, when the indicator is sex-disaggregated")
    private Sex sex;

    @Schema(description = "Age group subgroup, when the indicator is age-disaggregated")
    private String ageGroup;

    @Schema(description = "Flagged year", example = "2003")
    private int year;

    @Schema(description = "Observed value at the flagged year", example = "250")
    private double value;

    @Schema(description = "Methods that flagged this point", example = "[\"ACCELERATION\"]")
    @Builder.Default
    private Set<AnomalyMethod> methods = EnumSet.noneOf(AnomalyMethod.class);

    @Schema(description = "Whole-series (or rolling) z-score of the value", example = "1.62")
    private Double valueZScore;

    @Schema(description = "Relative change from the previous point", example = "1.427")
    private Double yoyChange;

    @Schema(description = "Z-score of the relative change against the whole series", example = "1.68")
    private Double globalZScore;

    @Schema(description = "Z-score of the relative change against the trailing window", example = "1.50")
    private Double rollingZScore;

    @Schema(description = "Change of the relative change (acceleration)", example = "1.407")
    private Double secondDerivative;

    @Schema(description = "Direction of the relative change", example = "INCREASE")
    private Direction direction;

    @Schema(description = "Triggered year-over-year lenses", example = "acceleration")
    private String category;

    @Schema(description = "Human-readable summary",
            example = "Year 2003: increase of 142.7% (above average by 125.1%), showing acceleration of 140.7%")
    private String description;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    public SeriesKey seriesKey() {
        return new SeriesKey(entityId, providerId, indicator, sex, ageGroup);
    }

    public boolean isFlaggedBy(AnomalyMethod method) {
        return methods != null && methods.contains(method);
    }

    /**
     * True when every flagged method carries the diagnostic fields that justify it.
     */
    public boolean hasSupportingDiagnostics() {
        if (methods == null || methods.isEmpty()) return false;
        for (AnomalyMethod method : methods) {
            boolean present = switch (method) {
                case Z_SCORE -> valueZScore != null;
                case GLOBAL_YOY -> yoyChange != null && globalZScore != null;
                case ROLLING_YOY -> yoyChange != null && rollingZScore != null;
                case ACCELERATION -> yoyChange != null && secondDerivative != null;
                case MULTIVARIATE, DISCREPANCY -> false;
            };
            if (!present) return false;
        }
        return true;
    }
}
