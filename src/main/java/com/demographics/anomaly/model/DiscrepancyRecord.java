package com.demographics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Disagreement between providers for one entity, indicator and year")
public class DiscrepancyRecord {

    @Schema(description = "Analysis run that produced this record")
    private String runId;

    @Schema(description = "Entity identifier", example = "NPL")
    private String entityId;

    @Schema(description = "Indicator compared across providers", example = "POPULATION")
    private Indicator indicator;

    @Schema(description = "Year", example = "2010")
    private int year;

    @Schema(description = "Smallest reported value", example = "1000000")
    private double minValue;

    @Schema(description = "Largest reported value", example = "1300000")
    private double maxValue;

    @Schema(description = "Mean of the reported values", example = "1150000")
    private double meanValue;

    @Schema(description = "Sample standard deviation divided by the mean", example = "0.184")
    private double coefficientOfVariation;

    @Schema(description = "(max - min) / min", example = "0.30")
    private double maxDiscrepancy;

    @Schema(description = "Number of providers reporting a value", example = "2")
    private int providerCount;

    @Schema(description = "Providers reporting a value")
    @Builder.Default
    private List<String> providerIds = new ArrayList<>();

    @Schema(description = "Whether the max discrepancy exceeded the threshold", example = "true")
    private boolean flagged;

    @Schema(description = "Creation timestamp in epoch milliseconds")
    private long createdAt;

    public AnomalyMethod getMethod() {
        return AnomalyMethod.DISCREPANCY;
    }
}
