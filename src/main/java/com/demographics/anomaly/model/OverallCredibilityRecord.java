package com.demographics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregated credibility of one provider across all entities it covers")
public class OverallCredibilityRecord {

    @Schema(description = "Provider identifier", example = "WORLD_BANK")
    private String providerId;

    @Schema(description = "Scoring model that produced the score", example = "PENALTY")
    private ScoringModel model;

    @Schema(description = "Summed penalty, or average confidence across flagged anomalies", example = "-14.0")
    private double score;

    @Schema(description = "Softmax weight among all scored providers", example = "0.31")
    private double normalizedWeight;

    @Schema(description = "Entities contributing to the score", example = "187")
    private int entityCount;

    @Schema(description = "Anomalies contributing to the score", example = "42")
    private int anomalyCount;

    @Schema(description = "Computation timestamp in epoch milliseconds")
    private long computedAt;
}
