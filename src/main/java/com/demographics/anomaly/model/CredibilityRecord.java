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
@Schema(description = "Credibility of one provider for one entity")
public class CredibilityRecord {

    @Schema(description = "Provider identifier", example = "WORLD_BANK")
    private String providerId;

    @Schema(description = "Entity identifier", example = "NPL")
    private String entityId;

    @Schema(description = "Scoring model that produced the score", example = "PENALTY")
    private ScoringModel model;

    @Schema(description = "Penalty (<= 0) or average confidence, depending on the model", example = "-2.0")
    private double score;

    @Schema(description = "Softmax weight among providers covering the entity; sums to 1 per entity", example = "0.12")
    private double weight;

    @Schema(description = "Anomalies that contributed to the score", example = "3")
    private int anomalyCount;

    @Schema(description = "Computation timestamp in epoch milliseconds")
    private long computedAt;
}
