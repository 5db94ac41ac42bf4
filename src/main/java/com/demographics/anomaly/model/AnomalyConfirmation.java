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
@Schema(description = "External explanation attached to an entity-year anomaly")
public class AnomalyConfirmation {

    @Schema(description = "Entity identifier", example = "NPL")
    private String entityId;

    @Schema(description = "Year of the explained anomaly", example = "2015")
    private int year;

    @Schema(description = "Confidence of the explanation, 1 (low) to 5 (high); 0 when unknown", example = "4")
    private int confidenceLevel;

    @Schema(description = "One-sentence explanation", example = "Gorkha earthquake caused mass displacement")
    private String explanation;
}
