package com.demographics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-run overrides. Null fields fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Parameters for one analysis run")
public class AnalysisRequest {

    @Schema(description = "First year to analyse", example = "1950")
    private Integer yearFrom;

    @Schema(description = "Last year to analyse", example = "2025")
    private Integer yearTo;

    @Schema(description = "Indicators to analyse", example = "[\"POPULATION\", \"BIRTH_RATE\"]")
    private List<Indicator> indicators;

    @Schema(description = "Run the multivariate detector", example = "true")
    private Boolean includeMultivariate;
}
