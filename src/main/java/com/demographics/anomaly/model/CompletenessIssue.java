package com.demographics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A core indicator missing for an entity-provider-year that has other core indicators")
public record CompletenessIssue(
        @Schema(example = "NPL") String entityId,
        @Schema(example = "UN_DESA") String providerId,
        @Schema(example = "2015") int year,
        @Schema(example = "MEDIAN_AGE") Indicator missingIndicator) {}
