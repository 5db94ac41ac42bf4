package com.demographics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A sex-disaggregated indicator reported for one sex only")
public record SexImbalanceIssue(
        @Schema(example = "NPL") String entityId,
        @Schema(example = "UN_DESA") String providerId,
        @Schema(example = "2015") int year,
        @Schema(example = "LIFE_EXPECTANCY") Indicator indicator,
        @Schema(example = "MALE") Sex presentSex,
        @Schema(example = "FEMALE") Sex missingSex) {}
