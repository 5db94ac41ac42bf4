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
@Schema(description = "A single indicator value reported by one provider for one entity and year")
public class Observation {

    @Schema(description = "Entity (country or area) identifier", example = "NPL")
    private String entityId;

    @Schema(description = "Data provider identifier", example = "WORLD_BANK")
    private String providerId;

    @Schema(description = "Indicator the value belongs to", example = "POPULATION")
    private Indicator indicator;

    @Schema(description = "Calendar year", example = "2015")
    private int year;

    @Schema(description = "Reported value; absent when the provider has no data", example = "28656282")
    private Double value;

    @Schema(description = "Sex subgroup for sex-disaggregated indicators", example = "FEMALE")
    private Sex sex;

    @Schema(description = "Age group subgroup for age-disaggregated indicators", example = "15-19")
    private String ageGroup;

    @Schema(description = "Ingestion timestamp in epoch milliseconds", example = "1739886764000")
    private long ingestedAt;
}
