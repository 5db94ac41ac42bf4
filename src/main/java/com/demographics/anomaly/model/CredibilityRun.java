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
@Schema(description = "Outcome of one credibility scoring pass")
public class CredibilityRun {

    @Schema(description = "Completed analysis run whose anomaly records were scored")
    private String sourceRunId;

    @Schema(description = "Scoring model applied", example = "PENALTY")
    private ScoringModel model;

    @Schema(description = "Confirmation rule applied", example = "ANY_POSITIVE_CONFIDENCE")
    private ConfirmationRule confirmationRule;

    @Schema(description = "Confirmed entity-years taken into account", example = "87")
    private int confirmedAnomalies;

    @Schema(description = "Per-provider results, highest normalized weight first")
    @Builder.Default
    private List<OverallCredibilityRecord> providers = new ArrayList<>();

    @Schema(description = "Providers whose rows could not be stored")
    @Builder.Default
    private List<String> failedProviders = new ArrayList<>();

    @Schema(description = "Providers scored by an earlier pass whose rows this pass removed")
    @Builder.Default
    private List<String> removedProviders = new ArrayList<>();

    @Schema(description = "Scoring timestamp in epoch milliseconds")
    private long computedAt;
}
