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
@Schema(description = "Manifest of one analysis run; only COMPLETED runs are authoritative")
public class AnalysisRun {

    @Schema(description = "Run identifier", example = "4b0c7d0e-6a43-4a8e-9a55-0d3f3e2f8b11")
    private String runId;

    @Schema(description = "Run status", example = "COMPLETED")
    private RunStatus status;

    @Schema(description = "First year analysed", example = "1950")
    private int yearFrom;

    @Schema(description = "Last year analysed", example = "2025")
    private int yearTo;

    @Schema(description = "Indicators analysed")
    @Builder.Default
    private List<Indicator> indicators = new ArrayList<>();

    @Schema(description = "Start timestamp in epoch milliseconds")
    private long startedAt;

    @Schema(description = "Completion timestamp in epoch milliseconds; 0 while running")
    private long completedAt;

    @Schema(description = "Counts collected during the run")
    private RunReport report;

    @Schema(description = "Failure message when the run did not complete")
    private String failureReason;
}
