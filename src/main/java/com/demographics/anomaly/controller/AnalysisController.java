package com.demographics.anomaly.controller;

import com.demographics.anomaly.model.AnalysisRequest;
import com.demographics.anomaly.model.AnalysisRun;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.AnomalyRecord;
import com.demographics.anomaly.model.DiscrepancyRecord;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.MultivariateOutlierRecord;
import com.demographics.anomaly.service.AnalysisPipelineService;
import com.demographics.anomaly.service.AnalysisResultService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
@Tag(name = "Analysis", description = "Trigger analysis runs and read their anomaly records")
public class AnalysisController {

    private final AnalysisPipelineService pipelineService;
    private final AnalysisResultService resultService;

    public AnalysisController(AnalysisPipelineService pipelineService, AnalysisResultService resultService) {
        this.pipelineService = pipelineService;
        this.resultService = resultService;
    }

    @Operation(summary = "Run an analysis",
            description = "Runs every series detector, the cross-provider comparison and, unless disabled, " +
                    "the multivariate detector over the stored observations. Blocks until the run finishes " +
                    "and returns its manifest. Omitted fields use the configured defaults.")
    @PostMapping("/runs")
    public ResponseEntity<?> startRun(@RequestBody(required = false) AnalysisRequest request) {
        AnalysisRequest effective = request != null ? request : new AnalysisRequest();
        if (effective.getYearFrom() != null && effective.getYearTo() != null
                && effective.getYearFrom() > effective.getYearTo()) {
            return badRequest("yearFrom must not be after yearTo", "yearFrom");
        }
        try {
            return ResponseEntity.ok(pipelineService.run(effective));
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage(), "yearFrom");
        }
    }

    @Operation(summary = "List analysis runs", description = "All runs, most recent first, whatever their status.")
    @GetMapping("/runs")
    public ResponseEntity<List<AnalysisRun>> getRuns() {
        return ResponseEntity.ok(resultService.getRuns());
    }

    @Operation(summary = "Get a run manifest")
    @GetMapping("/runs/{runId}")
    public ResponseEntity<AnalysisRun> getRun(
            @Parameter(description = "Run ID") @PathVariable String runId) {
        AnalysisRun run = resultService.getRun(runId);
        if (run == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(run);
    }

    @Operation(summary = "Get series anomaly records of a run",
            description = "One record per flagged (series, year), listing every method that flagged it.")
    @GetMapping("/runs/{runId}/anomalies")
    public ResponseEntity<List<AnomalyRecord>> getAnomalies(
            @Parameter(description = "Run ID") @PathVariable String runId,
            @Parameter(description = "Filter by entity", example = "NPL") @RequestParam(required = false) String entityId,
            @Parameter(description = "Filter by provider", example = "WORLD_BANK") @RequestParam(required = false) String providerId,
            @Parameter(description = "Filter by indicator") @RequestParam(required = false) Indicator indicator,
            @Parameter(description = "Only records flagged by this method") @RequestParam(required = false) AnomalyMethod method) {
        List<AnomalyRecord> records = resultService.getAnomalies(runId, entityId, providerId, indicator, method);
        if (records == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(records);
    }

    @Operation(summary = "Get multivariate outlier scores of a run",
            description = "Rows sorted by robust Mahalanobis distance, largest first.")
    @GetMapping("/runs/{runId}/multivariate")
    public ResponseEntity<List<MultivariateOutlierRecord>> getMultivariate(
            @Parameter(description = "Run ID") @PathVariable String runId,
            @Parameter(description = "Only flagged rows") @RequestParam(defaultValue = "true") boolean flaggedOnly) {
        List<MultivariateOutlierRecord> records = resultService.getMultivariate(runId, flaggedOnly);
        if (records == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(records);
    }

    @Operation(summary = "Get cross-provider discrepancies of a run",
            description = "Sorted by max discrepancy, largest first.")
    @GetMapping("/runs/{runId}/discrepancies")
    public ResponseEntity<List<DiscrepancyRecord>> getDiscrepancies(
            @Parameter(description = "Run ID") @PathVariable String runId,
            @Parameter(description = "Filter by indicator") @RequestParam(required = false) Indicator indicator,
            @Parameter(description = "Only flagged slices") @RequestParam(defaultValue = "true") boolean flaggedOnly) {
        List<DiscrepancyRecord> records = resultService.getDiscrepancies(runId, indicator, flaggedOnly);
        if (records == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(records);
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
