package com.demographics.anomaly.controller;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.service.DataCompletenessService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/validation")
@Tag(name = "Validation", description = "Completeness checks over the stored observations")
public class ValidationController {

    private final DataCompletenessService completenessService;
    private final DetectionConfig config;

    public ValidationController(DataCompletenessService completenessService, DetectionConfig config) {
        this.completenessService = completenessService;
        this.config = config;
    }

    @Operation(summary = "Missing core indicators",
            description = "Core indicators absent for an entity-provider-year that reports at least one other core indicator.")
    @GetMapping("/completeness")
    public ResponseEntity<?> getCompleteness(
            @Parameter(description = "First year", example = "1990") @RequestParam(required = false) Integer yearFrom,
            @Parameter(description = "Last year", example = "2020") @RequestParam(required = false) Integer yearTo,
            @Parameter(description = "Restrict to one entity", example = "NPL") @RequestParam(required = false) String entityId) {
        int from = yearFrom != null ? yearFrom : config.getPipeline().getYearFrom();
        int to = yearTo != null ? yearTo : config.getPipeline().getYearTo();
        if (from > to) return badRequest("yearFrom must not be after yearTo", "yearFrom");
        return ResponseEntity.ok(completenessService.findMissingCoreIndicators(from, to, entityId));
    }

    @Operation(summary = "Sex-imbalanced indicators",
            description = "Sex-disaggregated values reported for one sex while the other is missing.")
    @GetMapping("/sex-balance")
    public ResponseEntity<?> getSexBalance(
            @Parameter(description = "First year", example = "1990") @RequestParam(required = false) Integer yearFrom,
            @Parameter(description = "Last year", example = "2020") @RequestParam(required = false) Integer yearTo,
            @Parameter(description = "Restrict to one entity", example = "NPL") @RequestParam(required = false) String entityId) {
        int from = yearFrom != null ? yearFrom : config.getPipeline().getYearFrom();
        int to = yearTo != null ? yearTo : config.getPipeline().getYearTo();
        if (from > to) return badRequest("yearFrom must not be after yearTo", "yearFrom");
        return ResponseEntity.ok(completenessService.findSexImbalances(from, to, entityId));
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
