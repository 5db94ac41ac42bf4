package com.demographics.anomaly.controller;

import com.demographics.anomaly.model.ConfirmationRule;
import com.demographics.anomaly.model.CredibilityRecord;
import com.demographics.anomaly.model.OverallCredibilityRecord;
import com.demographics.anomaly.model.ScoringModel;
import com.demographics.anomaly.service.CredibilityService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/credibility")
@Tag(name = "Credibility", description = "Provider credibility scoring from anomaly agreement")
public class CredibilityController {

    private final CredibilityService credibilityService;

    public CredibilityController(CredibilityService credibilityService) {
        this.credibilityService = credibilityService;
    }

    @Operation(summary = "Score provider credibility",
            description = "Scores every provider against the latest COMPLETED analysis run and upserts the results. " +
                    "Returns 409 when no run has completed yet.")
    @PostMapping("/score")
    public ResponseEntity<?> score(
            @Parameter(description = "Scoring model; configured default when omitted")
            @RequestParam(required = false) ScoringModel model,
            @Parameter(description = "Which explained anomalies count as confirmed; configured default when omitted")
            @RequestParam(required = false) ConfirmationRule confirmationRule) {
        try {
            return ResponseEntity.ok(credibilityService.score(model, confirmationRule));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "List provider credibility", description = "Highest normalized weight first.")
    @GetMapping("/providers")
    public ResponseEntity<List<OverallCredibilityRecord>> getProviders() {
        return ResponseEntity.ok(credibilityService.getProviders());
    }

    @Operation(summary = "Get a provider's per-entity credibility")
    @GetMapping("/providers/{providerId}/entities")
    public ResponseEntity<List<CredibilityRecord>> getProviderEntities(
            @Parameter(description = "Provider ID", example = "WORLD_BANK") @PathVariable String providerId) {
        List<CredibilityRecord> rows = credibilityService.getProviderEntities(providerId);
        if (rows == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rows);
    }
}
