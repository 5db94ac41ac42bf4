package com.demographics.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Counts reported by a finished analysis run")
public class RunReport {

    @Schema(description = "Flagged points per detection method")
    @Builder.Default
    private Map<AnomalyMethod, Long> anomaliesByMethod = new EnumMap<>(AnomalyMethod.class);

    @Schema(description = "Series-level anomaly records written", example = "318")
    private long anomalyRecords;

    @Schema(description = "Series analysed across all indicators", example = "5120")
    private long seriesAnalysed;

    @Schema(description = "Series skipped per detector for insufficient data")
    @Builder.Default
    private Map<String, Long> seriesSkipped = new HashMap<>();

    @Schema(description = "Entity-year-indicator slices compared across providers", example = "9800")
    private long discrepancySlices;

    @Schema(description = "Feature rows dropped for missing values", example = "1204")
    private long multivariateRowsDropped;

    @Schema(description = "Feature rows scored", example = "6411")
    private long multivariateRowsScored;

    @Schema(description = "Whether the robust covariance fit was skipped", example = "false")
    private boolean multivariateSkipped;

    @Schema(description = "Logical units whose persistence failed and was rolled back")
    @Builder.Default
    private List<String> persistenceFailures = new ArrayList<>();

    public void addAnomalies(AnomalyMethod method, long count) {
        if (count > 0) {
            anomaliesByMethod.merge(method, count, Long::sum);
        }
    }

    public void addSkipped(String detector) {
        seriesSkipped.merge(detector, 1L, Long::sum);
    }

    public void addPersistenceFailure(String unit) {
        persistenceFailures.add(unit);
    }
}
