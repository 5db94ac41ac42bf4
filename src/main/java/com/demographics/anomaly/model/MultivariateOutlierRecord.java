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
@Schema(description = "Robust Mahalanobis score of one entity-year feature vector")
public class MultivariateOutlierRecord {

    @Schema(description = "Analysis run that produced this record")
    private String runId;

    @Schema(description = "Entity identifier", example = "NPL")
    private String entityId;

    @Schema(description = "Year", example = "2015")
    private int year;

    @Schema(description = "Squared Mahalanobis distance under the robust covariance", example = "41.7")
    private double squaredDistance;

    @Schema(description = "Mahalanobis distance", example = "6.46")
    private double distance;

    @Schema(description = "Chi-square survival probability of the squared distance", example = "0.00019")
    private double chiSquarePValue;

    @Schema(description = "Whether the p-value fell below the configured alpha", example = "true")
    private boolean flagged;

    @Schema(description = "Number of features (chi-square degrees of freedom)", example = "22")
    private int featureCount;

    @Schema(description = "Creation timestamp in epoch milliseconds")
    private long createdAt;

    public AnomalyMethod getMethod() {
        return AnomalyMethod.MULTIVARIATE;
    }
}
