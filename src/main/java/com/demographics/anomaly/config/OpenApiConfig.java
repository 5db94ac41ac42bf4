package com.demographics.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI demographicAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Demographic Anomaly API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection and provider credibility scoring for demographic indicators " +
                                "reported by several data providers for the same country and year.\n\n" +
                                "**Analysis run:**\n" +
                                "1. Trigger via `POST /analysis/runs`\n" +
                                "2. Observations are grouped into yearly series per (country, provider, indicator)\n" +
                                "3. Series detectors: `Z_SCORE`, `GLOBAL_YOY`, `ROLLING_YOY`, `ACCELERATION`\n" +
                                "4. Cross-provider comparison: `DISCREPANCY` (max-min spread over 10%)\n" +
                                "5. Per country-year feature table scored with a robust (MCD) Mahalanobis distance: `MULTIVARIATE`\n" +
                                "6. The run is marked **COMPLETED**; only completed runs feed credibility scoring\n\n" +
                                "**Credibility models:**\n" +
                                "- `PENALTY` - providers lose a point for every confirmed anomaly they failed to flag\n" +
                                "- `CONFIDENCE_AVERAGE` - mean explanation confidence of the anomalies a provider flagged")
                        .contact(new Contact().name("Demographic Data Quality Team")));
    }
}
