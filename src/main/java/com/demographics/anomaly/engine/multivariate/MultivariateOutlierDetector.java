package com.demographics.anomaly.engine.multivariate;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.engine.stats.ChiSquared;
import com.demographics.anomaly.exception.FittingException;
import com.demographics.anomaly.model.MultivariateOutlierRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores every feature row by its squared Mahalanobis distance under a robust
 * (MCD) fit and flags rows whose chi-square tail probability falls below alpha.
 */
@Component
public class MultivariateOutlierDetector {

    private static final Logger log = LoggerFactory.getLogger(MultivariateOutlierDetector.class);

    private final DetectionConfig config;

    public MultivariateOutlierDetector(DetectionConfig config) {
        this.config = config;
    }

    public List<MultivariateOutlierRecord> detect(FeatureTable table) throws FittingException {
        DetectionConfig.Multivariate params = config.getMultivariate();
        int n = table.size();
        int p = table.featureCount();

        double supportFraction = supportFraction(n, p);
        RobustCovarianceEstimator estimator = new RobustCovarianceEstimator(
                params.getTrials(), params.getMaxConcentrationSteps(), params.getSeed());
        RobustFit fit = estimator.fit(table.matrix(), supportFraction);

        List<MultivariateOutlierRecord> records = new ArrayList<>(n);
        int flagged = 0;
        for (FeatureRow row : table.rows()) {
            double d2 = Math.max(0.0, fit.squaredDistance(row.values()));
            double pValue = ChiSquared.survival(d2, p);
            boolean outlier = pValue < params.getAlpha();
            if (outlier) flagged++;
            records.add(MultivariateOutlierRecord.builder()
                    .entityId(row.entityId())
                    .year(row.year())
                    .squaredDistance(d2)
                    .distance(Math.sqrt(d2))
                    .chiSquarePValue(pValue)
                    .flagged(outlier)
                    .featureCount(p)
                    .build());
        }

        log.info("Multivariate scoring: {} rows, {} features, support fraction {}, {} outliers at alpha {}",
                n, p, supportFraction, flagged, params.getAlpha());
        return records;
    }

    /**
     * Configured support fraction, reduced to max(min, n / 2p) when there are fewer
     * than rowsPerFeature rows per feature. Never above the configured value.
     */
    double supportFraction(int rows, int features) {
        DetectionConfig.Multivariate params = config.getMultivariate();
        double configured = params.getSupportFraction();
        if (features > 0 && rows < params.getRowsPerFeature() * features) {
            double adaptive = Math.max(params.getMinSupportFraction(), rows / (2.0 * features));
            return Math.min(configured, adaptive);
        }
        return configured;
    }
}
