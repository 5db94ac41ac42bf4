package com.demographics.anomaly.config;

import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.ConfirmationRule;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.ScoringModel;
import com.demographics.anomaly.model.ZScoreStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    private ZScore zscore = new ZScore();

    private Yoy yoy = new Yoy();

    private Multivariate multivariate = new Multivariate();

    private Discrepancy discrepancy = new Discrepancy();

    private Credibility credibility = new Credibility();

    private Pipeline pipeline = new Pipeline();

    @Data
    public static class ZScore {
        private double threshold = 3.0;
        private ZScoreStrategy strategy = ZScoreStrategy.PLAIN;
        // Trailing window over raw values, ROLLING strategy only
        private int rollingWindow = 5;
        private int rollingMinPeriods = 3;
    }

    @Data
    public static class Yoy {
        private double threshold = 2.0;
        private int window = 5;
        private int minPeriods = 2;
        // Absolute change in relative growth between consecutive years
        private double secondDerivativeThreshold = 0.03;
    }

    @Data
    public static class Multivariate {
        private boolean enabled = true;
        // Chi-square tail probability below which a row is an outlier
        private double alpha = 0.003;
        private double supportFraction = 0.8;
        // Below rowsPerFeature * features rows the support fraction shrinks
        private int rowsPerFeature = 5;
        private double minSupportFraction = 0.5;
        private int trials = 50;
        private int maxConcentrationSteps = 30;
        private long seed = 42L;
        // Centered rolling median/MAD used for the robust deviation features
        private int robustWindow = 5;
        private int robustMinPeriods = 3;
    }

    @Data
    public static class Discrepancy {
        // (max - min) / min above which providers disagree
        private double threshold = 0.10;
        private int minProviders = 2;
    }

    @Data
    public static class Credibility {
        private ScoringModel model = ScoringModel.PENALTY;
        private ConfirmationRule confirmationRule = ConfirmationRule.ANY_POSITIVE_CONFIDENCE;
        private int minConfirmationConfidence = 3;
        // Indicator whose providers define coverage for the penalty model
        private Indicator coverageIndicator = Indicator.POPULATION;
        private Set<AnomalyMethod> flagMethods = EnumSet.of(
                AnomalyMethod.Z_SCORE, AnomalyMethod.GLOBAL_YOY,
                AnomalyMethod.ROLLING_YOY, AnomalyMethod.ACCELERATION);
        private List<String> noKnownCausePhrases = new ArrayList<>(List.of(
                "no known event", "no significant event", "no major event", "no specific event"));
    }

    @Data
    public static class Pipeline {
        private int parallelism = 1;
        private int yearFrom = 1950;
        private int yearTo = 2025;
        private List<Indicator> indicators = new ArrayList<>(List.of(
                Indicator.POPULATION, Indicator.BIRTH_RATE, Indicator.DEATH_RATE,
                Indicator.FERTILITY_RATE, Indicator.NET_MIGRATION, Indicator.MEDIAN_AGE,
                Indicator.LIFE_EXPECTANCY));
        private List<String> excludedEntities = new ArrayList<>();
        private List<String> excludedProviders = new ArrayList<>();
        // Placeholder values some providers write instead of leaving a gap
        private List<Double> sentinelValues = new ArrayList<>(List.of(-999.0, -9999.0));
        private boolean multivariate = true;
    }
}
