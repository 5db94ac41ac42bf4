package com.demographics.anomaly.engine.credibility;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.model.AnomalyConfirmation;
import com.demographics.anomaly.model.ConfirmationRule;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Builds the predicate that decides whether an explained anomaly counts as confirmed.
 */
public final class ConfirmationFilter {

    private ConfirmationFilter() {}

    public static Predicate<AnomalyConfirmation> forRule(ConfirmationRule rule, DetectionConfig.Credibility config) {
        Predicate<AnomalyConfirmation> positive = c -> c.getConfidenceLevel() > 0;
        return switch (rule) {
            case ANY_POSITIVE_CONFIDENCE -> positive;
            case MIN_CONFIDENCE -> c -> c.getConfidenceLevel() >= Math.max(1, config.getMinConfirmationConfidence());
            case EXCLUDE_NO_KNOWN_CAUSE -> positive.and(c -> !statesNoKnownCause(c.getExplanation(),
                    config.getNoKnownCausePhrases()));
        };
    }

    static boolean statesNoKnownCause(String explanation, List<String> phrases) {
        if (explanation == null || explanation.isBlank()) return true;
        String text = explanation.toLowerCase(Locale.ROOT);
        return phrases.stream().anyMatch(p -> text.contains(p.toLowerCase(Locale.ROOT)));
    }
}
