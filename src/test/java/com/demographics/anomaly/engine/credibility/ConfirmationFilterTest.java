package com.demographics.anomaly.engine.credibility;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.model.AnomalyConfirmation;
import com.demographics.anomaly.model.ConfirmationRule;
import org.junit.jupiter.api.Test;

import java.util.function.Predicate;

import static com.demographics.anomaly.testutil.TestDataFactory.createConfirmation;
import static org.assertj.core.api.Assertions.assertThat;

class ConfirmationFilterTest {

    private final DetectionConfig.Credibility config = new DetectionConfig.Credibility();

    @Test
    void anyPositiveConfidence_rejectsZero() {
        Predicate<AnomalyConfirmation> filter = ConfirmationFilter.forRule(ConfirmationRule.ANY_POSITIVE_CONFIDENCE, config);

        assertThat(filter.test(createConfirmation("NPL", 2015, 1, "Earthquake"))).isTrue();
        assertThat(filter.test(createConfirmation("NPL", 2015, 0, "Unclear"))).isFalse();
    }

    @Test
    void minConfidence_usesConfiguredFloor() {
        config.setMinConfirmationConfidence(3);
        Predicate<AnomalyConfirmation> filter = ConfirmationFilter.forRule(ConfirmationRule.MIN_CONFIDENCE, config);

        assertThat(filter.test(createConfirmation("NPL", 2015, 3, "Earthquake"))).isTrue();
        assertThat(filter.test(createConfirmation("NPL", 2015, 2, "Earthquake"))).isFalse();
    }

    @Test
    void excludeNoKnownCause_rejectsBlankAndUnexplained() {
        Predicate<AnomalyConfirmation> filter = ConfirmationFilter.forRule(ConfirmationRule.EXCLUDE_NO_KNOWN_CAUSE, config);
        String noCause = config.getNoKnownCausePhrases().get(0);

        assertThat(filter.test(createConfirmation("NPL", 2015, 4, "2015 earthquake displaced thousands"))).isTrue();
        assertThat(filter.test(createConfirmation("NPL", 2015, 4, "  "))).isFalse();
        assertThat(filter.test(createConfirmation("NPL", 2015, 4, noCause.toUpperCase()))).isFalse();
    }
}
