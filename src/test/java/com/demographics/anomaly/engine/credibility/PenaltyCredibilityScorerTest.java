package com.demographics.anomaly.engine.credibility;

import com.demographics.anomaly.model.CredibilityRecord;
import com.demographics.anomaly.model.OverallCredibilityRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PenaltyCredibilityScorerTest {

    private PenaltyCredibilityScorer scorer;
    private CredibilityInput input;

    @BeforeEach
    void setUp() {
        scorer = new PenaltyCredibilityScorer();
        // P covers five entities and flags only the E3 event; Q covers E1 and flags its event
        input = new CredibilityInput(
                Map.of("P", Set.of("E1", "E2", "E3", "E4", "E5"),
                        "Q", Set.of("E1")),
                Map.of("P", Set.of(new EntityYear("E3", 2002)),
                        "Q", Set.of(new EntityYear("E1", 2000))),
                Map.of(new EntityYear("E1", 2000), 5,
                        new EntityYear("E2", 2001), 4,
                        new EntityYear("E3", 2002), 3));
    }

    @Test
    void score_missedConfirmedEventsCostOnePointEach() {
        CredibilityOutcome outcome = scorer.score(input);

        Map<String, Double> pScores = outcome.entityScores().stream()
                .filter(r -> r.getProviderId().equals("P"))
                .collect(Collectors.toMap(CredibilityRecord::getEntityId, CredibilityRecord::getScore));
        assertThat(pScores).containsExactlyInAnyOrderEntriesOf(Map.of(
                "E1", -1.0, "E2", -1.0, "E3", 0.0, "E4", 0.0, "E5", 0.0));

        OverallCredibilityRecord p = overall(outcome, "P");
        assertThat(p.getScore()).isEqualTo(-2.0);
        assertThat(p.getEntityCount()).isEqualTo(5);
        assertThat(p.getAnomalyCount()).isEqualTo(1);
    }

    @Test
    void score_scoresNeverPositive() {
        CredibilityOutcome outcome = scorer.score(input);

        assertThat(outcome.entityScores()).allSatisfy(r -> assertThat(r.getScore()).isLessThanOrEqualTo(0.0));
        assertThat(overall(outcome, "Q").getScore()).isEqualTo(0.0);
    }

    @Test
    void score_perEntityWeightsSumToOne() {
        CredibilityOutcome outcome = scorer.score(input);

        Map<String, Double> e1 = outcome.entityScores().stream()
                .filter(r -> r.getEntityId().equals("E1"))
                .collect(Collectors.toMap(CredibilityRecord::getProviderId, CredibilityRecord::getWeight));
        assertThat(e1.get("P") + e1.get("Q")).isCloseTo(1.0, within(1e-12));
        assertThat(e1.get("P")).isCloseTo(Math.exp(-1) / (1 + Math.exp(-1)), within(1e-12));

        // E2 has P as its only provider
        assertThat(outcome.entityScores()).filteredOn(r -> r.getEntityId().equals("E2"))
                .singleElement()
                .satisfies(r -> assertThat(r.getWeight()).isEqualTo(1.0));
    }

    @Test
    void score_overallNormalizedWeightsSumToOne() {
        CredibilityOutcome outcome = scorer.score(input);

        double total = outcome.overall().stream().mapToDouble(OverallCredibilityRecord::getNormalizedWeight).sum();
        assertThat(total).isCloseTo(1.0, within(1e-12));
        assertThat(overall(outcome, "Q").getNormalizedWeight())
                .isGreaterThan(overall(outcome, "P").getNormalizedWeight());
    }

    @Test
    void score_isIdempotent() {
        CredibilityOutcome first = scorer.score(input);
        CredibilityOutcome second = scorer.score(input);

        assertThat(second.entityScores()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(first.entityScores());
        assertThat(second.overall()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(first.overall());
    }

    @Test
    void score_noConfirmations_everyoneKeepsZero() {
        CredibilityOutcome outcome = scorer.score(new CredibilityInput(
                input.coverage(), input.flags(), Map.of()));

        assertThat(outcome.entityScores()).allSatisfy(r -> assertThat(r.getScore()).isEqualTo(0.0));
        assertThat(overall(outcome, "P").getNormalizedWeight()).isCloseTo(0.5, within(1e-12));
    }

    private static OverallCredibilityRecord overall(CredibilityOutcome outcome, String providerId) {
        return outcome.overall().stream()
                .filter(r -> r.getProviderId().equals(providerId))
                .findFirst()
                .orElseThrow();
    }
}
