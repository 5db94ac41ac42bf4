package com.demographics.anomaly.engine.credibility;

import com.demographics.anomaly.model.CredibilityRecord;
import com.demographics.anomaly.model.OverallCredibilityRecord;
import com.demographics.anomaly.model.ScoringModel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Confidence-average model. Per (provider, entity) the score is the mean
 * explanation confidence of the flagged anomalies that were confirmed, 0 when
 * none was. The overall score averages over every flagged anomaly of the
 * provider, an unconfirmed flag counting as 0. Only providers that flagged
 * something are scored.
 */
@Component
public class ConfidenceAverageCredibilityScorer implements CredibilityScorer {

    @Override
    public ScoringModel getModel() {
        return ScoringModel.CONFIDENCE_AVERAGE;
    }

    @Override
    public CredibilityOutcome score(CredibilityInput input) {
        // provider -> entity -> [confidence sum, matched count, flagged count]
        Map<String, Map<String, double[]>> tallies = new TreeMap<>();
        for (Map.Entry<String, Set<EntityYear>> provider : input.flags().entrySet()) {
            for (EntityYear flagged : provider.getValue()) {
                double[] tally = tallies.computeIfAbsent(provider.getKey(), k -> new TreeMap<>())
                        .computeIfAbsent(flagged.entityId(), k -> new double[3]);
                tally[2]++;
                Integer confidence = input.confirmed().get(flagged);
                if (confidence != null) {
                    tally[0] += confidence;
                    tally[1]++;
                }
            }
        }

        Map<String, Map<String, Double>> byEntity = new TreeMap<>();
        tallies.forEach((provider, perEntity) -> perEntity.forEach((entity, tally) ->
                byEntity.computeIfAbsent(entity, k -> new TreeMap<>()).put(provider, average(tally[0], tally[1]))));
        Map<String, Map<String, Double>> weights = new HashMap<>();
        byEntity.forEach((entity, scores) -> weights.put(entity, SoftmaxNormalizer.normalize(scores)));

        List<CredibilityRecord> entityScores = new ArrayList<>();
        Map<String, Double> overallScores = new TreeMap<>();
        Map<String, OverallCredibilityRecord> overall = new TreeMap<>();
        for (Map.Entry<String, Map<String, double[]>> provider : tallies.entrySet()) {
            String providerId = provider.getKey();
            double confidenceSum = 0.0;
            int flagged = 0;
            for (Map.Entry<String, double[]> entity : provider.getValue().entrySet()) {
                double[] tally = entity.getValue();
                confidenceSum += tally[0];
                flagged += (int) tally[2];
                entityScores.add(CredibilityRecord.builder()
                        .providerId(providerId)
                        .entityId(entity.getKey())
                        .model(ScoringModel.CONFIDENCE_AVERAGE)
                        .score(average(tally[0], tally[1]))
                        .weight(weights.get(entity.getKey()).get(providerId))
                        .anomalyCount((int) tally[2])
                        .build());
            }
            double score = average(confidenceSum, flagged);
            overallScores.put(providerId, score);
            overall.put(providerId, OverallCredibilityRecord.builder()
                    .providerId(providerId)
                    .model(ScoringModel.CONFIDENCE_AVERAGE)
                    .score(score)
                    .entityCount(provider.getValue().size())
                    .anomalyCount(flagged)
                    .build());
        }

        Map<String, Double> normalized = SoftmaxNormalizer.normalize(overallScores);
        overall.forEach((providerId, record) -> record.setNormalizedWeight(normalized.get(providerId)));
        return new CredibilityOutcome(entityScores, new ArrayList<>(overall.values()));
    }

    private static double average(double sum, double count) {
        return count > 0 ? sum / count : 0.0;
    }
}
