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
import java.util.TreeSet;

/**
 * Penalty model. Every (provider, entity) in a provider's coverage starts at 0;
 * each confirmed anomaly on the entity that the provider did not flag costs one
 * point. Scores are therefore never positive, and a provider that flags every
 * confirmed event keeps 0.
 */
@Component
public class PenaltyCredibilityScorer implements CredibilityScorer {

    @Override
    public ScoringModel getModel() {
        return ScoringModel.PENALTY;
    }

    @Override
    public CredibilityOutcome score(CredibilityInput input) {
        // provider -> entity -> penalty
        Map<String, Map<String, Double>> penalties = new TreeMap<>();
        for (Map.Entry<String, Set<String>> e : input.coverage().entrySet()) {
            Map<String, Double> perEntity = new TreeMap<>();
            for (String entity : e.getValue()) perEntity.put(entity, 0.0);
            penalties.put(e.getKey(), perEntity);
        }

        for (EntityYear confirmed : input.confirmed().keySet()) {
            for (Map.Entry<String, Map<String, Double>> provider : penalties.entrySet()) {
                Map<String, Double> perEntity = provider.getValue();
                if (!perEntity.containsKey(confirmed.entityId())) continue;
                if (!input.flagged(provider.getKey(), confirmed)) {
                    perEntity.merge(confirmed.entityId(), -1.0, Double::sum);
                }
            }
        }

        // entity -> provider -> penalty, for per-entity softmax
        Map<String, Map<String, Double>> byEntity = new TreeMap<>();
        penalties.forEach((provider, perEntity) -> perEntity.forEach((entity, score) ->
                byEntity.computeIfAbsent(entity, k -> new TreeMap<>()).put(provider, score)));
        Map<String, Map<String, Double>> weights = new HashMap<>();
        byEntity.forEach((entity, scores) -> weights.put(entity, SoftmaxNormalizer.normalize(scores)));

        List<CredibilityRecord> entityScores = new ArrayList<>();
        Map<String, Double> meanScores = new TreeMap<>();
        Map<String, OverallCredibilityRecord> overall = new TreeMap<>();
        for (Map.Entry<String, Map<String, Double>> provider : penalties.entrySet()) {
            String providerId = provider.getKey();
            double total = 0.0;
            int anomalies = 0;
            for (Map.Entry<String, Double> entity : provider.getValue().entrySet()) {
                int flaggedHere = flaggedCount(input, providerId, entity.getKey());
                anomalies += flaggedHere;
                total += entity.getValue();
                entityScores.add(CredibilityRecord.builder()
                        .providerId(providerId)
                        .entityId(entity.getKey())
                        .model(ScoringModel.PENALTY)
                        .score(entity.getValue())
                        .weight(weights.get(entity.getKey()).get(providerId))
                        .anomalyCount(flaggedHere)
                        .build());
            }
            int entityCount = provider.getValue().size();
            meanScores.put(providerId, entityCount == 0 ? 0.0 : total / entityCount);
            overall.put(providerId, OverallCredibilityRecord.builder()
                    .providerId(providerId)
                    .model(ScoringModel.PENALTY)
                    .score(total)
                    .entityCount(entityCount)
                    .anomalyCount(anomalies)
                    .build());
        }

        Map<String, Double> normalized = SoftmaxNormalizer.normalize(meanScores);
        overall.forEach((providerId, record) -> record.setNormalizedWeight(normalized.get(providerId)));
        return new CredibilityOutcome(entityScores, new ArrayList<>(overall.values()));
    }

    private static int flaggedCount(CredibilityInput input, String providerId, String entityId) {
        Set<EntityYear> flags = input.flags().get(providerId);
        if (flags == null) return 0;
        Set<Integer> years = new TreeSet<>();
        for (EntityYear ey : flags) {
            if (ey.entityId().equals(entityId)) years.add(ey.year());
        }
        return years.size();
    }
}
