package com.demographics.anomaly.engine.credibility;

import java.util.LinkedHashMap;
import java.util.Map;

public final class SoftmaxNormalizer {

    private SoftmaxNormalizer() {}

    /**
     * Softmax over the map values, shifted by the maximum for stability.
     * Preserves iteration order; an empty map yields an empty map.
     */
    public static <K> Map<K, Double> normalize(Map<K, Double> scores) {
        Map<K, Double> weights = new LinkedHashMap<>();
        if (scores.isEmpty()) return weights;

        double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double total = 0.0;
        for (Map.Entry<K, Double> e : scores.entrySet()) {
            double w = Math.exp(e.getValue() - max);
            weights.put(e.getKey(), w);
            total += w;
        }
        for (Map.Entry<K, Double> e : weights.entrySet()) {
            e.setValue(e.getValue() / total);
        }
        return weights;
    }
}
