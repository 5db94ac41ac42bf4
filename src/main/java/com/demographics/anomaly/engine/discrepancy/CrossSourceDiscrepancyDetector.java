package com.demographics.anomaly.engine.discrepancy;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.engine.stats.Statistics;
import com.demographics.anomaly.model.DiscrepancyRecord;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares the value each provider reports for the same (entity, indicator, year).
 * Only aggregate series take part; sex and age-group breakdowns are not compared.
 *
 * max discrepancy = (max - min) / min, 0 when min <= 0
 * coefficient of variation = sample std / mean, 0 when mean <= 0
 */
@Component
public class CrossSourceDiscrepancyDetector {

    private final DetectionConfig config;

    public CrossSourceDiscrepancyDetector(DetectionConfig config) {
        this.config = config;
    }

    /**
     * @param indicator the indicator all series belong to
     * @param series    assembled series for that indicator, any provider
     * @return one record per slice reported by enough providers, flagged or not
     */
    public List<DiscrepancyRecord> detect(Indicator indicator, List<Series> series) {
        // entity -> year -> provider -> value
        Map<String, Map<Integer, Map<String, Double>>> slices = new TreeMap<>();
        for (Series s : series) {
            if (s.key().sex() != null || s.key().ageGroup() != null) continue;
            for (SeriesPoint point : s.points()) {
                slices.computeIfAbsent(s.key().entityId(), e -> new TreeMap<>())
                        .computeIfAbsent(point.year(), y -> new TreeMap<>())
                        .put(s.key().providerId(), point.value());
            }
        }

        int minProviders = Math.max(2, config.getDiscrepancy().getMinProviders());
        List<DiscrepancyRecord> records = new ArrayList<>();
        for (Map.Entry<String, Map<Integer, Map<String, Double>>> entity : slices.entrySet()) {
            for (Map.Entry<Integer, Map<String, Double>> year : entity.getValue().entrySet()) {
                Map<String, Double> byProvider = year.getValue();
                if (byProvider.size() < minProviders) continue;
                records.add(compare(entity.getKey(), indicator, year.getKey(), byProvider));
            }
        }
        return records;
    }

    DiscrepancyRecord compare(String entityId, Indicator indicator, int year, Map<String, Double> byProvider) {
        double[] values = byProvider.values().stream().mapToDouble(Double::doubleValue).toArray();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = Statistics.mean(values);
        double cv = mean > 0 ? Statistics.sampleStd(values) / mean : 0.0;
        double maxDiscrepancy = min > 0 ? (max - min) / min : 0.0;

        return DiscrepancyRecord.builder()
                .entityId(entityId)
                .indicator(indicator)
                .year(year)
                .minValue(min)
                .maxValue(max)
                .meanValue(mean)
                .coefficientOfVariation(cv)
                .maxDiscrepancy(maxDiscrepancy)
                .providerCount(values.length)
                .providerIds(new ArrayList<>(byProvider.keySet()))
                .flagged(maxDiscrepancy > config.getDiscrepancy().getThreshold())
                .build();
    }
}
