package com.demographics.anomaly.engine;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.engine.stats.Statistics;
import com.demographics.anomaly.model.Observation;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesKey;
import com.demographics.anomaly.model.SeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups raw observations into year-ordered series keyed by
 * (entity, provider, indicator, sex, age group).
 *
 * Absent, non-finite and sentinel values are dropped. When the same key and year
 * appear more than once the most recently ingested observation wins.
 */
@Component
public class SeriesAssembler {

    private static final Logger log = LoggerFactory.getLogger(SeriesAssembler.class);

    private final DetectionConfig config;

    public SeriesAssembler(DetectionConfig config) {
        this.config = config;
    }

    public List<Series> assemble(List<Observation> observations) {
        Map<SeriesKey, TreeMap<Integer, Observation>> grouped = new LinkedHashMap<>();
        int dropped = 0;
        int duplicates = 0;

        for (Observation obs : observations) {
            if (!isUsable(obs.getValue())) {
                dropped++;
                continue;
            }
            TreeMap<Integer, Observation> byYear = grouped.computeIfAbsent(SeriesKey.of(obs), k -> new TreeMap<>());
            Observation existing = byYear.get(obs.getYear());
            if (existing != null) {
                duplicates++;
                if (existing.getIngestedAt() > obs.getIngestedAt()) continue;
            }
            byYear.put(obs.getYear(), obs);
        }

        List<Series> series = new ArrayList<>(grouped.size());
        for (Map.Entry<SeriesKey, TreeMap<Integer, Observation>> entry : grouped.entrySet()) {
            List<SeriesPoint> points = new ArrayList<>(entry.getValue().size());
            for (Observation obs : entry.getValue().values()) {
                points.add(new SeriesPoint(obs.getYear(), obs.getValue()));
            }
            series.add(new Series(entry.getKey(), points));
        }
        series.sort(Comparator.comparing(s -> s.key().asText()));

        if (dropped > 0 || duplicates > 0) {
            log.debug("Assembled {} series from {} observations ({} unusable values, {} duplicates)",
                    series.size(), observations.size(), dropped, duplicates);
        }
        return series;
    }

    boolean isUsable(Double value) {
        if (value == null || !Statistics.isFinite(value)) return false;
        for (Double sentinel : config.getPipeline().getSentinelValues()) {
            if (sentinel != null && sentinel.doubleValue() == value.doubleValue()) return false;
        }
        return true;
    }
}
