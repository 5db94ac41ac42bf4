package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Observation;
import com.demographics.anomaly.model.Sex;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Observations are written by the fetchers; this side only reads them back.
 */
@Repository
public class ObservationRepository {

    private final AerospikeClient client;
    private final String namespace;

    public ObservationRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    /**
     * All observations of one indicator inside the year range, minus excluded
     * entities and providers. Order is unspecified.
     */
    @Retry(name = "seriesStore")
    public List<Observation> findByIndicator(Indicator indicator, int yearFrom, int yearTo,
                                             Collection<String> excludedEntities,
                                             Collection<String> excludedProviders) {
        List<Observation> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_OBSERVATIONS,
                (key, record) -> {
                    if (!indicator.name().equals(record.getString("indicator"))) return;
                    int year = record.getInt("year");
                    if (year < yearFrom || year > yearTo) return;
                    String entityId = record.getString("entityId");
                    String providerId = record.getString("providerId");
                    if (excludedEntities.contains(entityId) || excludedProviders.contains(providerId)) return;
                    Observation obs = mapRecord(record);
                    synchronized (results) {
                        results.add(obs);
                    }
                });
        return results;
    }

    /**
     * Entities each provider reports the given indicator for, in any year.
     */
    @Retry(name = "seriesStore")
    public Map<String, Set<String>> findCoverage(Indicator indicator) {
        Map<String, Set<String>> coverage = new TreeMap<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_OBSERVATIONS,
                (key, record) -> {
                    if (!indicator.name().equals(record.getString("indicator"))) return;
                    if (record.getValue("value") == null) return;
                    String providerId = record.getString("providerId");
                    String entityId = record.getString("entityId");
                    synchronized (coverage) {
                        coverage.computeIfAbsent(providerId, p -> new TreeSet<>()).add(entityId);
                    }
                },
                "indicator", "value", "providerId", "entityId");
        return coverage;
    }

    private Observation mapRecord(Record record) {
        Object value = record.getValue("value");
        return Observation.builder()
                .entityId(record.getString("entityId"))
                .providerId(record.getString("providerId"))
                .indicator(Indicator.valueOf(record.getString("indicator")))
                .year(record.getInt("year"))
                .value(value instanceof Number n ? n.doubleValue() : null)
                .sex(Sex.parse(record.getString("sex")))
                .ageGroup(record.getString("ageGroup"))
                .ingestedAt(record.getLong("ingestedAt"))
                .build();
    }
}
