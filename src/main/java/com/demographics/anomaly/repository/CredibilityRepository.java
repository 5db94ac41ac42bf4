package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.model.CredibilityRecord;
import com.demographics.anomaly.model.OverallCredibilityRecord;
import com.demographics.anomaly.model.ScoringModel;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Credibility rows are upserted: (provider, entity) in one set, provider in the
 * other. Each scoring pass replaces a provider's rows wholesale, so entities the
 * provider no longer has a score for are deleted with the same unit. Re-scoring
 * with the same inputs leaves the stored state unchanged.
 */
@Repository
public class CredibilityRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final UnitWriter writer;

    public CredibilityRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writer = new UnitWriter(client, writePolicy, readPolicy);
    }

    /**
     * Upsert one provider's per-entity rows together with its overall row, and
     * delete the provider's entity rows that are not among {@code entityRows}.
     */
    @Retry(name = "seriesStore")
    public void upsertProvider(OverallCredibilityRecord overall, List<CredibilityRecord> entityRows) {
        String providerId = overall.getProviderId();
        List<UnitWriter.PendingWrite> writes = new ArrayList<>(entityRows.size() + 1);
        Set<String> current = new HashSet<>();
        for (CredibilityRecord r : entityRows) {
            current.add(r.getEntityId());
            writes.add(new UnitWriter.PendingWrite(entityKey(r.getProviderId(), r.getEntityId()), new Bin[]{
                    new Bin("providerId", r.getProviderId()),
                    new Bin("entityId", r.getEntityId()),
                    new Bin("model", r.getModel().name()),
                    new Bin("score", r.getScore()),
                    new Bin("weight", r.getWeight()),
                    new Bin("anomalyCount", r.getAnomalyCount()),
                    new Bin("computedAt", r.getComputedAt())
            }));
        }
        writes.add(new UnitWriter.PendingWrite(overallKey(providerId), new Bin[]{
                new Bin("providerId", overall.getProviderId()),
                new Bin("model", overall.getModel().name()),
                new Bin("score", overall.getScore()),
                new Bin("normWeight", overall.getNormalizedWeight()),
                new Bin("entityCount", overall.getEntityCount()),
                new Bin("anomalyCount", overall.getAnomalyCount()),
                new Bin("computedAt", overall.getComputedAt())
        }));

        List<Key> stale = new ArrayList<>();
        for (String entityId : storedEntityIds(providerId)) {
            if (!current.contains(entityId)) stale.add(entityKey(providerId, entityId));
        }
        writer.replace("credibility:" + providerId, writes, stale);
    }

    /**
     * Delete every row of a provider the latest scoring pass no longer scores.
     */
    @Retry(name = "seriesStore")
    public void removeProvider(String providerId) {
        List<Key> keys = new ArrayList<>();
        for (String entityId : storedEntityIds(providerId)) {
            keys.add(entityKey(providerId, entityId));
        }
        keys.add(overallKey(providerId));
        writer.replace("credibility:" + providerId, List.of(), keys);
    }

    @Retry(name = "seriesStore")
    public OverallCredibilityRecord findOverall(String providerId) {
        Record record = client.get(readPolicy, overallKey(providerId));
        if (record == null) return null;
        return mapOverall(record);
    }

    @Retry(name = "seriesStore")
    public List<OverallCredibilityRecord> findAllOverall() {
        List<OverallCredibilityRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PROVIDER_CRED,
                (key, record) -> {
                    OverallCredibilityRecord mapped = mapOverall(record);
                    synchronized (results) {
                        results.add(mapped);
                    }
                });

        results.sort(Comparator.comparingDouble(OverallCredibilityRecord::getNormalizedWeight).reversed());
        return results;
    }

    @Retry(name = "seriesStore")
    public List<CredibilityRecord> findByProvider(String providerId) {
        List<CredibilityRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PROVIDER_ENTITY_CRED,
                (key, record) -> {
                    if (!providerId.equals(record.getString("providerId"))) return;
                    CredibilityRecord mapped = CredibilityRecord.builder()
                            .providerId(providerId)
                            .entityId(record.getString("entityId"))
                            .model(ScoringModel.valueOf(record.getString("model")))
                            .score(record.getDouble("score"))
                            .weight(record.getDouble("weight"))
                            .anomalyCount(record.getInt("anomalyCount"))
                            .computedAt(record.getLong("computedAt"))
                            .build();
                    synchronized (results) {
                        results.add(mapped);
                    }
                });

        results.sort(Comparator.comparing(CredibilityRecord::getEntityId));
        return results;
    }

    private List<String> storedEntityIds(String providerId) {
        List<String> entityIds = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PROVIDER_ENTITY_CRED,
                (key, record) -> {
                    if (!providerId.equals(record.getString("providerId"))) return;
                    String entityId = record.getString("entityId");
                    synchronized (entityIds) {
                        entityIds.add(entityId);
                    }
                },
                "providerId", "entityId");
        return entityIds;
    }

    private Key entityKey(String providerId, String entityId) {
        return new Key(namespace, AerospikeConfig.SET_PROVIDER_ENTITY_CRED, providerId + "|" + entityId);
    }

    private Key overallKey(String providerId) {
        return new Key(namespace, AerospikeConfig.SET_PROVIDER_CRED, providerId);
    }

    private OverallCredibilityRecord mapOverall(Record record) {
        return OverallCredibilityRecord.builder()
                .providerId(record.getString("providerId"))
                .model(ScoringModel.valueOf(record.getString("model")))
                .score(record.getDouble("score"))
                .normalizedWeight(record.getDouble("normWeight"))
                .entityCount(record.getInt("entityCount"))
                .anomalyCount(record.getInt("anomalyCount"))
                .computedAt(record.getLong("computedAt"))
                .build();
    }
}
