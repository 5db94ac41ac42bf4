package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.model.DiscrepancyRecord;
import com.demographics.anomaly.model.Indicator;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

@Repository
public class DiscrepancyRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final UnitWriter writer;

    public DiscrepancyRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writer = new UnitWriter(client, writePolicy, readPolicy);
    }

    /** One indicator's comparisons for a run form one unit. */
    @Retry(name = "seriesStore")
    public void saveBatch(String unit, List<DiscrepancyRecord> records) {
        List<UnitWriter.PendingWrite> writes = new ArrayList<>(records.size());
        for (DiscrepancyRecord r : records) {
            Key key = new Key(namespace, AerospikeConfig.SET_DISCREPANCIES,
                    r.getRunId() + "|" + r.getEntityId() + "|" + r.getIndicator() + "|" + r.getYear());
            writes.add(new UnitWriter.PendingWrite(key, new Bin[]{
                    new Bin("runId", r.getRunId()),
                    new Bin("entityId", r.getEntityId()),
                    new Bin("indicator", r.getIndicator().name()),
                    new Bin("year", r.getYear()),
                    new Bin("minValue", r.getMinValue()),
                    new Bin("maxValue", r.getMaxValue()),
                    new Bin("meanValue", r.getMeanValue()),
                    new Bin("cv", r.getCoefficientOfVariation()),
                    new Bin("maxDiscrepancy", r.getMaxDiscrepancy()),
                    new Bin("providerCount", r.getProviderCount()),
                    new Bin("providerIds", String.join(",", r.getProviderIds())),
                    new Bin("flagged", r.isFlagged()),
                    new Bin("createdAt", r.getCreatedAt())
            }));
        }
        writer.insert(unit, writes);
    }

    /**
     * @param indicator null for every indicator
     */
    @Retry(name = "seriesStore")
    public List<DiscrepancyRecord> findByRunId(String runId, Indicator indicator, boolean flaggedOnly) {
        List<DiscrepancyRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DISCREPANCIES,
                (key, record) -> {
                    if (!runId.equals(record.getString("runId"))) return;
                    if (indicator != null && !indicator.name().equals(record.getString("indicator"))) return;
                    if (flaggedOnly && !record.getBoolean("flagged")) return;
                    DiscrepancyRecord mapped = mapRecord(record);
                    synchronized (results) {
                        results.add(mapped);
                    }
                });

        results.sort(Comparator.comparingDouble(DiscrepancyRecord::getMaxDiscrepancy).reversed());
        return results;
    }

    private DiscrepancyRecord mapRecord(Record record) {
        String providers = record.getString("providerIds");
        return DiscrepancyRecord.builder()
                .runId(record.getString("runId"))
                .entityId(record.getString("entityId"))
                .indicator(Indicator.valueOf(record.getString("indicator")))
                .year(record.getInt("year"))
                .minValue(record.getDouble("minValue"))
                .maxValue(record.getDouble("maxValue"))
                .meanValue(record.getDouble("meanValue"))
                .coefficientOfVariation(record.getDouble("cv"))
                .maxDiscrepancy(record.getDouble("maxDiscrepancy"))
                .providerCount(record.getInt("providerCount"))
                .providerIds(providers == null || providers.isEmpty()
                        ? new ArrayList<>() : new ArrayList<>(Arrays.asList(providers.split(","))))
                .flagged(record.getBoolean("flagged"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
