package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.model.MultivariateOutlierRecord;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class MultivariateOutlierRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final UnitWriter writer;

    public MultivariateOutlierRepository(AerospikeClient client,
                                         @Qualifier("aerospikeNamespace") String namespace,
                                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                         @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writer = new UnitWriter(client, writePolicy, readPolicy);
    }

    /** The whole multivariate batch of a run is one unit. */
    @Retry(name = "seriesStore")
    public void saveBatch(String unit, List<MultivariateOutlierRecord> records) {
        List<UnitWriter.PendingWrite> writes = new ArrayList<>(records.size());
        for (MultivariateOutlierRecord r : records) {
            Key key = new Key(namespace, AerospikeConfig.SET_MV_OUTLIERS,
                    r.getRunId() + "|" + r.getEntityId() + "|" + r.getYear());
            writes.add(new UnitWriter.PendingWrite(key, new Bin[]{
                    new Bin("runId", r.getRunId()),
                    new Bin("entityId", r.getEntityId()),
                    new Bin("year", r.getYear()),
                    new Bin("squaredDist", r.getSquaredDistance()),
                    new Bin("distance", r.getDistance()),
                    new Bin("pValue", r.getChiSquarePValue()),
                    new Bin("flagged", r.isFlagged()),
                    new Bin("featureCount", r.getFeatureCount()),
                    new Bin("createdAt", r.getCreatedAt())
            }));
        }
        writer.insert(unit, writes);
    }

    @Retry(name = "seriesStore")
    public List<MultivariateOutlierRecord> findByRunId(String runId, boolean flaggedOnly) {
        List<MultivariateOutlierRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MV_OUTLIERS,
                (key, record) -> {
                    if (!runId.equals(record.getString("runId"))) return;
                    if (flaggedOnly && !record.getBoolean("flagged")) return;
                    MultivariateOutlierRecord mapped = mapRecord(record);
                    synchronized (results) {
                        results.add(mapped);
                    }
                });

        results.sort(Comparator.comparingDouble(MultivariateOutlierRecord::getSquaredDistance).reversed());
        return results;
    }

    private MultivariateOutlierRecord mapRecord(Record record) {
        return MultivariateOutlierRecord.builder()
                .runId(record.getString("runId"))
                .entityId(record.getString("entityId"))
                .year(record.getInt("year"))
                .squaredDistance(record.getDouble("squaredDist"))
                .distance(record.getDouble("distance"))
                .chiSquarePValue(record.getDouble("pValue"))
                .flagged(record.getBoolean("flagged"))
                .featureCount(record.getInt("featureCount"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
