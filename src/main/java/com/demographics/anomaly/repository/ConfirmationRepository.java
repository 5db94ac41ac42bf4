package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ScanPolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.model.AnomalyConfirmation;
import io.github.resilience4j.retry.annotation.Retry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Explanations of anomalies (entity, year, confidence 1-5) produced outside this
 * service. Read-only here.
 */
@Repository
public class ConfirmationRepository {

    private final AerospikeClient client;
    private final String namespace;

    public ConfirmationRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Retry(name = "seriesStore")
    public List<AnomalyConfirmation> findAll() {
        List<AnomalyConfirmation> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CONFIRMATIONS,
                (key, record) -> {
                    AnomalyConfirmation confirmation = AnomalyConfirmation.builder()
                            .entityId(record.getString("entityId"))
                            .year(record.getInt("year"))
                            .confidenceLevel(record.getInt("confidence"))
                            .explanation(record.getString("explanation"))
                            .build();
                    synchronized (results) {
                        results.add(confirmation);
                    }
                });
        return results;
    }
}
