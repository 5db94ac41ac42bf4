package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.exception.PersistenceException;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.AnomalyRecord;
import com.demographics.anomaly.model.Direction;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Sex;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class AnomalyRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final UnitWriter writer;
    private final ObjectMapper objectMapper;

    public AnomalyRecordRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writer = new UnitWriter(client, writePolicy, readPolicy);
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Insert all records of one series as a single unit.
     *
     * @throws PersistenceException if a record lacks the diagnostics behind its flags,
     *                              or the store rejects a write (after rollback)
     */
    @Retry(name = "seriesStore")
    public void saveUnit(String unit, List<AnomalyRecord> records) {
        for (AnomalyRecord record : records) {
            if (!record.hasSupportingDiagnostics()) {
                throw new PersistenceException(unit, "record for year " + record.getYear()
                        + " is flagged by " + record.getMethods() + " without its diagnostics", null);
            }
        }

        List<UnitWriter.PendingWrite> writes = new ArrayList<>(records.size());
        for (AnomalyRecord record : records) {
            Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_RECORDS, keyOf(record));
            writes.add(new UnitWriter.PendingWrite(key, new Bin[]{
                    new Bin("runId", record.getRunId()),
                    new Bin("entityId", record.getEntityId()),
                    new Bin("providerId", record.getProviderId()),
                    new Bin("indicator", record.getIndicator().name()),
                    record.getSex() == null ? Bin.asNull("sex") : new Bin("sex", record.getSex().name()),
                    record.getAgeGroup() == null ? Bin.asNull("ageGroup") : new Bin("ageGroup", record.getAgeGroup()),
                    new Bin("year", record.getYear()),
                    new Bin("value", record.getValue()),
                    new Bin("methods", record.getMethods().stream().map(Enum::name).sorted()
                            .collect(Collectors.joining(","))),
                    new Bin("diag", serializeDiagnostics(record)),
                    record.getDirection() == null ? Bin.asNull("direction")
                            : new Bin("direction", record.getDirection().name()),
                    new Bin("category", record.getCategory()),
                    new Bin("description", record.getDescription()),
                    new Bin("createdAt", record.getCreatedAt())
            }));
        }
        writer.insert(unit, writes);
    }

    @Retry(name = "seriesStore")
    public List<AnomalyRecord> findByRunId(String runId) {
        List<AnomalyRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_RECORDS,
                (key, record) -> {
                    if (runId.equals(record.getString("runId"))) {
                        AnomalyRecord mapped = mapRecord(record);
                        synchronized (results) {
                            results.add(mapped);
                        }
                    }
                });

        results.sort(Comparator.comparing((AnomalyRecord r) -> r.seriesKey().asText())
                .thenComparingInt(AnomalyRecord::getYear));
        return results;
    }

    private AnomalyRecord mapRecord(Record record) {
        Map<String, Double> diag = deserializeDiagnostics(record.getString("diag"));
        String direction = record.getString("direction");
        return AnomalyRecord.builder()
                .runId(record.getString("runId"))
                .entityId(record.getString("entityId"))
                .providerId(record.getString("providerId"))
                .indicator(Indicator.valueOf(record.getString("indicator")))
                .sex(Sex.parse(record.getString("sex")))
                .ageGroup(record.getString("ageGroup"))
                .year(record.getInt("year"))
                .value(record.getDouble("value"))
                .methods(parseMethods(record.getString("methods")))
                .valueZScore(diag.get("z"))
                .yoyChange(diag.get("yoy"))
                .globalZScore(diag.get("globalZ"))
                .rollingZScore(diag.get("rollingZ"))
                .secondDerivative(diag.get("secondDeriv"))
                .direction(direction == null ? null : Direction.valueOf(direction))
                .category(record.getString("category"))
                .description(record.getString("description"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    static String keyOf(AnomalyRecord record) {
        return record.getRunId() + "|" + record.seriesKey().asText() + "|" + record.getYear();
    }

    private static Set<AnomalyMethod> parseMethods(String joined) {
        Set<AnomalyMethod> methods = EnumSet.noneOf(AnomalyMethod.class);
        if (joined == null || joined.isEmpty()) return methods;
        for (String name : joined.split(",")) {
            methods.add(AnomalyMethod.valueOf(name));
        }
        return methods;
    }

    private String serializeDiagnostics(AnomalyRecord record) {
        Map<String, Double> diag = new HashMap<>();
        diag.put("z", record.getValueZScore());
        diag.put("yoy", record.getYoyChange());
        diag.put("globalZ", record.getGlobalZScore());
        diag.put("rollingZ", record.getRollingZScore());
        diag.put("secondDeriv", record.getSecondDerivative());
        try {
            return objectMapper.writeValueAsString(diag);
        } catch (JsonProcessingException e) {
            throw new PersistenceException(keyOf(record), "diagnostics could not be encoded", e);
        }
    }

    private Map<String, Double> deserializeDiagnostics(String json) {
        if (json == null || json.isEmpty()) return Map.of();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Double>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize anomaly diagnostics", e);
            return Map.of();
        }
    }
}
