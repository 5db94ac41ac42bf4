package com.demographics.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.demographics.anomaly.config.AerospikeConfig;
import com.demographics.anomaly.model.AnalysisRun;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.RunReport;
import com.demographics.anomaly.model.RunStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Run manifests. A run is written as STARTED before any result and rewritten as
 * COMPLETED or FAILED at the end; readers only trust COMPLETED runs.
 */
@Repository
public class AnalysisRunRepository {

    private static final Logger log = LoggerFactory.getLogger(AnalysisRunRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnalysisRunRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Retry(name = "seriesStore")
    public void save(AnalysisRun run) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_RUNS, run.getRunId());
        client.put(writePolicy, key,
                new Bin("runId", run.getRunId()),
                new Bin("status", run.getStatus().name()),
                new Bin("yearFrom", run.getYearFrom()),
                new Bin("yearTo", run.getYearTo()),
                new Bin("indicators", run.getIndicators().stream().map(Enum::name).collect(Collectors.joining(","))),
                new Bin("startedAt", run.getStartedAt()),
                new Bin("completedAt", run.getCompletedAt()),
                new Bin("report", serializeReport(run.getReport())),
                run.getFailureReason() == null ? Bin.asNull("failureReason")
                        : new Bin("failureReason", run.getFailureReason()));
    }

    @Retry(name = "seriesStore")
    public AnalysisRun findById(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_RUNS, runId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    @Retry(name = "seriesStore")
    public List<AnalysisRun> findAll() {
        List<AnalysisRun> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANALYSIS_RUNS,
                (key, record) -> {
                    AnalysisRun run = mapRecord(record);
                    synchronized (results) {
                        results.add(run);
                    }
                });

        results.sort(Comparator.comparingLong(AnalysisRun::getStartedAt).reversed());
        return results;
    }

    /**
     * Most recently started run that reached COMPLETED, or null if there is none.
     */
    public AnalysisRun findLatestCompleted() {
        return findAll().stream()
                .filter(r -> r.getStatus() == RunStatus.COMPLETED)
                .findFirst()
                .orElse(null);
    }

    private AnalysisRun mapRecord(Record record) {
        String indicators = record.getString("indicators");
        return AnalysisRun.builder()
                .runId(record.getString("runId"))
                .status(RunStatus.valueOf(record.getString("status")))
                .yearFrom(record.getInt("yearFrom"))
                .yearTo(record.getInt("yearTo"))
                .indicators(indicators == null || indicators.isEmpty() ? new ArrayList<>()
                        : Arrays.stream(indicators.split(",")).map(Indicator::valueOf)
                                .collect(Collectors.toCollection(ArrayList::new)))
                .startedAt(record.getLong("startedAt"))
                .completedAt(record.getLong("completedAt"))
                .report(deserializeReport(record.getString("report")))
                .failureReason(record.getString("failureReason"))
                .build();
    }

    private String serializeReport(RunReport report) {
        if (report == null) return "";
        try {
            return objectMapper.writeValueAsString(report);
        } catch (Exception e) {
            log.error("Failed to serialize run report", e);
            return "";
        }
    }

    private RunReport deserializeReport(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, RunReport.class);
        } catch (Exception e) {
            log.error("Failed to deserialize run report", e);
            return null;
        }
    }
}
