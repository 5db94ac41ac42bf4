package com.demographics.anomaly.service;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.config.MetricsConfig;
import com.demographics.anomaly.engine.DetectionEngine;
import com.demographics.anomaly.engine.SeriesAnalysis;
import com.demographics.anomaly.engine.SeriesAssembler;
import com.demographics.anomaly.engine.discrepancy.CrossSourceDiscrepancyDetector;
import com.demographics.anomaly.engine.multivariate.FeatureEngineer;
import com.demographics.anomaly.engine.multivariate.FeatureTable;
import com.demographics.anomaly.engine.multivariate.MultivariateOutlierDetector;
import com.demographics.anomaly.exception.FittingException;
import com.demographics.anomaly.exception.PersistenceException;
import com.demographics.anomaly.model.AnalysisRequest;
import com.demographics.anomaly.model.AnalysisRun;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.AnomalyRecord;
import com.demographics.anomaly.model.DiscrepancyRecord;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.MultivariateOutlierRecord;
import com.demographics.anomaly.model.RunReport;
import com.demographics.anomaly.model.RunStatus;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.repository.AnalysisRunRepository;
import com.demographics.anomaly.repository.AnomalyRecordRepository;
import com.demographics.anomaly.repository.DiscrepancyRepository;
import com.demographics.anomaly.repository.MultivariateOutlierRepository;
import com.demographics.anomaly.repository.ObservationRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one batch analysis end to end: fetch, assemble, detect, persist, report.
 *
 * Detection may fan out over a worker pool; every write happens on the calling
 * thread, one logical unit at a time. A unit that fails to persist is rolled back
 * by its repository and listed in the run report; the run carries on.
 */
@Service
public class AnalysisPipelineService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisPipelineService.class);

    private final ObservationRepository observationRepository;
    private final SeriesAssembler seriesAssembler;
    private final DetectionEngine detectionEngine;
    private final CrossSourceDiscrepancyDetector discrepancyDetector;
    private final FeatureEngineer featureEngineer;
    private final MultivariateOutlierDetector multivariateDetector;
    private final AnomalyRecordRepository anomalyRecordRepository;
    private final DiscrepancyRepository discrepancyRepository;
    private final MultivariateOutlierRepository multivariateRepository;
    private final AnalysisRunRepository runRepository;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public AnalysisPipelineService(ObservationRepository observationRepository,
                                   SeriesAssembler seriesAssembler,
                                   DetectionEngine detectionEngine,
                                   CrossSourceDiscrepancyDetector discrepancyDetector,
                                   FeatureEngineer featureEngineer,
                                   MultivariateOutlierDetector multivariateDetector,
                                   AnomalyRecordRepository anomalyRecordRepository,
                                   DiscrepancyRepository discrepancyRepository,
                                   MultivariateOutlierRepository multivariateRepository,
                                   AnalysisRunRepository runRepository,
                                   DetectionConfig config,
                                   MetricsConfig metricsConfig) {
        this.observationRepository = observationRepository;
        this.seriesAssembler = seriesAssembler;
        this.detectionEngine = detectionEngine;
        this.discrepancyDetector = discrepancyDetector;
        this.featureEngineer = featureEngineer;
        this.multivariateDetector = multivariateDetector;
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.discrepancyRepository = discrepancyRepository;
        this.multivariateRepository = multivariateRepository;
        this.runRepository = runRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Execute an analysis run.
     *
     * @param request per-run overrides; null fields use the configured defaults
     * @return the run manifest, COMPLETED unless an unexpected error occurred
     * @throws IllegalArgumentException if the year range is empty
     */
    @Observed(name = "analysis.run", contextualName = "run-analysis")
    public AnalysisRun run(AnalysisRequest request) {
        DetectionConfig.Pipeline defaults = config.getPipeline();
        int yearFrom = request.getYearFrom() != null ? request.getYearFrom() : defaults.getYearFrom();
        int yearTo = request.getYearTo() != null ? request.getYearTo() : defaults.getYearTo();
        if (yearFrom > yearTo) {
            throw new IllegalArgumentException("yearFrom must not be after yearTo");
        }
        List<Indicator> indicators = request.getIndicators() != null && !request.getIndicators().isEmpty()
                ? request.getIndicators() : defaults.getIndicators();
        boolean multivariate = request.getIncludeMultivariate() != null
                ? request.getIncludeMultivariate()
                : defaults.isMultivariate() && config.getMultivariate().isEnabled();

        AnalysisRun run = AnalysisRun.builder()
                .runId(UUID.randomUUID().toString())
                .status(RunStatus.STARTED)
                .yearFrom(yearFrom)
                .yearTo(yearTo)
                .indicators(new ArrayList<>(indicators))
                .startedAt(System.currentTimeMillis())
                .build();
        runRepository.save(run);
        log.info("=== Analysis run {} started: years {}-{}, indicators {} ===",
                run.getRunId(), yearFrom, yearTo, indicators);

        RunReport report = RunReport.builder().build();
        run.setReport(report);
        try {
            Map<Indicator, List<Series>> seriesByIndicator = new EnumMap<>(Indicator.class);
            for (Indicator indicator : indicators) {
                List<Series> series = fetchSeries(indicator, yearFrom, yearTo);
                seriesByIndicator.put(indicator, series);
                detectSeries(run.getRunId(), series, report);
                detectDiscrepancies(run.getRunId(), indicator, series, report);
            }

            if (multivariate) {
                for (Indicator indicator : FeatureEngineer.REQUIRED_INDICATORS) {
                    if (!seriesByIndicator.containsKey(indicator)) {
                        seriesByIndicator.put(indicator, fetchSeries(indicator, yearFrom, yearTo));
                    }
                }
                detectMultivariate(run.getRunId(), seriesByIndicator, report);
            } else {
                report.setMultivariateSkipped(true);
            }

            run.setStatus(RunStatus.COMPLETED);
            run.setCompletedAt(System.currentTimeMillis());
            runRepository.save(run);
            metricsConfig.recordRun(RunStatus.COMPLETED.name());
            log.info("=== Analysis run {} completed: {} series, anomalies {}, {} persistence failures ===",
                    run.getRunId(), report.getSeriesAnalysed(), report.getAnomaliesByMethod(),
                    report.getPersistenceFailures().size());
            return run;
        } catch (RuntimeException e) {
            log.error("Analysis run {} failed", run.getRunId(), e);
            run.setStatus(RunStatus.FAILED);
            run.setCompletedAt(System.currentTimeMillis());
            run.setFailureReason(e.getMessage());
            runRepository.save(run);
            metricsConfig.recordRun(RunStatus.FAILED.name());
            throw e;
        }
    }

    private List<Series> fetchSeries(Indicator indicator, int yearFrom, int yearTo) {
        DetectionConfig.Pipeline defaults = config.getPipeline();
        List<Series> series = seriesAssembler.assemble(observationRepository.findByIndicator(
                indicator, yearFrom, yearTo, defaults.getExcludedEntities(), defaults.getExcludedProviders()));
        log.info("Indicator {}: {} series", indicator, series.size());
        return series;
    }

    private void detectSeries(String runId, List<Series> series, RunReport report) {
        for (SeriesAnalysis analysis : analyseAll(series)) {
            report.setSeriesAnalysed(report.getSeriesAnalysed() + 1);
            analysis.skippedDetectors().forEach(report::addSkipped);
            if (analysis.anomalies().isEmpty()) continue;

            long createdAt = System.currentTimeMillis();
            List<AnomalyRecord> records = analysis.anomalies();
            records.forEach(r -> {
                r.setRunId(runId);
                r.setCreatedAt(createdAt);
            });

            String unit = "anomalies:" + analysis.key().asText();
            try {
                anomalyRecordRepository.saveUnit(unit, records);
            } catch (PersistenceException e) {
                recordFailure(report, "anomalies", e);
                continue;
            }
            report.setAnomalyRecords(report.getAnomalyRecords() + records.size());
            for (AnomalyRecord record : records) {
                for (AnomalyMethod method : record.getMethods()) {
                    report.addAnomalies(method, 1);
                    metricsConfig.recordAnomalies(method.name(), 1);
                }
            }
        }
    }

    /**
     * Detection results in input order. With parallelism above one the series are
     * analysed on a short-lived pool owned by this call.
     */
    private List<SeriesAnalysis> analyseAll(List<Series> series) {
        int parallelism = Math.max(1, config.getPipeline().getParallelism());
        List<SeriesAnalysis> results = new ArrayList<>(series.size());
        if (parallelism == 1 || series.size() < 2) {
            for (Series s : series) results.add(detectionEngine.analyse(s));
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, series.size()));
        try {
            List<Future<SeriesAnalysis>> futures = new ArrayList<>(series.size());
            for (Series s : series) {
                futures.add(pool.submit(() -> detectionEngine.analyse(s)));
            }
            for (Future<SeriesAnalysis> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analysing series", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Series analysis failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private void detectDiscrepancies(String runId, Indicator indicator, List<Series> series, RunReport report) {
        List<DiscrepancyRecord> records = discrepancyDetector.detect(indicator, series);
        if (records.isEmpty()) return;

        long createdAt = System.currentTimeMillis();
        records.forEach(r -> {
            r.setRunId(runId);
            r.setCreatedAt(createdAt);
        });
        try {
            discrepancyRepository.saveBatch("discrepancies:" + indicator, records);
        } catch (PersistenceException e) {
            recordFailure(report, "discrepancies", e);
            return;
        }
        long flagged = records.stream().filter(DiscrepancyRecord::isFlagged).count();
        report.setDiscrepancySlices(report.getDiscrepancySlices() + records.size());
        report.addAnomalies(AnomalyMethod.DISCREPANCY, flagged);
        metricsConfig.recordAnomalies(AnomalyMethod.DISCREPANCY.name(), flagged);
        log.info("Indicator {}: {} provider comparisons, {} discrepancies", indicator, records.size(), flagged);
    }

    private void detectMultivariate(String runId, Map<Indicator, List<Series>> seriesByIndicator, RunReport report) {
        FeatureTable table = featureEngineer.build(seriesByIndicator);
        report.setMultivariateRowsDropped(table.droppedRows());

        List<MultivariateOutlierRecord> records;
        try {
            records = multivariateDetector.detect(table);
        } catch (FittingException e) {
            log.warn("Multivariate detection skipped for run {}: {}", runId, e.getMessage());
            report.setMultivariateSkipped(true);
            metricsConfig.recordSeriesSkipped("multivariate");
            return;
        }

        long createdAt = System.currentTimeMillis();
        records.forEach(r -> {
            r.setRunId(runId);
            r.setCreatedAt(createdAt);
        });
        try {
            multivariateRepository.saveBatch("multivariate:" + runId, records);
        } catch (PersistenceException e) {
            recordFailure(report, "multivariate", e);
            return;
        }
        long flagged = records.stream().filter(MultivariateOutlierRecord::isFlagged).count();
        report.setMultivariateRowsScored(records.size());
        report.addAnomalies(AnomalyMethod.MULTIVARIATE, flagged);
        metricsConfig.recordAnomalies(AnomalyMethod.MULTIVARIATE.name(), flagged);
    }

    private void recordFailure(RunReport report, String unitType, PersistenceException e) {
        log.error("Persistence failed for {}, unit rolled back", e.getUnit(), e);
        report.addPersistenceFailure(e.getUnit());
        metricsConfig.recordPersistenceFailure(unitType);
    }
}
