package com.demographics.anomaly.service;

import com.demographics.anomaly.model.AnalysisRun;
import com.demographics.anomaly.model.AnomalyMethod;
import com.demographics.anomaly.model.AnomalyRecord;
import com.demographics.anomaly.model.DiscrepancyRecord;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.MultivariateOutlierRecord;
import com.demographics.anomaly.repository.AnalysisRunRepository;
import com.demographics.anomaly.repository.AnomalyRecordRepository;
import com.demographics.anomaly.repository.DiscrepancyRepository;
import com.demographics.anomaly.repository.MultivariateOutlierRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of analysis runs. Every lookup returns null for an unknown run id.
 */
@Service
public class AnalysisResultService {

    private final AnalysisRunRepository runRepository;
    private final AnomalyRecordRepository anomalyRecordRepository;
    private final MultivariateOutlierRepository multivariateRepository;
    private final DiscrepancyRepository discrepancyRepository;

    public AnalysisResultService(AnalysisRunRepository runRepository,
                                 AnomalyRecordRepository anomalyRecordRepository,
                                 MultivariateOutlierRepository multivariateRepository,
                                 DiscrepancyRepository discrepancyRepository) {
        this.runRepository = runRepository;
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.multivariateRepository = multivariateRepository;
        this.discrepancyRepository = discrepancyRepository;
    }

    public List<AnalysisRun> getRuns() {
        return runRepository.findAll();
    }

    public AnalysisRun getRun(String runId) {
        return runRepository.findById(runId);
    }

    public List<AnomalyRecord> getAnomalies(String runId, String entityId, String providerId,
                                            Indicator indicator, AnomalyMethod method) {
        if (runRepository.findById(runId) == null) return null;
        return anomalyRecordRepository.findByRunId(runId).stream()
                .filter(r -> entityId == null || entityId.equals(r.getEntityId()))
                .filter(r -> providerId == null || providerId.equals(r.getProviderId()))
                .filter(r -> indicator == null || indicator == r.getIndicator())
                .filter(r -> method == null || r.isFlaggedBy(method))
                .toList();
    }

    public List<MultivariateOutlierRecord> getMultivariate(String runId, boolean flaggedOnly) {
        if (runRepository.findById(runId) == null) return null;
        return multivariateRepository.findByRunId(runId, flaggedOnly);
    }

    public List<DiscrepancyRecord> getDiscrepancies(String runId, Indicator indicator, boolean flaggedOnly) {
        if (runRepository.findById(runId) == null) return null;
        return discrepancyRepository.findByRunId(runId, indicator, flaggedOnly);
    }
}
