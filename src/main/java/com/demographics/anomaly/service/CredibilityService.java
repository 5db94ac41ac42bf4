package com.demographics.anomaly.service;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.config.MetricsConfig;
import com.demographics.anomaly.engine.credibility.ConfirmationFilter;
import com.demographics.anomaly.engine.credibility.CredibilityInput;
import com.demographics.anomaly.engine.credibility.CredibilityOutcome;
import com.demographics.anomaly.engine.credibility.CredibilityScorer;
import com.demographics.anomaly.engine.credibility.EntityYear;
import com.demographics.anomaly.exception.PersistenceException;
import com.demographics.anomaly.model.AnalysisRun;
import com.demographics.anomaly.model.AnomalyConfirmation;
import com.demographics.anomaly.model.AnomalyRecord;
import com.demographics.anomaly.model.ConfirmationRule;
import com.demographics.anomaly.model.CredibilityRecord;
import com.demographics.anomaly.model.CredibilityRun;
import com.demographics.anomaly.model.OverallCredibilityRecord;
import com.demographics.anomaly.model.ScoringModel;
import com.demographics.anomaly.repository.AnalysisRunRepository;
import com.demographics.anomaly.repository.AnomalyRecordRepository;
import com.demographics.anomaly.repository.ConfirmationRepository;
import com.demographics.anomaly.repository.CredibilityRepository;
import com.demographics.anomaly.repository.ObservationRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Scores provider credibility from the latest COMPLETED analysis run, the
 * providers' coverage and the externally produced anomaly confirmations.
 */
@Service
public class CredibilityService {

    private static final Logger log = LoggerFactory.getLogger(CredibilityService.class);

    private final AnalysisRunRepository runRepository;
    private final AnomalyRecordRepository anomalyRecordRepository;
    private final ObservationRepository observationRepository;
    private final ConfirmationRepository confirmationRepository;
    private final CredibilityRepository credibilityRepository;
    private final Map<ScoringModel, CredibilityScorer> scorerMap;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public CredibilityService(AnalysisRunRepository runRepository,
                              AnomalyRecordRepository anomalyRecordRepository,
                              ObservationRepository observationRepository,
                              ConfirmationRepository confirmationRepository,
                              CredibilityRepository credibilityRepository,
                              List<CredibilityScorer> scorers,
                              DetectionConfig config,
                              MetricsConfig metricsConfig) {
        this.runRepository = runRepository;
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.observationRepository = observationRepository;
        this.confirmationRepository = confirmationRepository;
        this.credibilityRepository = credibilityRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.scorerMap = new EnumMap<>(ScoringModel.class);
        for (CredibilityScorer scorer : scorers) {
            scorerMap.put(scorer.getModel(), scorer);
            log.info("Registered credibility scorer: {} -> {}", scorer.getModel(), scorer.getClass().getSimpleName());
        }
    }

    /**
     * Score every provider and replace the stored results, one provider per unit.
     * Providers scored by an earlier pass but absent from this one are removed,
     * so the stored overall weights always come from a single pass.
     *
     * @param model null for the configured model
     * @param rule  null for the configured confirmation rule
     * @throws IllegalStateException if no analysis run has completed yet
     */
    @Observed(name = "credibility.score", contextualName = "score-credibility")
    public CredibilityRun score(ScoringModel model, ConfirmationRule rule) {
        DetectionConfig.Credibility params = config.getCredibility();
        ScoringModel effectiveModel = model != null ? model : params.getModel();
        ConfirmationRule effectiveRule = rule != null ? rule : params.getConfirmationRule();

        AnalysisRun run = runRepository.findLatestCompleted();
        if (run == null) {
            throw new IllegalStateException("No completed analysis run to score");
        }
        CredibilityScorer scorer = scorerMap.get(effectiveModel);
        if (scorer == null) {
            throw new IllegalStateException("No scorer registered for model " + effectiveModel);
        }

        CredibilityInput input = buildInput(run, effectiveRule);
        CredibilityOutcome outcome = scorer.score(input);
        log.info("Credibility {} over run {}: {} providers, {} confirmed anomalies, rule {}",
                effectiveModel, run.getRunId(), outcome.overall().size(), input.confirmed().size(), effectiveRule);

        Set<String> previouslyScored = credibilityRepository.findAllOverall().stream()
                .map(OverallCredibilityRecord::getProviderId)
                .collect(Collectors.toCollection(TreeSet::new));

        long now = System.currentTimeMillis();
        Map<String, List<CredibilityRecord>> rowsByProvider = outcome.entityScores().stream()
                .collect(Collectors.groupingBy(CredibilityRecord::getProviderId, TreeMap::new, Collectors.toList()));

        List<OverallCredibilityRecord> stored = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (OverallCredibilityRecord overall : outcome.overall()) {
            overall.setComputedAt(now);
            List<CredibilityRecord> rows = rowsByProvider.getOrDefault(overall.getProviderId(), Collections.emptyList());
            rows.forEach(r -> r.setComputedAt(now));
            try {
                credibilityRepository.upsertProvider(overall, rows);
            } catch (PersistenceException e) {
                log.error("Credibility rows for provider {} not stored, unit rolled back", overall.getProviderId(), e);
                failed.add(overall.getProviderId());
                metricsConfig.recordPersistenceFailure("credibility");
                continue;
            }
            stored.add(overall);
            metricsConfig.recordCredibility(effectiveModel.name(), overall.getNormalizedWeight());
        }
        stored.sort(Comparator.comparingDouble(OverallCredibilityRecord::getNormalizedWeight).reversed());

        outcome.overall().forEach(o -> previouslyScored.remove(o.getProviderId()));
        List<String> removed = new ArrayList<>();
        for (String providerId : previouslyScored) {
            try {
                credibilityRepository.removeProvider(providerId);
            } catch (PersistenceException e) {
                log.error("Stale credibility rows of provider {} not removed, unit rolled back", providerId, e);
                failed.add(providerId);
                metricsConfig.recordPersistenceFailure("credibility");
                continue;
            }
            removed.add(providerId);
        }
        if (!removed.isEmpty()) {
            log.info("Removed credibility rows of {} providers no longer scored: {}", removed.size(), removed);
        }

        return CredibilityRun.builder()
                .sourceRunId(run.getRunId())
                .model(effectiveModel)
                .confirmationRule(effectiveRule)
                .confirmedAnomalies(input.confirmed().size())
                .providers(stored)
                .failedProviders(failed)
                .removedProviders(removed)
                .computedAt(now)
                .build();
    }

    public List<OverallCredibilityRecord> getProviders() {
        return credibilityRepository.findAllOverall();
    }

    /**
     * @return the provider's per-entity rows, or null if the provider was never scored
     */
    public List<CredibilityRecord> getProviderEntities(String providerId) {
        if (credibilityRepository.findOverall(providerId) == null) return null;
        return credibilityRepository.findByProvider(providerId);
    }

    CredibilityInput buildInput(AnalysisRun run, ConfirmationRule rule) {
        DetectionConfig.Credibility params = config.getCredibility();
        DetectionConfig.Pipeline pipeline = config.getPipeline();
        Set<String> excludedEntities = new HashSet<>(pipeline.getExcludedEntities());
        Set<String> excludedProviders = new HashSet<>(pipeline.getExcludedProviders());

        Map<String, Set<String>> coverage = new TreeMap<>();
        observationRepository.findCoverage(params.getCoverageIndicator()).forEach((provider, entities) -> {
            if (excludedProviders.contains(provider)) return;
            Set<String> kept = new TreeSet<>(entities);
            kept.removeAll(excludedEntities);
            if (!kept.isEmpty()) coverage.put(provider, kept);
        });

        // Confirmations explain anomalies of the coverage indicator; flags on other indicators do not answer them
        Map<String, Set<EntityYear>> flags = new HashMap<>();
        for (AnomalyRecord record : anomalyRecordRepository.findByRunId(run.getRunId())) {
            if (record.getIndicator() != params.getCoverageIndicator()) continue;
            boolean counted = record.getMethods().stream().anyMatch(params.getFlagMethods()::contains);
            if (!counted) continue;
            flags.computeIfAbsent(record.getProviderId(), p -> new HashSet<>())
                    .add(new EntityYear(record.getEntityId(), record.getYear()));
        }

        Predicate<AnomalyConfirmation> confirmedBy = ConfirmationFilter.forRule(rule, params);
        Map<EntityYear, Integer> confirmed = new HashMap<>();
        for (AnomalyConfirmation confirmation : confirmationRepository.findAll()) {
            if (excludedEntities.contains(confirmation.getEntityId())) continue;
            if (!confirmedBy.test(confirmation)) continue;
            // Several explanations for one entity-year: the most confident wins
            confirmed.merge(new EntityYear(confirmation.getEntityId(), confirmation.getYear()),
                    confirmation.getConfidenceLevel(), Math::max);
        }
        return new CredibilityInput(coverage, flags, confirmed);
    }
}
