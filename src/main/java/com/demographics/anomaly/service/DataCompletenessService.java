package com.demographics.anomaly.service;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.model.CompletenessIssue;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Observation;
import com.demographics.anomaly.model.Sex;
import com.demographics.anomaly.model.SexImbalanceIssue;
import com.demographics.anomaly.repository.ObservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reports gaps in the stored observations: core indicators missing where other
 * core indicators exist, and sex-disaggregated indicators reported for one sex only.
 */
@Service
public class DataCompletenessService {

    private static final Logger log = LoggerFactory.getLogger(DataCompletenessService.class);

    private final ObservationRepository observationRepository;
    private final DetectionConfig config;

    public DataCompletenessService(ObservationRepository observationRepository, DetectionConfig config) {
        this.observationRepository = observationRepository;
        this.config = config;
    }

    public List<CompletenessIssue> findMissingCoreIndicators(int yearFrom, int yearTo, String entityId) {
        // entity|provider|year -> core indicators present
        Map<String, Set<Indicator>> present = new TreeMap<>();
        Map<String, Observation> sample = new TreeMap<>();
        for (Indicator indicator : Indicator.values()) {
            if (!indicator.isCore()) continue;
            for (Observation obs : fetch(indicator, yearFrom, yearTo, entityId)) {
                if (obs.getValue() == null || obs.getSex() != null || obs.getAgeGroup() != null) continue;
                String key = obs.getEntityId() + "|" + obs.getProviderId() + "|" + obs.getYear();
                present.computeIfAbsent(key, k -> EnumSet.noneOf(Indicator.class)).add(indicator);
                sample.putIfAbsent(key, obs);
            }
        }

        List<CompletenessIssue> issues = new ArrayList<>();
        for (Map.Entry<String, Set<Indicator>> entry : present.entrySet()) {
            Observation obs = sample.get(entry.getKey());
            for (Indicator indicator : Indicator.values()) {
                if (indicator.isCore() && !entry.getValue().contains(indicator)) {
                    issues.add(new CompletenessIssue(obs.getEntityId(), obs.getProviderId(), obs.getYear(), indicator));
                }
            }
        }
        log.info("Completeness check {}-{}: {} entity-provider-years, {} missing core values",
                yearFrom, yearTo, present.size(), issues.size());
        return issues;
    }

    public List<SexImbalanceIssue> findSexImbalances(int yearFrom, int yearTo, String entityId) {
        // entity|provider|year|indicator|ageGroup -> sexes present
        Map<String, Set<Sex>> sexes = new TreeMap<>();
        Map<String, Observation> sample = new TreeMap<>();
        for (Indicator indicator : Indicator.values()) {
            if (!indicator.isSexDisaggregated()) continue;
            for (Observation obs : fetch(indicator, yearFrom, yearTo, entityId)) {
                if (obs.getValue() == null || obs.getSex() == null) continue;
                String key = String.join("|", obs.getEntityId(), obs.getProviderId(),
                        String.valueOf(obs.getYear()), indicator.name(), Objects.toString(obs.getAgeGroup(), ""));
                sexes.computeIfAbsent(key, k -> EnumSet.noneOf(Sex.class)).add(obs.getSex());
                sample.putIfAbsent(key, obs);
            }
        }

        List<SexImbalanceIssue> issues = new ArrayList<>();
        for (Map.Entry<String, Set<Sex>> entry : sexes.entrySet()) {
            if (entry.getValue().size() != 1) continue;
            Observation obs = sample.get(entry.getKey());
            Sex presentSex = entry.getValue().iterator().next();
            Sex missing = Arrays.stream(Sex.values()).filter(s -> s != presentSex).findFirst().orElseThrow();
            issues.add(new SexImbalanceIssue(obs.getEntityId(), obs.getProviderId(), obs.getYear(),
                    obs.getIndicator(), presentSex, missing));
        }
        issues.sort(Comparator.comparing(SexImbalanceIssue::entityId).thenComparingInt(SexImbalanceIssue::year));
        log.info("Sex balance check {}-{}: {} imbalanced values", yearFrom, yearTo, issues.size());
        return issues;
    }

    private List<Observation> fetch(Indicator indicator, int yearFrom, int yearTo, String entityId) {
        List<Observation> observations = observationRepository.findByIndicator(indicator, yearFrom, yearTo,
                config.getPipeline().getExcludedEntities(), config.getPipeline().getExcludedProviders());
        if (entityId == null) return observations;
        return observations.stream().filter(o -> entityId.equals(o.getEntityId())).toList();
    }
}
