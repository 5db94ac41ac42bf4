package com.demographics.anomaly.engine.credibility;

import java.util.Map;
import java.util.Set;

/**
 * Everything a scorer needs, already reduced to plain sets.
 *
 * @param coverage  provider id to the entities it reports on
 * @param flags     provider id to the entity-years it flagged with a counted method
 * @param confirmed confirmed entity-years with the confidence level backing each
 */
public record CredibilityInput(Map<String, Set<String>> coverage,
                               Map<String, Set<EntityYear>> flags,
                               Map<EntityYear, Integer> confirmed) {

    public boolean flagged(String providerId, EntityYear entityYear) {
        Set<EntityYear> provided = flags.get(providerId);
        return provided != null && provided.contains(entityYear);
    }
}
