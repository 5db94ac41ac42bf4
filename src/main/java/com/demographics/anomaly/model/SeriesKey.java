package com.demographics.anomaly.model;

/**
 * Identifies one series: an (entity, provider, indicator) triple, narrowed by
 * sex and age group for disaggregated indicators.
 */
public record SeriesKey(String entityId, String providerId, Indicator indicator, Sex sex, String ageGroup) {

    public static SeriesKey of(Observation obs) {
        return new SeriesKey(obs.getEntityId(), obs.getProviderId(), obs.getIndicator(),
                obs.getSex(), obs.getAgeGroup());
    }

    /** Stable text form used in record keys and log lines. */
    public String asText() {
        StringBuilder sb = new StringBuilder()
                .append(entityId).append('|')
                .append(providerId).append('|')
                .append(indicator);
        if (sex != null) sb.append('|').append(sex);
        if (ageGroup != null) sb.append('|').append(ageGroup);
        return sb.toString();
    }
}
