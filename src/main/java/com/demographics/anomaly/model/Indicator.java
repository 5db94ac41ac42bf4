package com.demographics.anomaly.model;

/**
 * Demographic indicators tracked per (entity, provider, year).
 * Core indicators are expected for every entity-provider-year; sex-disaggregated
 * indicators are recorded once per sex.
 */
public enum Indicator {
    POPULATION(true, false),
    BIRTH_RATE(true, false),
    DEATH_RATE(true, false),
    FERTILITY_RATE(true, false),
    NET_MIGRATION(true, false),
    NET_MIGRATION_RATE(true, false),
    SEX_RATIO_AT_BIRTH(true, false),
    SEX_RATIO_TOTAL(true, false),
    MEDIAN_AGE(true, false),
    LIFE_EXPECTANCY(false, true),
    INFANT_MORTALITY_RATE(false, true),
    UNDER_FIVE_MORTALITY_RATE(false, true),
    POPULATION_BY_SEX(false, true),
    POPULATION_BY_AGE_GROUP(false, false);

    private final boolean core;
    private final boolean sexDisaggregated;

    Indicator(boolean core, boolean sexDisaggregated) {
        this.core = core;
        this.sexDisaggregated = sexDisaggregated;
    }

    public boolean isCore() {
        return core;
    }

    public boolean isSexDisaggregated() {
        return sexDisaggregated;
    }
}
