package com.demographics.anomaly.model;

public enum ScoringModel {
    PENALTY,
    CONFIDENCE_AVERAGE
}
