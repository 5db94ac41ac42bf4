package com.demographics.anomaly.model;

public enum RunStatus {
    STARTED,
    COMPLETED,
    FAILED
}
