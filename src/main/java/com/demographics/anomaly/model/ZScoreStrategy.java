package com.demographics.anomaly.model;

public enum ZScoreStrategy {
    // whole-series mean and standard deviation
    PLAIN,
    // trailing window over raw values
    ROLLING
}
