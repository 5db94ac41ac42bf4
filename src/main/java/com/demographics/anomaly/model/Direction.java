package com.demographics.anomaly.model;

public enum Direction {
    INCREASE,
    DECREASE,
    NONE;

    public static Direction fromChange(double relativeChange) {
        if (relativeChange > 0) return INCREASE;
        if (relativeChange < 0) return DECREASE;
        return NONE;
    }
}
