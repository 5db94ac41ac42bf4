package com.demographics.anomaly.engine.credibility;

public record EntityYear(String entityId, int year) {}
