package com.demographics.anomaly.model;

public record SeriesPoint(int year, double value) {}
