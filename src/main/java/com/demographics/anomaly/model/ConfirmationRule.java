package com.demographics.anomaly.model;

/**
 * Decides which explained anomalies count as confirmed when scoring provider credibility.
 */
public enum ConfirmationRule {
    /** Any confidence above zero, including "no known event" explanations. */
    ANY_POSITIVE_CONFIDENCE,
    /** Confidence at or above the configured minimum. */
    MIN_CONFIDENCE,
    /** Confidence above zero and an explanation that names an actual event. */
    EXCLUDE_NO_KNOWN_CAUSE
}
