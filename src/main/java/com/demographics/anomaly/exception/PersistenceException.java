package com.demographics.anomaly.exception;

/**
 * A logical unit of records could not be written. By the time this is thrown the
 * records of the unit that did reach the store have been deleted again.
 */
public class PersistenceException extends RuntimeException {

    private final String unit;

    public PersistenceException(String unit, String message, Throwable cause) {
        super("Persisting " + unit + " failed: " + message, cause);
        this.unit = unit;
    }

    public String getUnit() {
        return unit;
    }
}
