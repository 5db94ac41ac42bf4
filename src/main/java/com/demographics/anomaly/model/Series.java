package com.demographics.anomaly.model;

import java.util.List;

/**
 * Chronologically ordered observations for one {@link SeriesKey}.
 * Years are strictly increasing; gaps are allowed.
 */
public record Series(SeriesKey key, List<SeriesPoint> points) {

    public Series {
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i).year() <= points.get(i - 1).year()) {
                throw new IllegalArgumentException("Series years must be strictly increasing: " + key.asText());
            }
        }
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).value();
        }
        return values;
    }

    public int yearAt(int index) {
        return points.get(index).year();
    }
}
