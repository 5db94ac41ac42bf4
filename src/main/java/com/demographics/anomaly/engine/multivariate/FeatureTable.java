package com.demographics.anomaly.engine.multivariate;

import java.util.List;

/**
 * Complete feature rows ready for fitting, with the number of rows that were
 * dropped because some feature was missing.
 */
public record FeatureTable(List<String> featureNames, List<FeatureRow> rows, int droppedRows) {

    public FeatureTable {
        featureNames = List.copyOf(featureNames);
        rows = List.copyOf(rows);
    }

    public int featureCount() {
        return featureNames.size();
    }

    public int size() {
        return rows.size();
    }

    public double[][] matrix() {
        double[][] data = new double[rows.size()][];
        for (int i = 0; i < data.length; i++) {
            data[i] = rows.get(i).values().clone();
        }
        return data;
    }
}
