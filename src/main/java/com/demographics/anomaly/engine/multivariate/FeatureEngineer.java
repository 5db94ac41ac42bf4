package com.demographics.anomaly.engine.multivariate;

import com.demographics.anomaly.config.DetectionConfig;
import com.demographics.anomaly.engine.stats.Statistics;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesPoint;
import com.demographics.anomaly.model.Sex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the per (entity, year) feature table from cross-provider aggregates
 * (average, max, min, distinct provider count) of each indicator.
 *
 * Features, in order:
 * scaled year; robust deviation of seven averaged indicators; year-over-year delta of
 * average population and birth rate; natural increase; range-to-mean ratio and
 * provider count for five indicators; male minus female life expectancy.
 */
@Component
public class FeatureEngineer {

    static final double EPS = 1e-10;

    /** Indicators the feature table reads. */
    public static final List<Indicator> REQUIRED_INDICATORS = List.of(
            Indicator.POPULATION, Indicator.BIRTH_RATE, Indicator.DEATH_RATE, Indicator.FERTILITY_RATE,
            Indicator.NET_MIGRATION, Indicator.MEDIAN_AGE, Indicator.LIFE_EXPECTANCY);

    private static final List<Indicator> ROBUST_Z = REQUIRED_INDICATORS;

    private static final List<Indicator> SPREAD = List.of(
            Indicator.POPULATION, Indicator.BIRTH_RATE, Indicator.DEATH_RATE,
            Indicator.FERTILITY_RATE, Indicator.NET_MIGRATION);

    private final DetectionConfig config;

    public FeatureEngineer(DetectionConfig config) {
        this.config = config;
    }

    public static List<String> featureNames() {
        List<String> names = new ArrayList<>();
        names.add("year_scaled");
        for (Indicator indicator : ROBUST_Z) names.add(indicator.name().toLowerCase() + "_robust_z");
        names.add("population_delta");
        names.add("birth_rate_delta");
        names.add("natural_increase");
        for (Indicator indicator : SPREAD) names.add(indicator.name().toLowerCase() + "_range_ratio");
        for (Indicator indicator : SPREAD) names.add(indicator.name().toLowerCase() + "_providers");
        names.add("life_expectancy_sex_gap");
        return names;
    }

    public FeatureTable build(Map<Indicator, List<Series>> seriesByIndicator) {
        // entity -> year -> slice
        Map<String, TreeMap<Integer, Slice>> slices = aggregate(seriesByIndicator);

        int minYear = Integer.MAX_VALUE;
        int maxYear = Integer.MIN_VALUE;
        for (TreeMap<Integer, Slice> byYear : slices.values()) {
            minYear = Math.min(minYear, byYear.firstKey());
            maxYear = Math.max(maxYear, byYear.lastKey());
        }

        List<String> names = featureNames();
        List<FeatureRow> complete = new ArrayList<>();
        int dropped = 0;

        for (Map.Entry<String, TreeMap<Integer, Slice>> entity : slices.entrySet()) {
            List<Slice> rows = new ArrayList<>(entity.getValue().values());
            int n = rows.size();

            Map<Indicator, double[]> robust = new EnumMap<>(Indicator.class);
            for (Indicator indicator : ROBUST_Z) {
                robust.put(indicator, robustDeviation(averages(rows, indicator)));
            }
            double[] population = averages(rows, Indicator.POPULATION);
            double[] birthRate = averages(rows, Indicator.BIRTH_RATE);

            for (int i = 0; i < n; i++) {
                Slice slice = rows.get(i);
                double[] values = new double[names.size()];
                int f = 0;
                values[f++] = 2.0 * (slice.year - minYear) / (maxYear - minYear + EPS) - 1.0;
                for (Indicator indicator : ROBUST_Z) values[f++] = robust.get(indicator)[i];
                values[f++] = i == 0 ? Double.NaN : population[i] - population[i - 1];
                values[f++] = i == 0 ? Double.NaN : birthRate[i] - birthRate[i - 1];
                values[f++] = slice.average(Indicator.BIRTH_RATE) - slice.average(Indicator.DEATH_RATE);
                for (Indicator indicator : SPREAD) values[f++] = slice.rangeRatio(indicator);
                for (Indicator indicator : SPREAD) values[f++] = slice.providerCount(indicator);
                values[f] = slice.sexGap();

                FeatureRow row = new FeatureRow(entity.getKey(), slice.year, values);
                if (row.isComplete()) {
                    complete.add(row);
                } else {
                    dropped++;
                }
            }
        }
        return new FeatureTable(names, complete, dropped);
    }

    private Map<String, TreeMap<Integer, Slice>> aggregate(Map<Indicator, List<Series>> seriesByIndicator) {
        Map<String, TreeMap<Integer, Slice>> slices = new TreeMap<>();
        for (Indicator indicator : REQUIRED_INDICATORS) {
            for (Series series : seriesByIndicator.getOrDefault(indicator, List.of())) {
                if (series.key().ageGroup() != null) continue;
                Sex sex = series.key().sex();
                for (SeriesPoint point : series.points()) {
                    Slice slice = slices.computeIfAbsent(series.key().entityId(), e -> new TreeMap<>())
                            .computeIfAbsent(point.year(), Slice::new);
                    if (sex == null) {
                        slice.add(indicator, series.key().providerId(), point.value());
                    } else if (indicator == Indicator.LIFE_EXPECTANCY) {
                        slice.addBySex(sex, point.value());
                    }
                }
            }
        }
        return slices;
    }

    private static double[] averages(List<Slice> rows, Indicator indicator) {
        double[] out = new double[rows.size()];
        for (int i = 0; i < out.length; i++) out[i] = rows.get(i).average(indicator);
        return out;
    }

    // (x - rolling median) / (1.4826 * rolling MAD), centered window over the entity's rows
    private double[] robustDeviation(double[] column) {
        int window = config.getMultivariate().getRobustWindow();
        int minPeriods = config.getMultivariate().getRobustMinPeriods();
        double[] median = Statistics.centeredRollingMedian(column, window, minPeriods);
        double[] mad = Statistics.centeredRollingMad(column, window, minPeriods);
        double[] out = new double[column.length];
        for (int i = 0; i < column.length; i++) {
            double m = mad[i] == 0.0 ? EPS : mad[i];
            out[i] = (column[i] - median[i]) / (Statistics.MAD_SCALE * m);
        }
        return out;
    }

    private static final class Slice {
        private final int year;
        private final Map<Indicator, Aggregate> aggregates = new EnumMap<>(Indicator.class);
        private final Map<Sex, Aggregate> lifeExpectancyBySex = new EnumMap<>(Sex.class);

        Slice(int year) {
            this.year = year;
        }

        void add(Indicator indicator, String providerId, double value) {
            aggregates.computeIfAbsent(indicator, i -> new Aggregate()).add(providerId, value);
        }

        void addBySex(Sex sex, double value) {
            lifeExpectancyBySex.computeIfAbsent(sex, s -> new Aggregate()).add(null, value);
        }

        double average(Indicator indicator) {
            Aggregate a = aggregates.get(indicator);
            if (a != null) return a.mean();
            if (indicator == Indicator.LIFE_EXPECTANCY) {
                // No total reported: fall back to the midpoint of the sex-specific averages
                return (averageBySex(Sex.MALE) + averageBySex(Sex.FEMALE)) / 2.0;
            }
            return Double.NaN;
        }

        double rangeRatio(Indicator indicator) {
            Aggregate a = aggregates.get(indicator);
            return a == null ? Double.NaN : (a.max - a.min) / (a.mean() + EPS);
        }

        double providerCount(Indicator indicator) {
            Aggregate a = aggregates.get(indicator);
            return a == null ? Double.NaN : a.providers.size();
        }

        /** Highest reported male minus highest reported female life expectancy. */
        double sexGap() {
            return maxBySex(Sex.MALE) - maxBySex(Sex.FEMALE);
        }

        private double maxBySex(Sex sex) {
            Aggregate a = lifeExpectancyBySex.get(sex);
            return a == null ? Double.NaN : a.max;
        }

        private double averageBySex(Sex sex) {
            Aggregate a = lifeExpectancyBySex.get(sex);
            return a == null ? Double.NaN : a.mean();
        }
    }

    private static final class Aggregate {
        private double sum;
        private int count;
        private double max = Double.NEGATIVE_INFINITY;
        private double min = Double.POSITIVE_INFINITY;
        private final Set<String> providers = new HashSet<>();

        void add(String providerId, double value) {
            sum += value;
            count++;
            max = Math.max(max, value);
            min = Math.min(min, value);
            if (providerId != null) providers.add(providerId);
        }

        double mean() {
            return sum / count;
        }
    }
}
