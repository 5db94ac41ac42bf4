package com.demographics.anomaly.engine.multivariate;

import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesKey;
import com.demographics.anomaly.model.SeriesPoint;
import com.demographics.anomaly.model.Sex;
import com.demographics.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.demographics.anomaly.testutil.TestDataFactory.createSeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureEngineerTest {

    private FeatureEngineer engineer;

    @BeforeEach
    void setUp() {
        engineer = new FeatureEngineer(TestDataFactory.defaultConfig());
    }

    @Test
    void featureNames_hasTwentyTwoColumns() {
        List<String> names = FeatureEngineer.featureNames();

        assertThat(names).hasSize(22).doesNotHaveDuplicates();
        assertThat(names.get(0)).isEqualTo("year_scaled");
        assertThat(names.get(21)).isEqualTo("life_expectancy_sex_gap");
    }

    @Test
    void build_firstYearDroppedForMissingDeltas() {
        FeatureTable table = engineer.build(fullInput(4));

        assertThat(table.featureCount()).isEqualTo(22);
        assertThat(table.size()).isEqualTo(3);
        assertThat(table.droppedRows()).isEqualTo(1);
        assertThat(table.rows()).extracting(FeatureRow::year).containsExactly(2001, 2002, 2003);
    }

    @Test
    void build_computesAggregatesAcrossProviders() {
        FeatureTable table = engineer.build(fullInput(4));
        List<String> names = table.featureNames();
        double[] row = table.rows().get(0).values();

        // WB reports population 1000 + 10i, UN 10% higher
        assertThat(row[names.indexOf("population_providers")]).isEqualTo(2.0);
        assertThat(row[names.indexOf("population_range_ratio")]).isCloseTo(101.0 / 1060.5, within(1e-6));
        assertThat(row[names.indexOf("population_delta")]).isCloseTo(10.5, within(1e-9));
        assertThat(row[names.indexOf("natural_increase")]).isCloseTo(30.0 - 10.0, within(1e-9));
        assertThat(row[names.indexOf("life_expectancy_sex_gap")]).isCloseTo(-4.0, within(1e-9));
        assertThat(row[names.indexOf("year_scaled")]).isCloseTo(2.0 / 3.0 - 1.0, within(1e-6));
    }

    @Test
    void build_sexGapComparesHighestReportedValues() {
        Map<Indicator, List<Series>> input = fullInput(4);
        List<Series> lifeExpectancy = new ArrayList<>(input.get(Indicator.LIFE_EXPECTANCY));
        lifeExpectancy.add(sexSeries("WB", Sex.MALE, ramp(62, 0.5, 4)));
        input.put(Indicator.LIFE_EXPECTANCY, lifeExpectancy);

        FeatureTable table = engineer.build(input);
        double[] row = table.rows().get(0).values();

        // male: max(UN 60.5, WB 62.5); female: UN 64.5
        assertThat(row[table.featureNames().indexOf("life_expectancy_sex_gap")]).isCloseTo(-2.0, within(1e-9));
    }

    @Test
    void build_missingIndicatorInAYear_dropsThatRow() {
        Map<Indicator, List<Series>> input = fullInput(4);
        input.put(Indicator.MEDIAN_AGE, List.of(createSeries("NPL", "WB", Indicator.MEDIAN_AGE, 2000, 20, 21, 22)));

        FeatureTable table = engineer.build(input);

        assertThat(table.rows()).extracting(FeatureRow::year).containsExactly(2001, 2002);
        assertThat(table.droppedRows()).isEqualTo(2);
        assertThat(table.rows()).allSatisfy(r -> assertThat(r.isComplete()).isTrue());
    }

    private static Map<Indicator, List<Series>> fullInput(int years) {
        Map<Indicator, List<Series>> input = new EnumMap<>(Indicator.class);
        input.put(Indicator.POPULATION, List.of(
                createSeries("NPL", "WB", Indicator.POPULATION, 2000, ramp(1000, 10, years)),
                createSeries("NPL", "UN", Indicator.POPULATION, 2000, ramp(1100, 11, years))));
        input.put(Indicator.BIRTH_RATE, List.of(createSeries("NPL", "WB", Indicator.BIRTH_RATE, 2000, ramp(30, 0, years))));
        input.put(Indicator.DEATH_RATE, List.of(createSeries("NPL", "WB", Indicator.DEATH_RATE, 2000, ramp(10, 0, years))));
        input.put(Indicator.FERTILITY_RATE, List.of(createSeries("NPL", "WB", Indicator.FERTILITY_RATE, 2000, ramp(3, 0.1, years))));
        input.put(Indicator.NET_MIGRATION, List.of(createSeries("NPL", "WB", Indicator.NET_MIGRATION, 2000, ramp(-50, 5, years))));
        input.put(Indicator.MEDIAN_AGE, List.of(createSeries("NPL", "WB", Indicator.MEDIAN_AGE, 2000, ramp(20, 1, years))));

        List<Series> lifeExpectancy = new ArrayList<>();
        lifeExpectancy.add(createSeries("NPL", "WB", Indicator.LIFE_EXPECTANCY, 2000, ramp(62, 0.5, years)));
        lifeExpectancy.add(sexSeries(Sex.MALE, ramp(60, 0.5, years)));
        lifeExpectancy.add(sexSeries(Sex.FEMALE, ramp(64, 0.5, years)));
        input.put(Indicator.LIFE_EXPECTANCY, lifeExpectancy);
        return input;
    }

    private static Series sexSeries(Sex sex, double[] values) {
        return sexSeries("UN", sex, values);
    }

    private static Series sexSeries(String providerId, Sex sex, double[] values) {
        List<SeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) points.add(new SeriesPoint(2000 + i, values[i]));
        return new Series(new SeriesKey("NPL", providerId, Indicator.LIFE_EXPECTANCY, sex, null), points);
    }

    private static double[] ramp(double start, double step, int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) values[i] = start + step * i;
        return values;
    }
}
