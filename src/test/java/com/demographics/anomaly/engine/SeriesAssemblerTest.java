package com.demographics.anomaly.engine;

import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Observation;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.Sex;
import com.demographics.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.demographics.anomaly.testutil.TestDataFactory.createObservation;
import static org.assertj.core.api.Assertions.assertThat;

class SeriesAssemblerTest {

    private SeriesAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new SeriesAssembler(TestDataFactory.defaultConfig());
    }

    @Test
    void assemble_ordersYearsAndGroupsByKey() {
        List<Series> series = assembler.assemble(List.of(
                createObservation("NPL", "WB", Indicator.POPULATION, 2002, 30.0),
                createObservation("NPL", "WB", Indicator.POPULATION, 2000, 10.0),
                createObservation("NPL", "UN", Indicator.POPULATION, 2000, 11.0),
                createObservation("NPL", "WB", Indicator.POPULATION, 2001, 20.0)));

        assertThat(series).hasSize(2);
        Series wb = series.stream().filter(s -> s.key().providerId().equals("WB")).findFirst().orElseThrow();
        assertThat(wb.points()).extracting(p -> p.year()).containsExactly(2000, 2001, 2002);
        assertThat(wb.values()).containsExactly(10.0, 20.0, 30.0);
    }

    @Test
    void assemble_duplicateYear_latestIngestionWins() {
        Observation older = createObservation("NPL", "WB", Indicator.POPULATION, 2000, 10.0);
        older.setIngestedAt(1_000L);
        Observation newer = createObservation("NPL", "WB", Indicator.POPULATION, 2000, 12.0);
        newer.setIngestedAt(2_000L);

        List<Series> series = assembler.assemble(List.of(newer, older));

        assertThat(series).hasSize(1);
        assertThat(series.get(0).values()).containsExactly(12.0);
    }

    @Test
    void assemble_dropsMissingNonFiniteAndSentinelValues() {
        List<Series> series = assembler.assemble(List.of(
                createObservation("NPL", "WB", Indicator.POPULATION, 2000, null),
                createObservation("NPL", "WB", Indicator.POPULATION, 2001, Double.NaN),
                createObservation("NPL", "WB", Indicator.POPULATION, 2002, -999.0),
                createObservation("NPL", "WB", Indicator.POPULATION, 2003, Double.POSITIVE_INFINITY),
                createObservation("NPL", "WB", Indicator.POPULATION, 2004, 5.0)));

        assertThat(series).hasSize(1);
        assertThat(series.get(0).points()).extracting(p -> p.year()).containsExactly(2004);
    }

    @Test
    void assemble_sexSubgroupsFormSeparateSeries() {
        List<Series> series = assembler.assemble(List.of(
                TestDataFactory.createSexObservation("NPL", "WB", Indicator.LIFE_EXPECTANCY, 2000, Sex.MALE, 60.0),
                TestDataFactory.createSexObservation("NPL", "WB", Indicator.LIFE_EXPECTANCY, 2000, Sex.FEMALE, 64.0),
                createObservation("NPL", "WB", Indicator.LIFE_EXPECTANCY, 2000, 62.0)));

        assertThat(series).hasSize(3);
        assertThat(series).extracting(s -> s.key().sex()).containsExactlyInAnyOrder(null, Sex.MALE, Sex.FEMALE);
    }
}
