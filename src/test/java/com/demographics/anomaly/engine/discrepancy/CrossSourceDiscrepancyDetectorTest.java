package com.demographics.anomaly.engine.discrepancy;

import com.demographics.anomaly.model.DiscrepancyRecord;
import com.demographics.anomaly.model.Indicator;
import com.demographics.anomaly.model.Series;
import com.demographics.anomaly.model.SeriesKey;
import com.demographics.anomaly.model.SeriesPoint;
import com.demographics.anomaly.model.Sex;
import com.demographics.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.demographics.anomaly.testutil.TestDataFactory.createSeries;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CrossSourceDiscrepancyDetectorTest {

    private CrossSourceDiscrepancyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CrossSourceDiscrepancyDetector(TestDataFactory.defaultConfig());
    }

    @Test
    void detect_thirtyPercentGap_flagged() {
        List<DiscrepancyRecord> records = detector.detect(Indicator.POPULATION, List.of(
                createSeries("NPL", "WB", Indicator.POPULATION, 2010, 1_000_000),
                createSeries("NPL", "UN", Indicator.POPULATION, 2010, 1_300_000)));

        assertThat(records).hasSize(1);
        DiscrepancyRecord record = records.get(0);
        assertThat(record.getMaxDiscrepancy()).isCloseTo(0.30, within(1e-9));
        assertThat(record.getMeanValue()).isEqualTo(1_150_000.0);
        assertThat(record.getCoefficientOfVariation()).isCloseTo(212_132.03 / 1_150_000.0, within(1e-6));
        assertThat(record.getProviderIds()).containsExactlyInAnyOrder("WB", "UN");
        assertThat(record.isFlagged()).isTrue();
    }

    @Test
    void detect_smallGap_keptButNotFlagged() {
        List<DiscrepancyRecord> records = detector.detect(Indicator.POPULATION, List.of(
                createSeries("NPL", "WB", Indicator.POPULATION, 2010, 1_000_000),
                createSeries("NPL", "UN", Indicator.POPULATION, 2010, 1_050_000)));

        assertThat(records).hasSize(1);
        assertThat(records.get(0).isFlagged()).isFalse();
    }

    @Test
    void detect_singleProviderYears_skipped() {
        List<DiscrepancyRecord> records = detector.detect(Indicator.POPULATION, List.of(
                createSeries("NPL", "WB", Indicator.POPULATION, 2010, 100, 110),
                createSeries("NPL", "UN", Indicator.POPULATION, 2011, 120)));

        assertThat(records).extracting(DiscrepancyRecord::getYear).containsExactly(2011);
    }

    @Test
    void detect_ignoresSexDisaggregatedSeries() {
        Series female = new Series(new SeriesKey("NPL", "UN", Indicator.LIFE_EXPECTANCY, Sex.FEMALE, null),
                List.of(new SeriesPoint(2010, 90.0)));

        List<DiscrepancyRecord> records = detector.detect(Indicator.LIFE_EXPECTANCY, List.of(
                createSeries("NPL", "WB", Indicator.LIFE_EXPECTANCY, 2010, 60), female));

        assertThat(records).isEmpty();
    }

    @Test
    void compare_nonPositiveMinimum_zeroDiscrepancy() {
        DiscrepancyRecord record = detector.compare("NPL", Indicator.NET_MIGRATION, 2010,
                Map.of("WB", -5.0, "UN", 10.0));

        assertThat(record.getMaxDiscrepancy()).isEqualTo(0.0);
        assertThat(record.getCoefficientOfVariation()).isGreaterThan(0.0);
        assertThat(record.isFlagged()).isFalse();
    }
}
