package com.wileyfuller.weatherenergy.quality;

import com.wileyfuller.weatherenergy.model.MergedRecord;
import com.wileyfuller.weatherenergy.model.QualityReport;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataQualityCheckerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);

    private final DataQualityChecker checker = new DataQualityChecker(CLOCK);

    private static MergedRecord record(LocalDate date, Double avgTemp, Double energy) {
        return new MergedRecord(date, "Alpha", avgTemp, avgTemp == null ? null : 10.0, energy);
    }

    @Test
    void testTemperatureBoundsAreExclusive() {
        LocalDate day = LocalDate.of(2024, 3, 9);
        List<MergedRecord> rows = Arrays.asList(
                record(day, 130.0, 1.0),
                record(day, 130.0001, 1.0),
                record(day, -50.0, 1.0),
                record(day, -50.0001, 1.0),
                record(day, 72.0, 1.0));

        QualityReport.Outliers outliers = checker.checkOutliers(rows);

        assertThat(outliers.getTemperatureOutliers()).isEqualTo(2);
        assertThat(outliers.getNegativeEnergyReadings()).isZero();
    }

    @Test
    void testCountsNegativeEnergyButNotZero() {
        LocalDate day = LocalDate.of(2024, 3, 9);
        List<MergedRecord> rows = Arrays.asList(
                record(day, 60.0, -500.0),
                record(day, 60.0, 0.0),
                record(day, 60.0, null));

        assertThat(checker.checkOutliers(rows).getNegativeEnergyReadings()).isEqualTo(1);
    }

    @Test
    void testMissingValuesPerColumn() {
        LocalDate day = LocalDate.of(2024, 3, 9);
        List<MergedRecord> rows = Arrays.asList(
                record(day, null, 1000.0),
                record(day, 61.0, null),
                record(day, null, null));

        Map<String, Long> missing = checker.checkMissingValues(rows);

        assertThat(missing).containsOnlyKeys("date", "city", "avg_temp_f", "temp_delta_f", "energy_consumption");
        assertThat(missing.get("date")).isZero();
        assertThat(missing.get("avg_temp_f")).isEqualTo(2);
        assertThat(missing.get("temp_delta_f")).isEqualTo(2);
        assertThat(missing.get("energy_consumption")).isEqualTo(2);
    }

    @Test
    void testYesterdayIsFresh() {
        QualityReport.Freshness freshness = checker.checkFreshness(Arrays.asList(
                record(LocalDate.of(2024, 3, 1), 50.0, 1.0),
                record(LocalDate.of(2024, 3, 9), 50.0, 1.0)));

        assertThat(freshness.getLatestDate()).isEqualTo(LocalDate.of(2024, 3, 9));
        assertThat(freshness.getDaysOld()).isEqualTo(1L);
        assertThat(freshness.isFresh()).isTrue();
    }

    @Test
    void testTwoDaysOldIsStale() {
        QualityReport.Freshness freshness = checker.checkFreshness(Collections.singletonList(
                record(LocalDate.of(2024, 3, 8), 50.0, 1.0)));

        assertThat(freshness.getDaysOld()).isEqualTo(2L);
        assertThat(freshness.isFresh()).isFalse();
    }

    @Test
    void testEmptyDatasetIsNotFresh() {
        QualityReport report = checker.check(Collections.emptyList());

        assertThat(report.getFreshness().getLatestDate()).isNull();
        assertThat(report.getFreshness().getDaysOld()).isNull();
        assertThat(report.getFreshness().isFresh()).isFalse();
        assertThat(report.getTotalMissing()).isZero();
        assertThat(report.getOutliers().getTemperatureOutliers()).isZero();
    }
}
