package com.wileyfuller.weatherenergy.quality;

import com.wileyfuller.weatherenergy.model.MergedRecord;
import com.wileyfuller.weatherenergy.model.QualityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Missing values, implausible readings and staleness of the merged dataset.
 */
public class DataQualityChecker {

    private static final Logger LOG = LoggerFactory.getLogger(DataQualityChecker.class);

    /** No US city averages above or below these; the bounds themselves are plausible. */
    public static final double MAX_PLAUSIBLE_TEMP_F = 130.0;
    public static final double MIN_PLAUSIBLE_TEMP_F = -50.0;
    public static final long MAX_FRESH_DAYS = 1;

    private static final Map<String, Function<MergedRecord, Object>> COLUMNS = new LinkedHashMap<>();

    static {
        COLUMNS.put("date", MergedRecord::getDate);
        COLUMNS.put("city", MergedRecord::getCity);
        COLUMNS.put("avg_temp_f", MergedRecord::getAvgTempF);
        COLUMNS.put("temp_delta_f", MergedRecord::getTempDeltaF);
        COLUMNS.put("energy_consumption", MergedRecord::getEnergyConsumption);
    }

    private final Clock clock;

    public DataQualityChecker(Clock clock) {
        this.clock = clock;
    }

    public QualityReport check(List<MergedRecord> merged) {
        LOG.info("Running data quality checks on {} rows", merged.size());
        return new QualityReport(checkMissingValues(merged), checkOutliers(merged), checkFreshness(merged));
    }

    Map<String, Long> checkMissingValues(List<MergedRecord> merged) {
        Map<String, Long> missing = new LinkedHashMap<>();
        for (Map.Entry<String, Function<MergedRecord, Object>> column : COLUMNS.entrySet()) {
            long count = merged.stream().map(column.getValue()).filter(Objects::isNull).count();
            missing.put(column.getKey(), count);
        }
        LOG.info("Total missing values: {}", missing.values().stream().mapToLong(Long::longValue).sum());
        return missing;
    }

    QualityReport.Outliers checkOutliers(List<MergedRecord> merged) {
        long temperature = merged.stream()
                .map(MergedRecord::getAvgTempF)
                .filter(Objects::nonNull)
                .filter(t -> t > MAX_PLAUSIBLE_TEMP_F || t < MIN_PLAUSIBLE_TEMP_F)
                .count();
        long negativeEnergy = merged.stream()
                .map(MergedRecord::getEnergyConsumption)
                .filter(Objects::nonNull)
                .filter(e -> e < 0)
                .count();
        QualityReport.Outliers outliers = new QualityReport.Outliers(temperature, negativeEnergy);
        LOG.info("Outliers found: {}", outliers);
        return outliers;
    }

    QualityReport.Freshness checkFreshness(List<MergedRecord> merged) {
        LocalDate latest = merged.stream()
                .map(MergedRecord::getDate)
                .filter(Objects::nonNull)
                .max(LocalDate::compareTo)
                .orElse(null);
        if (latest == null) {
            LOG.warn("No dated rows, dataset cannot be fresh");
            return new QualityReport.Freshness(null, false, null);
        }
        LocalDate today = LocalDate.now(clock);
        long daysOld = ChronoUnit.DAYS.between(latest, today);
        boolean fresh = daysOld <= MAX_FRESH_DAYS;
        LOG.info("Latest data date: {}, {} days old, fresh: {}", latest, daysOld, fresh);
        return new QualityReport.Freshness(latest, fresh, daysOld);
    }
}
