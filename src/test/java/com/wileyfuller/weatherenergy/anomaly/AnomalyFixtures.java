package com.wileyfuller.weatherenergy.anomaly;

import com.wileyfuller.weatherenergy.model.MergedRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

final class AnomalyFixtures {

    static final LocalDate START = LocalDate.of(2024, 1, 1);

    private AnomalyFixtures() {}

    /**
     * Ordinary days with small, regular variation around the given demand level.
     */
    static List<MergedRecord> cleanDays(String city, int count, double baseEnergy) {
        List<MergedRecord> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(new MergedRecord(START.plusDays(i), city, 60.0 + (i % 5), 14.0 + (i % 3),
                    baseEnergy + 10.0 * i));
        }
        return rows;
    }
}
