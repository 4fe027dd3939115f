package com.wileyfuller.weatherenergy.transform;

import com.wileyfuller.weatherenergy.model.EnergyObservation;
import com.wileyfuller.weatherenergy.model.MergedRecord;
import com.wileyfuller.weatherenergy.model.WeatherObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inner join of weather and energy on (city, date), sorted by city then date.
 * Days present in only one source are dropped, never filled in.
 */
public class MergeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MergeEngine.class);

    static final Comparator<MergedRecord> CITY_THEN_DATE = Comparator
            .comparing(MergedRecord::getCity)
            .thenComparing(MergedRecord::getDate);

    public List<MergedRecord> merge(List<WeatherObservation> weather, List<EnergyObservation> energy) {
        Map<Map.Entry<String, LocalDate>, Double> energyByKey = new HashMap<>();
        for (EnergyObservation e : energy) {
            Map.Entry<String, LocalDate> key = key(e.getCity(), e.getDate());
            if (energyByKey.containsKey(key)) {
                LOG.warn("Duplicate energy row for {} on {}, keeping the first", e.getCity(), e.getDate());
                continue;
            }
            energyByKey.put(key, e.getEnergyMwh());
        }

        Map<Map.Entry<String, LocalDate>, MergedRecord> merged = new HashMap<>();
        for (WeatherObservation w : weather) {
            Map.Entry<String, LocalDate> key = key(w.getCity(), w.getDate());
            if (!energyByKey.containsKey(key)) {
                continue;
            }
            if (merged.containsKey(key)) {
                LOG.warn("Duplicate weather row for {} on {}, keeping the first", w.getCity(), w.getDate());
                continue;
            }
            merged.put(key, new MergedRecord(w.getDate(), w.getCity(), w.getAvgTempF(), w.getTempDeltaF(),
                    energyByKey.get(key)));
        }

        List<MergedRecord> result = new ArrayList<>(merged.values());
        result.sort(CITY_THEN_DATE);
        LOG.info("Merged {} weather rows and {} energy rows into {} rows",
                weather.size(), energy.size(), result.size());
        return result;
    }

    private static Map.Entry<String, LocalDate> key(String city, LocalDate date) {
        return new AbstractMap.SimpleImmutableEntry<>(city, date);
    }
}
