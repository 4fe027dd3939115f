package com.wileyfuller.weatherenergy.anomaly;

import com.wileyfuller.weatherenergy.model.AnomalyRecord;
import com.wileyfuller.weatherenergy.model.MergedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Fits one model per city and flags each city's outliers against its own baseline.
 * <p>
 * Climate and grid size differ too much between cities for a single threshold: a global model would
 * keep flagging the naturally hot or naturally high-demand ones.
 */
public class AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final int MIN_ROWS_PER_CITY = 10;

    private final Supplier<OutlierModel> modelFactory;

    public AnomalyDetector(Supplier<OutlierModel> modelFactory) {
        this.modelFactory = modelFactory;
    }

    public List<AnomalyRecord> detect(List<MergedRecord> merged) {
        Map<String, List<MergedRecord>> byCity = usableRowsByCity(merged);
        Map<String, OutlierModel> models = fitModels(byCity);

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<String, OutlierModel> entry : models.entrySet()) {
            List<MergedRecord> rows = byCity.get(entry.getKey());
            List<double[]> features = features(rows);
            double[] scores = entry.getValue().score(features);
            boolean[] labels = entry.getValue().labels(features);
            int flagged = 0;
            for (int i = 0; i < rows.size(); i++) {
                if (labels[i]) {
                    anomalies.add(new AnomalyRecord(rows.get(i), scores[i]));
                    flagged++;
                }
            }
            LOG.info("{}: {} anomalies in {} rows", entry.getKey(), flagged, rows.size());
        }
        LOG.info("Detected {} anomalies across {} cities", anomalies.size(), models.size());
        return anomalies;
    }

    /**
     * One independently fitted model per city with enough rows. Cities below {@link #MIN_ROWS_PER_CITY}
     * have no entry.
     */
    public Map<String, OutlierModel> fitModels(Map<String, List<MergedRecord>> byCity) {
        Map<String, OutlierModel> models = new LinkedHashMap<>();
        for (Map.Entry<String, List<MergedRecord>> entry : byCity.entrySet()) {
            String city = entry.getKey();
            List<MergedRecord> rows = entry.getValue();
            if (rows.size() < MIN_ROWS_PER_CITY) {
                LOG.info("Skipping {}: {} rows, need at least {}", city, rows.size(), MIN_ROWS_PER_CITY);
                continue;
            }
            OutlierModel model = modelFactory.get();
            model.fit(features(rows));
            models.put(city, model);
        }
        return models;
    }

    /**
     * Rows grouped by city in lexical city order, leaving out rows with a missing feature.
     */
    Map<String, List<MergedRecord>> usableRowsByCity(List<MergedRecord> merged) {
        Map<String, List<MergedRecord>> byCity = new TreeMap<>();
        int incomplete = 0;
        for (MergedRecord record : merged) {
            if (record.getCity() == null || record.features() == null) {
                incomplete++;
                continue;
            }
            byCity.computeIfAbsent(record.getCity(), c -> new ArrayList<>()).add(record);
        }
        if (incomplete > 0) {
            LOG.warn("Left {} rows with missing values out of anomaly detection", incomplete);
        }
        return byCity;
    }

    private static List<double[]> features(List<MergedRecord> rows) {
        List<double[]> features = new ArrayList<>(rows.size());
        for (MergedRecord row : rows) {
            features.add(row.features());
        }
        return features;
    }
}
