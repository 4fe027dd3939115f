package com.wileyfuller.weatherenergy.anomaly;

import com.wileyfuller.weatherenergy.model.AnomalyRecord;
import com.wileyfuller.weatherenergy.model.MergedRecord;
import com.wileyfuller.weatherenergy.quality.DataQualityChecker;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyDetectorTest {

    private final AnomalyDetector detector = new AnomalyDetector(OutlierModels.forName("isolation_forest"));

    private static MergedRecord negativeDay(String city, LocalDate date) {
        return new MergedRecord(date, city, 62.0, 15.0, -500.0);
    }

    @Test
    void testFlagsNegativeEnergyDayAndSkipsSmallCity() {
        List<MergedRecord> merged = new ArrayList<>(AnomalyFixtures.cleanDays("Alpha", 15, 1000.0));
        MergedRecord bad = negativeDay("Alpha", AnomalyFixtures.START.plusDays(15));
        merged.add(bad);
        merged.addAll(AnomalyFixtures.cleanDays("Beta", 8, 800.0));

        List<AnomalyRecord> anomalies = detector.detect(merged);

        assertThat(anomalies).extracting(AnomalyRecord::getRecord).containsExactly(bad);
        assertThat(new DataQualityChecker(Clock.systemUTC()).check(merged)
                .getOutliers().getNegativeEnergyReadings()).isEqualTo(1);
    }

    @Test
    void testNineRowsAreSkippedTenAreScored() {
        List<MergedRecord> nine = new ArrayList<>(AnomalyFixtures.cleanDays("Alpha", 8, 1000.0));
        nine.add(negativeDay("Alpha", AnomalyFixtures.START.plusDays(8)));
        assertThat(detector.detect(nine)).isEmpty();

        List<MergedRecord> ten = new ArrayList<>(AnomalyFixtures.cleanDays("Alpha", 9, 1000.0));
        ten.add(negativeDay("Alpha", AnomalyFixtures.START.plusDays(9)));
        assertThat(detector.detect(ten)).isNotEmpty();
    }

    @Test
    void testRowsWithMissingFeaturesDoNotCount() {
        List<MergedRecord> merged = new ArrayList<>(AnomalyFixtures.cleanDays("Alpha", 9, 1000.0));
        merged.add(new MergedRecord(AnomalyFixtures.START.plusDays(9), "Alpha", null, null, -500.0));

        assertThat(detector.detect(merged)).isEmpty();
        assertThat(detector.usableRowsByCity(merged).get("Alpha")).hasSize(9);
    }

    @Test
    void testEachCityJudgedAgainstItsOwnBaseline() {
        List<MergedRecord> merged = new ArrayList<>();
        merged.addAll(AnomalyFixtures.cleanDays("Big", 20, 500000.0));
        MergedRecord bigSpike = new MergedRecord(AnomalyFixtures.START.plusDays(20), "Big", 62.0, 15.0, 900000.0);
        merged.add(bigSpike);
        merged.addAll(AnomalyFixtures.cleanDays("Small", 20, 1000.0));
        MergedRecord smallDip = negativeDay("Small", AnomalyFixtures.START.plusDays(20));
        merged.add(smallDip);

        List<AnomalyRecord> anomalies = detector.detect(merged);

        assertThat(anomalies).extracting(AnomalyRecord::getRecord).containsExactly(bigSpike, smallDip);
    }

    @Test
    void testDetectionIsReproducible() {
        List<MergedRecord> merged = new ArrayList<>(AnomalyFixtures.cleanDays("Alpha", 40, 1000.0));
        merged.add(negativeDay("Alpha", AnomalyFixtures.START.plusDays(40)));

        List<AnomalyRecord> first = detector.detect(merged);
        List<AnomalyRecord> second = detector.detect(merged);

        assertThat(first).extracting(AnomalyRecord::getRecord)
                .containsExactlyElementsOf(second.stream().map(AnomalyRecord::getRecord)
                        .collect(Collectors.toList()));
        assertThat(first).extracting(AnomalyRecord::getScore)
                .containsExactlyElementsOf(second.stream().map(AnomalyRecord::getScore)
                        .collect(Collectors.toList()));
    }

    @Test
    void testFitModelsOnlyForEligibleCities() {
        List<MergedRecord> merged = new ArrayList<>(AnomalyFixtures.cleanDays("Alpha", 12, 1000.0));
        merged.addAll(AnomalyFixtures.cleanDays("Beta", 5, 1000.0));

        Map<String, OutlierModel> models = detector.fitModels(detector.usableRowsByCity(merged));

        assertThat(models).containsOnlyKeys("Alpha");
    }

    @Test
    void testRobustZScoreModelAlsoFlagsNegativeDay() {
        AnomalyDetector robust = new AnomalyDetector(OutlierModels.forName("robust_zscore"));
        List<MergedRecord> merged = new ArrayList<>(AnomalyFixtures.cleanDays("Alpha", 15, 1000.0));
        MergedRecord bad = negativeDay("Alpha", AnomalyFixtures.START.plusDays(15));
        merged.add(bad);

        assertThat(robust.detect(merged)).extracting(AnomalyRecord::getRecord).containsExactly(bad);
    }

    @Test
    void testUnknownModelNameIsRejected() {
        assertThatThrownBy(() -> OutlierModels.forName("svm"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("svm");
    }
}
