package com.wileyfuller.weatherenergy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wileyfuller.weatherenergy.anomaly.AnomalyDetector;
import com.wileyfuller.weatherenergy.anomaly.OutlierModel;
import com.wileyfuller.weatherenergy.anomaly.OutlierModels;
import com.wileyfuller.weatherenergy.config.ApiKeys;
import com.wileyfuller.weatherenergy.config.ConfigException;
import com.wileyfuller.weatherenergy.config.ConfigLoader;
import com.wileyfuller.weatherenergy.config.PipelineConfig;
import com.wileyfuller.weatherenergy.fetch.ApiClient;
import com.wileyfuller.weatherenergy.fetch.EnergyFetcher;
import com.wileyfuller.weatherenergy.fetch.FetchCache;
import com.wileyfuller.weatherenergy.fetch.FetchException;
import com.wileyfuller.weatherenergy.fetch.RetryPolicy;
import com.wileyfuller.weatherenergy.fetch.WeatherFetcher;
import com.wileyfuller.weatherenergy.model.AnomalyRecord;
import com.wileyfuller.weatherenergy.model.CityDescriptor;
import com.wileyfuller.weatherenergy.model.EnergyObservation;
import com.wileyfuller.weatherenergy.model.MergedRecord;
import com.wileyfuller.weatherenergy.model.QualityReport;
import com.wileyfuller.weatherenergy.model.WeatherObservation;
import com.wileyfuller.weatherenergy.quality.DataQualityChecker;
import com.wileyfuller.weatherenergy.store.DataLayout;
import com.wileyfuller.weatherenergy.store.MergedDatasetStore;
import com.wileyfuller.weatherenergy.store.RawStore;
import com.wileyfuller.weatherenergy.store.ReportStore;
import com.wileyfuller.weatherenergy.transform.MergeEngine;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import static java.util.stream.Collectors.toList;

/**
 * Runs the weather/energy pipeline one stage at a time:
 * fetch, merge, quality and anomalies. Each stage reads the previous stage's files and overwrites its own.
 */
public class Pipeline {

    private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

    private final PipelineConfig config;
    private final DataLayout layout;
    private final Clock clock;
    private final RawStore rawStore;
    private final MergedDatasetStore datasetStore = new MergedDatasetStore();

    public Pipeline(PipelineConfig config, Clock clock) {
        this.config = config;
        this.layout = new DataLayout(config.getGeneral().getDataPath());
        this.clock = clock;
        this.rawStore = new RawStore(layout);
    }

    public static void main(String[] args) throws ClassNotFoundException {
        Class.forName("org.sqlite.JDBC");

        System.exit(run(args));
    }

    /**
     * @return process exit status
     */
    public static int run(String[] args) {

        Options options = new Options();
        options.addOption("fetch", "Fetch weather and energy data for every city into the raw store.");
        options.addOption("merge", "Join the raw weather and energy data into merged_data.csv.");
        options.addOption("quality", "Write quality_report.json for the merged data.");
        options.addOption("anomalies", "Write anomalies.csv for the merged data.");
        options.addOption("all", "Run fetch, merge, quality and anomalies in order.");
        options.addOption("refresh", "Ignore cached API responses when fetching.");
        options.addOption(Option.builder("config").hasArg().argName("file")
                .desc("Config file (default " + ConfigLoader.DEFAULT_CONFIG_PATH + ").").build());

        CommandLine cmd;
        try {
            CommandLineParser parser = new DefaultParser();
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            LOG.error(e.getMessage());
            printHelp(options);
            return 1;
        }

        List<String> stages = new ArrayList<>();
        for (String stage : new String[]{"fetch", "merge", "quality", "anomalies", "all"}) {
            if (cmd.hasOption(stage)) {
                stages.add(stage);
            }
        }
        if (stages.size() != 1) {
            printHelp(options);
            return 1;
        }

        try {
            PipelineConfig config = ConfigLoader.load(Paths.get(cmd.getOptionValue("config",
                    ConfigLoader.DEFAULT_CONFIG_PATH)), cmd.hasOption("config"));
            Pipeline pipeline = new Pipeline(config, Clock.systemDefaultZone());
            boolean refresh = cmd.hasOption("refresh");
            switch (stages.get(0)) {
                case "fetch":
                    pipeline.fetchData(refresh);
                    break;
                case "merge":
                    pipeline.mergeData();
                    break;
                case "quality":
                    pipeline.checkQuality();
                    break;
                case "anomalies":
                    pipeline.detectAnomalies();
                    break;
                default:
                    pipeline.runAll(refresh);
            }
            return 0;
        } catch (PipelineException e) {
            LOG.error("Stage failed: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            LOG.error("Stage failed writing or reading artifacts", e);
            return 1;
        }
    }

    private static void printHelp(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("weather-energy-pipeline", options);
    }

    public void runAll(boolean refresh) throws PipelineException, IOException {
        fetchData(refresh);
        mergeData();
        checkQuality();
        detectAnomalies();
    }

    /**
     * Builds the HTTP client, fetch cache and both fetchers from the environment's API keys, then fetches.
     */
    public FetchSummary fetchData(boolean refresh) throws PipelineException, IOException {
        ApiKeys keys = ConfigLoader.loadApiKeys();
        PipelineConfig.General general = config.getGeneral();

        FetchCache cache;
        try {
            cache = FetchCache.open(layout.fetchCache(), Duration.ofHours(general.getCacheTtlHours()), clock);
        } catch (SQLException e) {
            throw new PipelineException("Could not open fetch cache at " + layout.fetchCache(), e);
        }

        try (FetchCache ignored = cache;
             ApiClient client = new ApiClient(ApiClient.createHttpClient(ApiClient.DEFAULT_TIMEOUT_MS),
                     RetryPolicy.standard(), cache, refresh, new ObjectMapper())) {
            WeatherFetcher weatherFetcher = new WeatherFetcher(client, keys.getNoaa());
            EnergyFetcher energyFetcher = new EnergyFetcher(client, keys.getEia(),
                    general.isEnergyFallbackToAllRows());
            FetchSummary summary = fetchData(weatherFetcher, energyFetcher);
            LOG.info("Sent {} API requests", client.getRequestsSent());
            return summary;
        }
    }

    public FetchSummary fetchData(WeatherFetcher weatherFetcher, EnergyFetcher energyFetcher)
            throws PipelineException, IOException {
        // yesterday is the last day both sources are sure to have
        LocalDate endDate = LocalDate.now(clock).minusDays(1);
        LocalDate startDate = endDate.minusDays(config.getGeneral().getFetchDays());
        List<CityDescriptor> cities = config.getCities();
        LOG.info("Fetching {} to {} for {} cities", startDate, endDate, cities.size());

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1,
                Math.min(config.getGeneral().getFetchWorkers(), cities.size())));
        List<Future<CityFetch>> futures = new ArrayList<>();
        try {
            for (CityDescriptor city : cities) {
                futures.add(pool.submit(() -> fetchCity(city, weatherFetcher, energyFetcher, startDate, endDate)));
            }

            List<WeatherObservation> allWeather = new ArrayList<>();
            List<EnergyObservation> allEnergy = new ArrayList<>();
            List<String> failedWeather = new ArrayList<>();
            List<String> failedEnergy = new ArrayList<>();

            // collect in config order so the concatenations do not depend on thread timing
            for (int i = 0; i < cities.size(); i++) {
                CityDescriptor city = cities.get(i);
                CityFetch result = await(city, futures.get(i));

                if (result.weather.isEmpty()) {
                    failedWeather.add(city.getName());
                    rawStore.deleteWeather(city);
                } else {
                    rawStore.writeWeather(city, result.weather);
                    allWeather.addAll(result.weather);
                }
                if (result.energy.isEmpty()) {
                    failedEnergy.add(city.getName());
                    rawStore.deleteEnergy(city);
                } else {
                    rawStore.writeEnergy(city, result.energy);
                    allEnergy.addAll(result.energy);
                }
            }

            rawStore.writeAllWeather(allWeather);
            rawStore.writeAllEnergy(allEnergy);

            LOG.info("Weather: {}/{} cities, {} rows. Failed: {}", cities.size() - failedWeather.size(),
                    cities.size(), allWeather.size(), failedWeather);
            LOG.info("Energy: {}/{} cities, {} rows. Failed: {}", cities.size() - failedEnergy.size(),
                    cities.size(), allEnergy.size(), failedEnergy);
            return new FetchSummary(allWeather, allEnergy, failedWeather, failedEnergy);
        } finally {
            pool.shutdownNow();
        }
    }

    private CityFetch await(CityDescriptor city, Future<CityFetch> future) throws PipelineException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while fetching " + city.getName(), e);
        } catch (ExecutionException e) {
            LOG.error("Fetch for {} crashed", city.getName(), e.getCause());
            return new CityFetch(new ArrayList<>(), new ArrayList<>());
        }
    }

    private CityFetch fetchCity(CityDescriptor city, WeatherFetcher weatherFetcher, EnergyFetcher energyFetcher,
                                LocalDate startDate, LocalDate endDate) {
        List<WeatherObservation> weather = new ArrayList<>();
        try {
            weather = weatherFetcher.fetchWeather(city, startDate, endDate);
            if (weather.isEmpty()) {
                LOG.error("No weather data returned for {}", city.getName());
            }
        } catch (FetchException e) {
            LOG.error("Failed to fetch weather data for {}: {}", city.getName(), e.getMessage(), e);
        }

        List<EnergyObservation> energy = new ArrayList<>();
        try {
            energy = energyFetcher.fetchEnergy(city, startDate, endDate);
            if (energy.isEmpty()) {
                LOG.error("No energy data returned for {}", city.getName());
            }
        } catch (FetchException e) {
            LOG.error("Failed to fetch energy data for {}: {}", city.getName(), e.getMessage(), e);
        }
        return new CityFetch(weather, energy);
    }

    public List<MergedRecord> mergeData() throws PipelineException, IOException {
        LOG.info("Cleaning weather data...");
        List<WeatherObservation> weather = rawStore.readAllWeather();
        LOG.info("Cleaning energy data...");
        List<EnergyObservation> energy = rawStore.readAllEnergy();

        LOG.info("Merging datasets...");
        List<MergedRecord> merged = new MergeEngine().merge(weather, energy);
        datasetStore.write(layout.mergedData(), merged);

        List<String> cities = merged.stream().map(MergedRecord::getCity).distinct().collect(toList());
        LOG.info("Merged data saved to {}: {} rows for {} cities {}", layout.mergedData(), merged.size(),
                cities.size(), cities);
        return merged;
    }

    public QualityReport checkQuality() throws PipelineException, IOException {
        List<MergedRecord> merged = datasetStore.read(layout.mergedData());
        QualityReport report = new DataQualityChecker(clock).check(merged);
        new ReportStore().write(layout.qualityReport(), report);
        LOG.info("Quality report saved to {}", layout.qualityReport());
        return report;
    }

    public List<AnomalyRecord> detectAnomalies() throws PipelineException, IOException {
        Supplier<OutlierModel> models;
        try {
            models = OutlierModels.forName(config.getGeneral().getAnomalyModel());
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), e);
        }
        List<MergedRecord> merged = datasetStore.read(layout.mergedData());
        List<AnomalyRecord> anomalies = new AnomalyDetector(models).detect(merged);
        datasetStore.write(layout.anomalies(), anomalies.stream().map(AnomalyRecord::getRecord).collect(toList()));
        LOG.info("Saved {} anomalies to {}", anomalies.size(), layout.anomalies());
        return anomalies;
    }

    public DataLayout getLayout() {
        return layout;
    }

    private static final class CityFetch {
        final List<WeatherObservation> weather;
        final List<EnergyObservation> energy;

        CityFetch(List<WeatherObservation> weather, List<EnergyObservation> energy) {
            this.weather = weather;
            this.energy = energy;
        }
    }
}
