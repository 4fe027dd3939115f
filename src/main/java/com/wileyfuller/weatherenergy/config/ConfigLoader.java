package com.wileyfuller.weatherenergy.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.wileyfuller.weatherenergy.model.CityDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads the pipeline configuration from YAML and the API keys from the environment.
 * Fails fast on anything missing or inconsistent.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_PATH = "config/config.yaml";
    static final String BUNDLED_CONFIG = "/config.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigLoader() {}

    /**
     * Reads the given file. A missing file is an error.
     */
    public static PipelineConfig load(Path path) throws ConfigException {
        return load(path, true);
    }

    /**
     * @param explicit whether the path was asked for by the user. Only an implicit path may fall back to the
     *                 bundled default when the file does not exist.
     */
    public static PipelineConfig load(Path path, boolean explicit) throws ConfigException {
        PipelineConfig config;
        if (explicit && (path == null || !Files.isRegularFile(path))) {
            throw new ConfigException("Config file not found: " + path);
        }
        if (path != null && Files.isRegularFile(path)) {
            LOG.info("Loading config from {}", path);
            try (InputStream in = Files.newInputStream(path)) {
                config = YAML.readValue(in, PipelineConfig.class);
            } catch (IOException e) {
                throw new ConfigException("Could not read config file " + path, e);
            }
        } else {
            LOG.info("No config file at {}, using bundled defaults", path);
            try (InputStream in = ConfigLoader.class.getResourceAsStream(BUNDLED_CONFIG)) {
                if (in == null) {
                    throw new ConfigException("Bundled config " + BUNDLED_CONFIG + " is missing from the classpath");
                }
                config = YAML.readValue(in, PipelineConfig.class);
            } catch (IOException e) {
                throw new ConfigException("Could not read bundled config", e);
            }
        }
        validate(config);
        LOG.info("Loaded config for {} cities", config.getCities().size());
        return config;
    }

    static void validate(PipelineConfig config) throws ConfigException {
        if (config == null || config.getGeneral() == null) {
            throw new ConfigException("Config has no 'general' section");
        }
        PipelineConfig.General general = config.getGeneral();
        if (general.getFetchDays() <= 0) {
            throw new ConfigException("general.fetch_days must be positive, was " + general.getFetchDays());
        }
        if (general.getFetchWorkers() <= 0) {
            throw new ConfigException("general.fetch_workers must be positive, was " + general.getFetchWorkers());
        }
        if (general.getCacheTtlHours() < 0) {
            throw new ConfigException("general.cache_ttl_hours must not be negative");
        }
        if (config.getCities().isEmpty()) {
            throw new ConfigException("Config lists no cities");
        }
        Set<String> names = new HashSet<>();
        for (CityDescriptor city : config.getCities()) {
            if (isBlank(city.getName())) {
                throw new ConfigException("A city entry has no name");
            }
            if (isBlank(city.getWeatherStationId())) {
                throw new ConfigException("City " + city.getName() + " has no noaa_station_id");
            }
            if (isBlank(city.getEnergyRegionId())) {
                throw new ConfigException("City " + city.getName() + " has no eia_region_code");
            }
            if (!names.add(city.getName())) {
                throw new ConfigException("City " + city.getName() + " is listed twice");
            }
        }
    }

    public static ApiKeys loadApiKeys() throws ConfigException {
        return loadApiKeys(System::getenv);
    }

    public static ApiKeys loadApiKeys(Function<String, String> env) throws ConfigException {
        return new ApiKeys(getRequired(env, ApiKeys.NOAA_ENV), getRequired(env, ApiKeys.EIA_ENV));
    }

    private static String getRequired(Function<String, String> env, String key) throws ConfigException {
        Optional<String> value = Optional.ofNullable(env.apply(key)).filter(s -> !s.isEmpty());
        if (!value.isPresent()) {
            throw new ConfigException("Required environment variable not set or empty: " + key);
        }
        return value.get();
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
