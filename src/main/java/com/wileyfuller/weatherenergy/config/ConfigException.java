package com.wileyfuller.weatherenergy.config;

import com.wileyfuller.weatherenergy.PipelineException;

public class ConfigException extends PipelineException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
