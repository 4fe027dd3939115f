package com.wileyfuller.weatherenergy.fetch;

/**
 * A city's data could not be fetched. The orchestrator logs it and carries on with the other cities.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
