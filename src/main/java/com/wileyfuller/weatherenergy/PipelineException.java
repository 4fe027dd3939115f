package com.wileyfuller.weatherenergy;

/**
 * A failure that aborts the current stage. The command line exits non-zero on it.
 */
public class PipelineException extends Exception {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
