package com.wileyfuller.weatherenergy.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.function.IntFunction;

/**
 * Fixed attempt budget with a backoff between attempts.
 * <p>
 * Only {@link IOException}s are retried: non-2xx statuses, timeouts and connection failures all surface
 * as one. Anything else thrown by the call is a permanent error and propagates on the first attempt.
 */
public final class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final int maxAttempts;
    private final IntFunction<Duration> backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, IntFunction<Duration> backoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    /**
     * 3 attempts, waiting 2s after the first failure and 4s after the second.
     */
    public static RetryPolicy standard() {
        return standard(Sleeper.THREAD);
    }

    public static RetryPolicy standard(Sleeper sleeper) {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, attempt -> Duration.ofSeconds(2L * attempt), sleeper);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration backoffAfter(int attempt) {
        return backoff.apply(attempt);
    }

    public <T> T execute(String description, Call<T> call) throws FetchException {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (IOException e) {
                last = e;
                LOG.warn("Attempt {}/{} failed for {}: {}", attempt, maxAttempts, description, e.toString());
                if (attempt < maxAttempts) {
                    pause(description, backoff.apply(attempt));
                }
            }
        }
        throw new FetchException("Giving up on " + description + " after " + maxAttempts + " attempts", last);
    }

    private void pause(String description, Duration delay) throws FetchException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting to retry " + description, e);
        }
    }

    @FunctionalInterface
    public interface Call<T> {
        T call() throws IOException, FetchException;
    }
}
