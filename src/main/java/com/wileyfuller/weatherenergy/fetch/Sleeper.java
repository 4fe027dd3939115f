package com.wileyfuller.weatherenergy.fetch;

import java.time.Duration;

/**
 * Blocks between retry attempts. Tests substitute one that records instead of waiting.
 */
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
