package com.aliasmail.delivery;

import java.time.Duration;

/**
 * Blocking pause, replaceable in tests
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
