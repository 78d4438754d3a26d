package com.aliasmail.delivery;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window throttle: at most {@code maxPerWindow} starts per key inside any window.
 * {@link #acquire(String)} blocks until a slot frees up; it never rejects.
 */
@Slf4j
public class SlidingWindowRateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int maxPerWindow;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(int maxPerWindow, Duration window, Clock clock, Sleeper sleeper) {
        if (maxPerWindow <= 0) {
            throw new IllegalArgumentException("maxPerWindow must be positive");
        }
        this.maxPerWindow = maxPerWindow;
        this.window = window;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public SlidingWindowRateLimiter(int maxPerMinute) {
        this(maxPerMinute, DEFAULT_WINDOW, Clock.systemUTC(), Sleeper.system());
    }

    /**
     * Waits for a free slot under {@code key} and records the start.
     * An interrupt ends the wait early; the flag is restored and the start is recorded anyway.
     */
    public void acquire(String key) {
        Deque<Instant> timestamps = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
        while (true) {
            Duration wait;
            synchronized (timestamps) {
                Instant now = clock.instant();
                expireOldEntries(timestamps, now);
                if (timestamps.size() < maxPerWindow) {
                    timestamps.addLast(now);
                    return;
                }
                wait = Duration.between(now, timestamps.peekFirst().plus(window));
            }

            log.debug("Rate limit reached for {}, waiting {} ms", key, wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while rate limited on {}, proceeding", key);
                synchronized (timestamps) {
                    timestamps.addLast(clock.instant());
                }
                return;
            }
        }
    }

    /**
     * Time until {@code key} has a free slot, zero when one is available now
     */
    public Duration timeUntilAvailable(String key) {
        Deque<Instant> timestamps = windows.get(key);
        if (timestamps == null) {
            return Duration.ZERO;
        }
        synchronized (timestamps) {
            Instant now = clock.instant();
            expireOldEntries(timestamps, now);
            if (timestamps.size() < maxPerWindow) {
                return Duration.ZERO;
            }
            return Duration.between(now, timestamps.peekFirst().plus(window));
        }
    }

    private void expireOldEntries(Deque<Instant> timestamps, Instant now) {
        Instant cutoff = now.minus(window);
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
