package io.github.drompincen.collabsync.runtime.connection;

import java.time.Duration;

/**
 * Exponential reconnect delay: {@code base * 2^attempt}, never more than {@code max}.
 */
public record BackoffPolicy(Duration base, Duration max) {

    public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

    public BackoffPolicy {
        if (base == null) base = DEFAULT_BASE;
        if (max == null) max = DEFAULT_MAX;
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_MAX);
    }

    public Duration delayFor(int attempt) {
        if (attempt < 0) attempt = 0;
        // keeps the shift from overflowing
        if (attempt >= 31) return max;
        Duration delay = base.multipliedBy(1L << attempt);
        return delay.compareTo(max) > 0 ? max : delay;
    }
}
