package com.nodeproxy.proxy.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Time-based freshness: a value stamped at {@code t} is fresh while {@code now < t + window}.
 */
public final class FreshnessWindow {

    private final Clock clock;
    private final Duration window;

    public FreshnessWindow(Clock clock, Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("window must be non-negative");
        }
        this.clock = clock;
        this.window = window;
    }

    public boolean isFresh(Instant stampedAt) {
        return stampedAt != null && now().isBefore(stampedAt.plus(window));
    }

    public Instant now() {
        return clock.instant();
    }
}
