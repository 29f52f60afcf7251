package io.artifactmesh.util;

import java.time.Duration;

/**
 * Doubling poll interval capped at a maximum: 5s, 10s, 20s, 20s, ...
 */
public final class Backoff {
    private final Duration max;
    private Duration current;

    public Backoff(Duration initial, Duration max) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial interval must be positive");
        }
        this.current = initial;
        this.max = max.compareTo(initial) < 0 ? initial : max;
    }

    public Duration next() {
        Duration out = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        return out;
    }
}
