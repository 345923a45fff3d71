package io.github.genie.flake.core.support;

import java.time.Instant;

@FunctionalInterface
public interface Clock {

    long NANOS_PER_SECOND = 1_000_000_000L;

    Clock DEFAULT = () -> toNanos(Instant.now());

    // nanoseconds since 1970-01-01T00:00:00Z
    long now();

    // ArithmeticException when the instant does not fit in a long
    static long toNanos(Instant instant) {
        long seconds = instant.getEpochSecond();
        long nanos = instant.getNano();
        if (seconds < 0) {
            seconds++;
            nanos -= NANOS_PER_SECOND;
        }
        return Math.addExact(Math.multiplyExact(seconds, NANOS_PER_SECOND), nanos);
    }

}
