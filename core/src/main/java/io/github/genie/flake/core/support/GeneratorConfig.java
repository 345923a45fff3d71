package io.github.genie.flake.core.support;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Objects;

public class GeneratorConfig {

    public static final int DEFAULT_GENERATOR_ID = 0;
    /**
     * 2020-01-01T00:00:00Z
     */
    public static final Instant DEFAULT_EPOCH = Instant.ofEpochSecond(1577836800L);

    private final int generatorId;
    private final Instant epoch;
    private final Clock clock;
    private final Sleeper sleeper;

    public GeneratorConfig() {
        this(DEFAULT_GENERATOR_ID, DEFAULT_EPOCH, Clock.DEFAULT, Sleeper.DEFAULT);
    }

    private GeneratorConfig(int generatorId, Instant epoch, Clock clock, Sleeper sleeper) {
        this.generatorId = generatorId;
        this.epoch = epoch;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getGeneratorId() {
        return generatorId;
    }

    public Instant getEpoch() {
        return epoch;
    }

    public long getEpochNanos() {
        return Clock.toNanos(epoch);
    }

    public Clock getClock() {
        return clock;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public static class Builder {
        private int generatorId = DEFAULT_GENERATOR_ID;
        private Instant epoch = DEFAULT_EPOCH;
        private Clock clock = Clock.DEFAULT;
        private Sleeper sleeper = Sleeper.DEFAULT;

        private Builder() {
        }

        // must be unique across generators
        public Builder generatorId(int generatorId) {
            if (generatorId < 0 || generatorId > FlakeLayout.GENERATOR_ID_MAX) {
                throw new IllegalArgumentException(
                        "generator id " + generatorId + " out of bounds [0, " + FlakeLayout.GENERATOR_ID_MAX + "]"
                );
            }
            this.generatorId = generatorId;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the epoch is outside the range of a long of
         *                                  nanoseconds since 1970, about years 1677 to 2262
         */
        public Builder epoch(@NotNull Instant epoch) {
            Objects.requireNonNull(epoch, "epoch");
            try {
                Clock.toNanos(epoch);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("epoch " + epoch + " out of range", e);
            }
            this.epoch = epoch;
            return this;
        }

        public Builder clock(@NotNull Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder sleeper(@NotNull Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public GeneratorConfig build() {
            return new GeneratorConfig(generatorId, epoch, clock, sleeper);
        }
    }

}
