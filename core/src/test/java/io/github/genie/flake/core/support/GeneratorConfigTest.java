package io.github.genie.flake.core.support;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorConfigTest {

    @Test
    void shouldUseDefaults() {
        GeneratorConfig config = new GeneratorConfig();

        assertEquals(0, config.getGeneratorId());
        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), config.getEpoch());
        assertEquals(1577836800000000000L, config.getEpochNanos());
        assertSame(Clock.DEFAULT, config.getClock());
        assertSame(Sleeper.DEFAULT, config.getSleeper());
    }

    @Test
    void shouldApplyBuilderSettings() {
        Clock clock = () -> 42L;
        Sleeper sleeper = nanos -> {
        };
        Instant epoch = Instant.parse("2001-02-03T04:05:06.007Z");

        GeneratorConfig config = GeneratorConfig.builder()
                .generatorId(12)
                .epoch(epoch)
                .clock(clock)
                .sleeper(sleeper)
                .build();

        assertEquals(12, config.getGeneratorId());
        assertEquals(epoch, config.getEpoch());
        assertEquals(981173106007000000L, config.getEpochNanos());
        assertSame(clock, config.getClock());
        assertSame(sleeper, config.getSleeper());
    }

    @Test
    void shouldRejectNullSettings() {
        GeneratorConfig.Builder builder = GeneratorConfig.builder();
        assertThrows(NullPointerException.class, () -> builder.epoch(null));
        assertThrows(NullPointerException.class, () -> builder.clock(null));
        assertThrows(NullPointerException.class, () -> builder.sleeper(null));
    }

    @Test
    void shouldReadSystemTime() {
        long before = Clock.toNanos(Instant.now());
        long now = Clock.DEFAULT.now();
        long after = Clock.toNanos(Instant.now());

        assertTrue(now >= before);
        assertTrue(now <= after);
    }

    @Test
    void shouldAcceptEpochsAtNanosecondLimits() {
        Instant earliest = Instant.ofEpochSecond(0, Long.MIN_VALUE);
        Instant latest = Instant.ofEpochSecond(0, Long.MAX_VALUE);

        assertEquals(Long.MIN_VALUE, GeneratorConfig.builder().epoch(earliest).build().getEpochNanos());
        assertEquals(Long.MAX_VALUE, GeneratorConfig.builder().epoch(latest).build().getEpochNanos());
        assertThrows(IllegalArgumentException.class, () -> GeneratorConfig.builder().epoch(latest.plusNanos(1)));
        assertThrows(IllegalArgumentException.class, () -> GeneratorConfig.builder().epoch(earliest.minusNanos(1)));
    }

    @Test
    void shouldConvertInstantsBeforeUnixTime() {
        assertEquals(-1L, Clock.toNanos(Instant.ofEpochSecond(0, -1)));
        assertEquals(-1_500_000_000L, Clock.toNanos(Instant.parse("1969-12-31T23:59:58.500Z")));
        assertThrows(ArithmeticException.class, () -> Clock.toNanos(Instant.parse("1600-01-01T00:00:00Z")));
    }
}
