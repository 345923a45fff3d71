package io.github.genie.flake.core.support;

import io.github.genie.flake.core.IdGenerator;
import io.github.genie.flake.core.log.Log;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static io.github.genie.flake.core.support.FlakeLayout.BUCKET_NANOS;
import static io.github.genie.flake.core.support.FlakeLayout.SEQUENCE_MAX;
import static io.github.genie.flake.core.support.FlakeLayout.TIME_MAX;

public class FlakeIdGenerator implements IdGenerator {

    private static final Log log = Log.get(FlakeIdGenerator.class);

    private final Lock lock = new ReentrantLock();

    private final Instant epoch;
    private final long epochNanos;
    private final long epochBuckets;
    private final long epochRemainder;
    // last bucket whose start still fits in a long of nanoseconds
    private final long lastBucket;
    private final int generatorId;
    private final Clock clock;
    private final Sleeper sleeper;

    // guarded by lock
    private long bucket = -1;
    private long sequence = SEQUENCE_MAX;

    private FlakeIdGenerator(GeneratorConfig config) {
        this.epoch = config.getEpoch();
        this.epochNanos = config.getEpochNanos();
        this.epochBuckets = Math.floorDiv(epochNanos, BUCKET_NANOS);
        this.epochRemainder = Math.floorMod(epochNanos, BUCKET_NANOS);
        this.lastBucket = epochNanos < 0
                ? TIME_MAX
                : Math.min(TIME_MAX, (Long.MAX_VALUE - epochNanos) / BUCKET_NANOS);
        this.generatorId = config.getGeneratorId();
        this.clock = config.getClock();
        this.sleeper = config.getSleeper();
    }

    @Nullable
    public static FlakeIdGenerator create() {
        return create(new GeneratorConfig());
    }

    /**
     * @return the generator, or {@code null} if the epoch is ahead of the configured clock
     */
    @Nullable
    public static FlakeIdGenerator create(@NotNull GeneratorConfig config) {
        Objects.requireNonNull(config, "config");
        long now = config.getClock().now();
        if (config.getEpochNanos() > now) {
            log.debug(() -> "epoch " + config.getEpoch() + " is in the future, generator not created");
            return null;
        }
        FlakeIdGenerator generator = new FlakeIdGenerator(config);
        log.debug(() -> "generator " + config.getGeneratorId() + " created, epoch " + config.getEpoch());
        return generator;
    }

    @Override
    public long nextId() {
        lock.lock();
        try {
            boolean stall = false;
            long now = bucketsSince(clock.now());
            if (bucket < now) {
                bucket = now;
                sequence = 0;
            } else if (++sequence > SEQUENCE_MAX) {
                bucket++;
                sequence = 0;
                stall = true;
            }
            if (bucket > lastBucket) {
                log.warn(() -> "generator " + generatorId + " ran out of time buckets");
                throw new IllegalStateException("time bucket space exhausted");
            }
            if (stall) {
                awaitBucket(bucket);
            }
            return FlakeLayout.compose(bucket, sequence, generatorId);
        } finally {
            lock.unlock();
        }
    }

    // start of the bucket the id was issued in
    @NotNull
    public Instant timeOf(long id) {
        return epoch.plusNanos(FlakeLayout.decode(id).getTimeBucket() * BUCKET_NANOS);
    }

    public int getGeneratorId() {
        return generatorId;
    }

    public long getEpochBuckets() {
        return epochBuckets;
    }

    public Instant getEpoch() {
        return epoch;
    }

    // floor((nanos - epochNanos) / BUCKET_NANOS) without overflowing the subtraction
    private long bucketsSince(long nanos) {
        long buckets = Math.floorDiv(nanos, BUCKET_NANOS) - epochBuckets;
        return Math.floorMod(nanos, BUCKET_NANOS) < epochRemainder ? buckets - 1 : buckets;
    }

    // called with the lock held, later callers queue behind this one.
    // target <= lastBucket, so start does not overflow. An interrupted thread
    // spins here until the bucket starts.
    private void awaitBucket(long target) {
        long start = epochNanos + target * BUCKET_NANOS;
        long remaining = nanosUntil(start);
        if (remaining > 0) {
            log.trace(() -> "sequence exhausted, waiting " + remaining + "ns for bucket " + target);
        }
        for (long wait = remaining; wait > 0; wait = nanosUntil(start)) {
            sleeper.sleep(wait);
        }
    }

    private long nanosUntil(long start) {
        long now = clock.now();
        long remaining = start - now;
        // wrapped, the clock is far behind start
        return remaining < 0 && now < start ? Long.MAX_VALUE : remaining;
    }

}
