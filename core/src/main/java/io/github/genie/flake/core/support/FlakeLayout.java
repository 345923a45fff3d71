package io.github.genie.flake.core.support;

import io.github.genie.flake.core.codec.Base62;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;

/**
 * Bit layout of a flake ID.
 * <pre>
 *  1 bit  reserved, always 0
 * 38 bits time bucket, 10 ms units since the generator epoch
 * 13 bits sequence within the bucket
 * 12 bits generator ID
 * </pre>
 * The layout gives a lifetime of ~87 years after the epoch, 8192 IDs per bucket
 * and 4096 distinct generators.
 */
public final class FlakeLayout {

    public static final int TIME_BITS = 38;
    public static final int SEQUENCE_BITS = 13;
    public static final int GENERATOR_ID_BITS = 63 - TIME_BITS - SEQUENCE_BITS;

    public static final long BUCKET_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    public static final long TIME_MAX = (1L << TIME_BITS) - 1;
    public static final long SEQUENCE_MAX = (1L << SEQUENCE_BITS) - 1;
    public static final int GENERATOR_ID_MAX = (1 << GENERATOR_ID_BITS) - 1;

    static final int TIME_SHIFT = SEQUENCE_BITS + GENERATOR_ID_BITS;
    static final int SEQUENCE_SHIFT = GENERATOR_ID_BITS;

    private FlakeLayout() {
    }

    public static long compose(long bucket, long sequence, int generatorId) {
        return bucket << TIME_SHIFT | sequence << SEQUENCE_SHIFT | generatorId;
    }

    // a non-zero msb means the value did not come from a generator
    @NotNull
    public static DecodedId decode(long id) {
        return new DecodedId(
                id,
                id >>> 63,
                id >>> TIME_SHIFT & TIME_MAX,
                id >>> SEQUENCE_SHIFT & SEQUENCE_MAX,
                id & GENERATOR_ID_MAX
        );
    }

    @NotNull
    public static String encode(long id) {
        return Base62.encode(id);
    }

    public static long decodeEncoded(@NotNull String encoded) {
        return Base62.decode(encoded);
    }

}
