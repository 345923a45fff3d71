package io.github.genie.flake.core.codec;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Base62 codec for unsigned 64-bit values, alphabet {@code [0-9][A-Z][a-z]}.
 * A negative {@code long} is treated as its unsigned counterpart.
 */
public final class Base62 {

    public static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private static final int BASE = 62;

    // 2^64 - 1 needs 11 symbols
    private static final int MAX_LENGTH = 11;

    private static final int[] INDEX = new int[128];

    static {
        Arrays.fill(INDEX, -1);
        for (int i = 0; i < BASE; i++) {
            INDEX[ALPHABET.charAt(i)] = i;
        }
    }

    private Base62() {
    }

    @NotNull
    public static String encode(long value) {
        if (value == 0) {
            return "0";
        }
        char[] buf = new char[MAX_LENGTH];
        int pos = MAX_LENGTH;
        long q = value;
        while (q != 0) {
            buf[--pos] = ALPHABET.charAt((int) Long.remainderUnsigned(q, BASE));
            q = Long.divideUnsigned(q, BASE);
        }
        return new String(buf, pos, MAX_LENGTH - pos);
    }

    /**
     * Decodes most significant symbol first. The empty string decodes to 0.
     * Values past 64 bits wrap around.
     *
     * @throws InvalidBase62Exception on the first character outside the alphabet
     */
    public static long decode(@NotNull String encoded) {
        long result = 0;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            int digit = c < INDEX.length ? INDEX[c] : -1;
            if (digit < 0) {
                throw new InvalidBase62Exception(encoded, i);
            }
            result = result * BASE + digit;
        }
        return result;
    }

}
