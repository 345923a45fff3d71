package io.github.genie.flake.core.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Base62Test {

    @Test
    void shouldEncodeZeroAsSingleDigit() {
        assertEquals("0", Base62.encode(0));
        assertEquals(0, Base62.decode("0"));
    }

    @Test
    void shouldDecodeEmptyStringAsZero() {
        assertEquals(0, Base62.decode(""));
    }

    @Test
    void shouldMatchPinnedFixtures() {
        assertEquals("18OWG", Base62.encode(0x1000000));
        assertEquals(0x1000000, Base62.decode("18OWG"));

        assertEquals("2Gn2W", Base62.encode(0x2000000));
        assertEquals("4MV1b01dcO", Base62.encode(59061089258255360L));
        assertEquals("1ZlfarV", Base62.encode(89569285645L));
        assertEquals(89569285645L, Base62.decode("1ZlfarV"));
    }

    @Test
    void shouldTreatNegativeValuesAsUnsigned() {
        assertEquals("LygHa16AHYF", Base62.encode(-1L));
        assertEquals(-1L, Base62.decode("LygHa16AHYF"));
        assertEquals("AzL8n0Y58m7", Base62.encode(Long.MAX_VALUE));
        assertEquals(Long.MIN_VALUE, Base62.decode(Base62.encode(Long.MIN_VALUE)));
    }

    @Test
    void shouldNotEmitLeadingZeros() {
        assertEquals("1", Base62.encode(1));
        assertEquals("z", Base62.encode(61));
        assertEquals("10", Base62.encode(62));
    }

    @Test
    void shouldIgnoreLeadingZerosOnDecode() {
        assertEquals(Base62.decode("BM4fi"), Base62.decode("000BM4fi"));
    }

    @Test
    void shouldRoundTripSampledValues() {
        long value = 1;
        for (int i = 0; i < 200; i++) {
            assertEquals(value, Base62.decode(Base62.encode(value)));
            value = value * 31 + 7;
        }
    }

    @Test
    void shouldWrapAroundOnOverflow() {
        assertEquals(-1913450501271711745L, Base62.decode("zzzzzzzzzzzz"));
    }

    @Test
    void shouldRejectCharactersOutsideAlphabet() {
        InvalidBase62Exception e = assertThrows(InvalidBase62Exception.class, () -> Base62.decode("2Gn-2W"));
        assertEquals("2Gn-2W", e.getInput());
        assertEquals(3, e.getIndex());

        assertThrows(InvalidBase62Exception.class, () -> Base62.decode("abé"));
        assertThrows(InvalidBase62Exception.class, () -> Base62.decode(" 1"));
    }
}
