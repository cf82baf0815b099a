// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * Test the canonical 64-bit word used in hashing: NaN and zero collapse
 * to single values, and the word depends on the value, not the width
 * of the type holding it.
 */
class CanonicalBitsTest {

    /** Bit patterns of {@code double} NaNs of several sorts. */
    static final long[] DOUBLE_NANS = {0x7ff8000000000000L, // canonical
            0x7ff0000000000001L, // signalling
            0xfff8000000000000L, // negative
            0x7ff8dead0000beefL, // with payload
            0xffffffffffffffffL};

    /** Bit patterns of {@code float} NaNs of several sorts. */
    static final int[] FLOAT_NANS = {0x7fc00000, // canonical
            0x7f800001, // signalling
            0xffc00000, // negative
            0x7fc0beef, // with payload
            0xffffffff};

    @Nested
    @DisplayName("Special values collapse")
    class SpecialValues {

        @Test
        void doubleNaNs() {
            for (long bits : DOUBLE_NANS) {
                double nan = Double.longBitsToDouble(bits);
                assertEquals(CanonicalBits.CANONICAL_NAN_BITS,
                        CanonicalBits.of(nan),
                        () -> String.format("NaN %#x", bits));
            }
        }

        @Test
        void floatNaNs() {
            for (int bits : FLOAT_NANS) {
                float nan = Float.intBitsToFloat(bits);
                assertEquals(CanonicalBits.CANONICAL_NAN_BITS,
                        CanonicalBits.of(nan),
                        () -> String.format("NaN %#x", bits));
            }
        }

        @Test
        void signedZeros() {
            assertEquals(CanonicalBits.CANONICAL_ZERO_BITS,
                    CanonicalBits.of(0.0));
            assertEquals(CanonicalBits.CANONICAL_ZERO_BITS,
                    CanonicalBits.of(-0.0));
            assertEquals(CanonicalBits.CANONICAL_ZERO_BITS,
                    CanonicalBits.of(0.0f));
            assertEquals(CanonicalBits.CANONICAL_ZERO_BITS,
                    CanonicalBits.of(-0.0f));
        }

        @Test
        void infinities() {
            assertEquals(0x7ff0000000000000L,
                    CanonicalBits.of(Double.POSITIVE_INFINITY));
            assertEquals(0xfff0000000000000L,
                    CanonicalBits.of(Double.NEGATIVE_INFINITY));
            assertNotEquals(CanonicalBits.of(Double.POSITIVE_INFINITY),
                    CanonicalBits.of(Double.NEGATIVE_INFINITY));
        }
    }

    /**
     * For a normal {@code double} the canonical word is the IEEE-754
     * bit pattern.
     *
     * @param v value to test
     */
    @ParameterizedTest(name = "canonical({0}) is raw bits")
    @MethodSource("normalDoubles")
    void normalDoubleIsRawBits(double v) {
        assertEquals(Double.doubleToRawLongBits(v), CanonicalBits.of(v));
    }

    static Stream<Double> normalDoubles() {
        return Stream.of(1.0, -1.0, 2.5, -2.5, 0.1, 1e300, -1e-300,
                Double.MAX_VALUE, -Double.MAX_VALUE, Double.MIN_NORMAL,
                Math.PI);
    }

    /**
     * A sub-normal {@code double} also maps to its IEEE-754 bit
     * pattern, with a zero exponent field.
     *
     * @param v value to test
     */
    @ParameterizedTest(name = "canonical({0}) is raw bits")
    @MethodSource("subNormalDoubles")
    void subNormalDoubleIsRawBits(double v) {
        long bits = CanonicalBits.of(v);
        assertEquals(Double.doubleToRawLongBits(v), bits);
        assertEquals(0L, bits & CanonicalBits.EXP_MASK);
    }

    static Stream<Double> subNormalDoubles() {
        return Stream.of(Double.MIN_VALUE, -Double.MIN_VALUE, 1e-310,
                -1e-310, Double.MIN_NORMAL / 2,
                Math.nextDown(Double.MIN_NORMAL), 3 * Double.MIN_VALUE);
    }

    /**
     * A {@code float} and the same value widened to {@code double} have
     * the same canonical word. This includes sub-normal floats, which
     * are normal as doubles.
     *
     * @param f value to test
     */
    @ParameterizedTest(name = "canonical({0}f) == canonical({0}d)")
    @MethodSource("floats")
    void crossWidthConsistency(float f) {
        double d = f;
        assertEquals(CanonicalBits.of(d), CanonicalBits.of(f));
        assertEquals(
                CanonicalBits.hash(FloatKind.FLOAT64, d),
                CanonicalBits.hash(FloatKind.FLOAT32, f));
    }

    static Stream<Float> floats() {
        return Stream.of(1.0f, -1.0f, 0.1f, -0.1f, 3.0e38f, 1.5e-40f,
                Float.MAX_VALUE, -Float.MAX_VALUE, Float.MIN_VALUE,
                -Float.MIN_VALUE, Float.MIN_NORMAL, 0.0f, -0.0f,
                Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY,
                Float.NaN);
    }

    /**
     * Distinct non-NaN, non-zero values should have distinct canonical
     * words, at least over a range of ordinary values.
     *
     * @param a a value
     * @param b a different value
     */
    @ParameterizedTest(name = "canonical({0}) != canonical({1})")
    @MethodSource("distinctPairs")
    void distinctValues(double a, double b) {
        assertNotEquals(CanonicalBits.of(a), CanonicalBits.of(b));
    }

    static Stream<Arguments> distinctPairs() {
        return Stream.of( //
                arguments(1.0, -1.0), //
                arguments(1.0, 2.0), //
                arguments(1.0, Math.nextUp(1.0)), //
                arguments(Double.MIN_VALUE, 2 * Double.MIN_VALUE), //
                arguments(Double.MIN_VALUE, 0.0), //
                arguments(Double.MIN_VALUE, 0x1p974), //
                arguments(-1e-310, 1e-310), //
                arguments(Math.nextDown(Double.MIN_NORMAL),
                        Double.MIN_NORMAL), //
                arguments(Double.MAX_VALUE, Double.POSITIVE_INFINITY));
    }
}
