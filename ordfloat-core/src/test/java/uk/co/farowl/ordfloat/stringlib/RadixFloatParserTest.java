// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.stringlib;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.params.provider.Arguments.arguments;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Test parsing float literals in various radices. */
class RadixFloatParserTest {

    /**
     * Literals that parse exactly, with their radix and value.
     *
     * @return the examples
     */
    static Stream<Arguments> exact() {
        return Stream.of( //
                arguments("1.5", 10, 1.5), //
                arguments("-2e-3", 10, -2e-3), //
                arguments(".25", 10, 0.25), //
                arguments("7.", 10, 7.0), //
                arguments("3p2", 10, 12.0), //
                arguments("ff", 16, 255.0), //
                arguments("FF.8", 16, 255.5), //
                arguments("1p10", 16, 1024.0), //
                arguments("1.8p1", 16, 3.0), //
                arguments("-0.1", 2, -0.5), //
                arguments("101.1", 2, 5.5), //
                arguments("10e2", 8, 512.0), //
                arguments("+z", 36, 35.0), //
                arguments("0.2", 5, 0.4), //
                arguments("1p-1074", 2, Double.MIN_VALUE), //
                arguments("1p1023", 2, 0x1p1023), //
                // Exact ties, which round to even
                arguments("20000000000003p-53", 16, 0x1.0000000000002p0),
                arguments("1." + "0".repeat(51) + "11", 2,
                        0x1.0000000000002p0),
                arguments("20000000000001p-53", 16, 1.0), //
                // Quotients that do not terminate in any binary radix
                arguments("0.1", 3, 1.0 / 3.0), //
                arguments("-0.6", 7, -6.0 / 7.0), //
                arguments("1e-1", 3, 1.0 / 3.0));
    }

    @DisplayName("parse(text, radix)")
    @ParameterizedTest(name = "parse(\"{0}\", {1}) = {2}")
    @MethodSource("exact")
    void parseExact(String text, int radix, double expected) {
        assertEquals(expected, RadixFloatParser.parse(text, radix));
    }

    @DisplayName("parseFloat(text, radix)")
    @ParameterizedTest(name = "parseFloat(\"{0}\", {1})")
    @MethodSource("exact")
    void parseFloatExact(String text, int radix, double expected) {
        assertEquals((float)expected,
                RadixFloatParser.parseFloat(text, radix));
    }

    @Nested
    @DisplayName("Special values")
    class Special {

        @ParameterizedTest(name = "radix {0}")
        @ValueSource(ints = {2, 10, 16, 36})
        void spelledTheSameInAnyRadix(int radix) {
            assertEquals(Double.POSITIVE_INFINITY,
                    RadixFloatParser.parse("inf", radix));
            assertEquals(Double.NEGATIVE_INFINITY,
                    RadixFloatParser.parse("-Infinity", radix));
            assertTrue(Double.isNaN(RadixFloatParser.parse("NaN", radix)));
            assertTrue(
                    Float.isNaN(RadixFloatParser.parseFloat("nan", radix)));
        }

        @Test
        void negativeZero() {
            assertEquals(-0.0, RadixFloatParser.parse("-0", 10));
            assertEquals(-0.0, RadixFloatParser.parse("-0.0", 2));
            assertEquals(-0.0f, RadixFloatParser.parseFloat("-0", 16));
        }

        @Test
        void overflowAndUnderflow() {
            assertEquals(Double.POSITIVE_INFINITY,
                    RadixFloatParser.parse("1p2000", 2));
            assertEquals(Double.NEGATIVE_INFINITY,
                    RadixFloatParser.parse("-1e99999999999", 3));
            assertEquals(0.0, RadixFloatParser.parse("1p-2000", 2));
            assertEquals(Float.POSITIVE_INFINITY,
                    RadixFloatParser.parseFloat("1p128", 16));
            assertEquals(0.0f, RadixFloatParser.parseFloat("1p-200", 16));
        }

        @Test
        void floatRoundsOnce() {
            assertEquals(0.1f, RadixFloatParser.parseFloat("0.1", 10));
            assertEquals(0x1.fffffep127f,
                    RadixFloatParser.parseFloat("ffffff.0p104", 16));
            // 1 + 2**-24 + 2**-60 is above the tie, but rounds to the
            // tie as a double, and would then round down to 1.0f.
            assertEquals(0x1.000002p0f,
                    RadixFloatParser.parseFloat("1.000001000000001", 16));
            // 1 + 3 * 2**-24 is a tie, and rounds to even
            assertEquals(0x1.000004p0f,
                    RadixFloatParser.parseFloat("1000003p-24", 16));
            assertEquals(Float.MIN_VALUE,
                    RadixFloatParser.parseFloat("1p-149", 2));
            assertEquals(0.0f, RadixFloatParser.parseFloat("1p-151", 2));
        }
    }

    @Nested
    @DisplayName("Invalid literals")
    class Invalid {

        @ParameterizedTest(name = "\"{0}\"")
        @ValueSource(strings = {"12z", "1e", "1e+", ".", "+", "1.2.3", " 1",
                "1 ", "0x10", "infx", "--1", "1e3.5"})
        void rejectedInRadix10(String text) {
            NumberFormatException e = assertThrows(
                    NumberFormatException.class,
                    () -> RadixFloatParser.parse(text, 10));
            assertEquals(String.format(
                    "invalid float literal in radix 10: '%s'", text),
                    e.getMessage());
        }

        @Test
        void digitOutOfRadix() {
            assertThrows(NumberFormatException.class,
                    () -> RadixFloatParser.parse("102", 2));
            assertThrows(NumberFormatException.class,
                    () -> RadixFloatParser.parseFloat("g", 16));
        }

        @Test
        void empty() {
            NumberFormatException e = assertThrows(
                    NumberFormatException.class,
                    () -> RadixFloatParser.parse("", 10));
            assertEquals("cannot parse float from empty string",
                    e.getMessage());
        }

        @ParameterizedTest(name = "radix {0}")
        @ValueSource(ints = {-1, 0, 1, 37})
        void badRadix(int radix) {
            assertThrows(NumberFormatException.class,
                    () -> RadixFloatParser.parse("1", radix));
        }
    }
}
