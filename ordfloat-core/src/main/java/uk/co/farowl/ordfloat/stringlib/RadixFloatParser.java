// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.stringlib;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Parser for floating-point literals written in a radix from 2 to 36.
 * The accepted syntax is:
 *
 * <pre>
 * literal  ::= [sign] (special | number)
 * special  ::= "inf" | "infinity" | "nan"      (any case)
 * number   ::= digits ["." [digits]] [exponent]
 *            | "." digits [exponent]
 * exponent ::= ("e" | "E") [sign] decimal      (only where "e" is not a digit)
 *            | ("p" | "P") [sign] decimal      (only where "p" is not a digit)
 * </pre>
 *
 * Digits are those of {@link Character#digit(char, int)} in the radix.
 * An {@code e}-exponent scales by a power of the radix, a
 * {@code p}-exponent by a power of two. White space is not allowed
 * anywhere. In radix 10 without a {@code p}-exponent, conversion is
 * delegated to the JDK. Otherwise the value is computed exactly as a
 * ratio of integers and rounded once. Either way the result is
 * correctly rounded.
 */
public class RadixFloatParser {

    private RadixFloatParser() {}  // no instances

    /** Smallest radix accepted. */
    public static final int MIN_RADIX = 2;
    /** Largest radix accepted. */
    public static final int MAX_RADIX = 36;

    /**
     * Parse the text as a {@code double}.
     *
     * @param text to parse
     * @param radix of the digits
     * @return the value (NaN if the text is a NaN literal)
     * @throws NumberFormatException if the text is not a valid literal
     */
    public static double parse(String text, int radix)
            throws NumberFormatException {
        Literal lit = scan(text, radix);
        if (lit.special != null)
            return lit.special;
        else if (lit.jdkText != null)
            return Double.parseDouble(lit.jdkText);
        else
            return lit.negate(lit.magnitude(DOUBLE));
    }

    /**
     * Parse the text as a {@code float}. This rounds once, directly to
     * {@code float}, rather than by way of {@code double}.
     *
     * @param text to parse
     * @param radix of the digits
     * @return the value (NaN if the text is a NaN literal)
     * @throws NumberFormatException if the text is not a valid literal
     */
    public static float parseFloat(String text, int radix)
            throws NumberFormatException {
        Literal lit = scan(text, radix);
        if (lit.special != null)
            return lit.special.floatValue();
        else if (lit.jdkText != null)
            return Float.parseFloat(lit.jdkText);
        else
            return (float)lit.negate(lit.magnitude(FLOAT));
    }

    // plumbing ------------------------------------------------------

    /**
     * The result of scanning a literal. Exactly one of
     * {@link #special}, {@link #jdkText} or {@link #digits} is
     * meaningful.
     */
    private static class Literal {
        final boolean negative;
        /** Infinity or NaN, or {@code null}. */
        Double special;
        /** Text fit for the JDK parser, or {@code null}. */
        String jdkText;
        /** All mantissa digits as one integer. */
        BigInteger digits;
        /** Power of the radix to apply to {@link #digits}. */
        long radixExponent;
        /** Power of two to apply to {@link #digits}. */
        long binaryExponent;
        final int radix;

        Literal(boolean negative, int radix) {
            this.negative = negative;
            this.radix = radix;
        }

        double negate(double v) { return negative ? -v : v; }

        /**
         * Compute the magnitude of the number, correctly rounded (half
         * to even) to the precision of the target type.
         *
         * @param limits of the target type
         * @return the magnitude (infinite if it overflows)
         */
        double magnitude(Limits limits) {
            if (digits.signum() == 0) { return 0.0; }

            // Estimate log2 of the result to catch extremes cheaply
            double log2 = digits.bitLength()
                    + radixExponent * Math.log(radix) / Math.log(2)
                    + binaryExponent;
            if (log2 > limits.overflowLog2)
                return Double.POSITIVE_INFINITY;
            else if (log2 < limits.underflowLog2)
                return 0.0;

            // The value is exactly num / den
            BigInteger num = digits, den = BigInteger.ONE;
            BigInteger r = BigInteger.valueOf(radix);
            if (radixExponent >= 0)
                num = num.multiply(r.pow((int)radixExponent));
            else
                den = den.multiply(r.pow((int)-radixExponent));
            if (binaryExponent >= 0)
                num = num.shiftLeft((int)binaryExponent);
            else
                den = den.shiftLeft((int)-binaryExponent);
            return round(num, den, limits);
        }
    }

    /**
     * Round the positive ratio {@code num / den} to the nearest value
     * with the precision and least exponent of the target type, ties to
     * even. The result is exact as a {@code double}, and for a
     * {@code float} target it is exact as a {@code float} too, unless it
     * overflows.
     *
     * @param num numerator
     * @param den denominator
     * @param limits of the target type
     * @return the rounded value (infinite if it overflows)
     */
    private static double round(BigInteger num, BigInteger den,
            Limits limits) {
        // Find e such that 2**e <= num/den < 2**(e+1)
        int e = num.bitLength() - den.bitLength();
        if (compareScaled(num, den, e) < 0) { e--; }

        // Exponent of the unit in the last place of the result
        int u = Math.max(e - (limits.precision - 1), limits.minExponent);
        BigInteger n = num, d = den;
        if (u >= 0)
            d = d.shiftLeft(u);
        else
            n = n.shiftLeft(-u);

        BigInteger[] qr = n.divideAndRemainder(d);
        long m = qr[0].longValueExact();
        int half = qr[1].shiftLeft(1).compareTo(d);
        if (half > 0 || (half == 0 && (m & 1L) != 0)) { m++; }
        // m has at most precision + 1 bits, so this is exact or infinite
        return Math.scalb((double)m, u);
    }

    /** Compare {@code num} with {@code den * 2**e}. */
    private static int compareScaled(BigInteger num, BigInteger den,
            int e) {
        if (e >= 0)
            return num.compareTo(den.shiftLeft(e));
        else
            return num.shiftLeft(-e).compareTo(den);
    }

    /** Range and precision of a target type. */
    private static class Limits {
        final double overflowLog2;
        final double underflowLog2;
        /** Bits in the significand, including the implied one. */
        final int precision;
        /** Exponent of the least sub-normal value. */
        final int minExponent;

        Limits(double overflowLog2, double underflowLog2, int precision,
                int minExponent) {
            this.overflowLog2 = overflowLog2;
            this.underflowLog2 = underflowLog2;
            this.precision = precision;
            this.minExponent = minExponent;
        }
    }

    private static final Limits DOUBLE = new Limits(1100, -1200, 53, -1074);
    private static final Limits FLOAT = new Limits(200, -250, 24, -149);

    /** Exponents are clamped to this magnitude while scanning. */
    private static final long EXPONENT_CLAMP = 100_000L;

    /**
     * Scan the text into a {@link Literal}, validating it completely.
     *
     * @param text to scan
     * @param radix of the digits
     * @return the scanned literal
     * @throws NumberFormatException if the text is not a valid literal
     */
    private static Literal scan(String text, int radix)
            throws NumberFormatException {
        if (radix < MIN_RADIX || radix > MAX_RADIX) {
            throw new NumberFormatException(
                    String.format(BAD_RADIX, radix));
        } else if (text.isEmpty()) {
            throw new NumberFormatException(EMPTY);
        }

        int n = text.length(), p = 0;
        char c = text.charAt(0);
        boolean negative = c == '-';
        if (negative || c == '+') { p++; }

        Literal lit = new Literal(negative, radix);

        // Infinity and NaN are spelled the same in every radix
        String rest = text.substring(p).toLowerCase(Locale.ROOT);
        if (rest.equals("inf") || rest.equals("infinity")) {
            lit.special = negative ? Double.NEGATIVE_INFINITY
                    : Double.POSITIVE_INFINITY;
            return lit;
        } else if (rest.equals("nan")) {
            lit.special = Double.NaN;
            return lit;
        }

        // Mantissa: digits [. digits]
        BigInteger big = BigInteger.valueOf(radix);
        BigInteger digits = BigInteger.ZERO;
        int count = 0, fraction = 0;
        boolean point = false;
        for (; p < n; p++) {
            c = text.charAt(p);
            if (c == '.' && !point) {
                point = true;
            } else {
                int d = Character.digit(c, radix);
                if (d < 0) { break; }
                digits = digits.multiply(big).add(BigInteger.valueOf(d));
                count++;
                if (point) { fraction++; }
            }
        }
        if (count == 0) { throw invalid(text, radix); }

        // Optional exponent
        long exponent = 0;
        boolean binary = false;
        if (p < n) {
            c = Character.toLowerCase(text.charAt(p));
            if (c == 'e' && Character.digit('e', radix) < 0) {
                binary = false;
            } else if (c == 'p' && Character.digit('p', radix) < 0) {
                binary = true;
            } else {
                throw invalid(text, radix);
            }
            exponent = scanExponent(text, p + 1, radix);
            p = n;
        }

        if (radix == 10 && !binary) {
            // The JDK accepts this syntax, and rounds correctly.
            lit.jdkText = text;
        } else {
            lit.digits = digits;
            lit.radixExponent = (binary ? 0 : exponent) - fraction;
            lit.binaryExponent = binary ? exponent : 0;
        }
        return lit;
    }

    /**
     * Scan a signed decimal exponent occupying the rest of the text.
     *
     * @param text containing the exponent
     * @param start index of the first character after the marker
     * @param radix only for the error message
     * @return the exponent, clamped to a safe range
     * @throws NumberFormatException if there is no valid exponent
     */
    private static long scanExponent(String text, int start, int radix)
            throws NumberFormatException {
        int n = text.length(), p = start;
        boolean negative = false;
        if (p < n && (text.charAt(p) == '-' || text.charAt(p) == '+')) {
            negative = text.charAt(p++) == '-';
        }
        if (p >= n) { throw invalid(text, radix); }
        long e = 0;
        for (; p < n; p++) {
            int d = Character.digit(text.charAt(p), 10);
            if (d < 0) { throw invalid(text, radix); }
            // Beyond the clamp the result is 0 or inf anyway
            e = Math.min(e * 10 + d, EXPONENT_CLAMP);
        }
        return negative ? -e : e;
    }

    private static NumberFormatException invalid(String text,
            int radix) {
        return new NumberFormatException(
                String.format(INVALID_LITERAL, radix, text));
    }

    private static final String EMPTY =
            "cannot parse float from empty string";
    private static final String BAD_RADIX =
            "radix %d out of range for a float literal";
    private static final String INVALID_LITERAL =
            "invalid float literal in radix %d: '%s'";
}
