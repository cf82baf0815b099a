// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.kind;

import uk.co.farowl.ordfloat.stringlib.RadixFloatParser;

/** The {@link FloatKind} of Java {@code double}. */
final class Float64Kind implements FloatKind<Double> {

    /** The only instance. Published as {@link FloatKind#FLOAT64}. */
    static final Float64Kind INSTANCE = new Float64Kind();

    private static final Double ZERO = 0.0;
    private static final Double ONE = 1.0;
    private static final Double NAN = Double.NaN;

    private Float64Kind() {}

    @Override
    public String name() { return "float64"; }

    @Override
    public Class<Double> type() { return Double.class; }

    @Override
    public boolean isNaN(Double v) { return Double.isNaN(v); }

    @Override
    public boolean isInfinite(Double v) { return Double.isInfinite(v); }

    @Override
    public boolean signBit(Double v) {
        return (Double.doubleToRawLongBits(v) & SIGN) != 0L;
    }

    @Override
    public FloatDecomposition decompose(Double v) {
        long raw = Double.doubleToRawLongBits(v);
        byte sign = (raw & SIGN) == 0L ? (byte)1 : (byte)-1;
        int e = (int)((raw & EXPONENT) >>> SIGNIFICAND_BITS);
        long mantissa = e == 0 ? (raw & SIGNIFICAND) << 1
                : (raw & SIGNIFICAND) | IMPLIED_ONE;
        // Make mantissa * 2**exponent the magnitude
        short exponent = (short)(e - EXPONENT_BIAS - SIGNIFICAND_BITS);
        return new FloatDecomposition(mantissa, exponent, sign);
    }

    @Override
    public Double zero() { return ZERO; }

    @Override
    public Double one() { return ONE; }

    @Override
    public Double nan() { return NAN; }

    @Override
    public Double minValue() { return -Double.MAX_VALUE; }

    @Override
    public Double maxValue() { return Double.MAX_VALUE; }

    @Override
    public Double minPositive() { return Double.MIN_NORMAL; }

    @Override
    public Double add(Double a, Double b) { return a + b; }

    @Override
    public Double subtract(Double a, Double b) { return a - b; }

    @Override
    public Double multiply(Double a, Double b) { return a * b; }

    @Override
    public Double divide(Double a, Double b) { return a / b; }

    @Override
    public Double remainder(Double a, Double b) { return a % b; }

    @Override
    public Double negate(Double a) { return -a; }

    @Override
    public Double abs(Double a) { return Math.abs(a); }

    @Override
    public Double signum(Double a) {
        // Unlike Math.signum, zeros map to +/-1
        double v = a;
        return Double.isNaN(v) ? NAN : Math.copySign(1.0, v);
    }

    @Override
    public int compareOrdered(Double a, Double b) {
        double x = a, y = b;
        return x < y ? -1 : (x > y ? 1 : 0);
    }

    @Override
    public boolean equalValues(Double a, Double b) {
        return a.doubleValue() == b.doubleValue();
    }

    @Override
    public Double fromDouble(double v) { return v; }

    @Override
    public Double fromLong(long v) { return (double)v; }

    @Override
    public double toDouble(Double v) { return v; }

    @Override
    public Double parse(String text, int radix)
            throws NumberFormatException {
        return RadixFloatParser.parse(text, radix);
    }

    @Override
    public String toString() { return name(); }

    // IEE-754 64-bit floating point parameters
    private static final int SIGNIFICAND_BITS = 52; // exc. implied 1
    private static final int EXPONENT_BITS = 11;
    private static final int EXPONENT_BIAS = 1023;

    // Masks derived from the 64-bit floating point parameters
    private static final long IMPLIED_ONE = 1L << SIGNIFICAND_BITS;
    // = 0x0010000000000000L
    private static final long SIGNIFICAND = IMPLIED_ONE - 1;
    // = 0x000fffffffffffffL
    private static final long SIGN = IMPLIED_ONE << EXPONENT_BITS;
    // = 0x8000000000000000L;
    private static final long EXPONENT = SIGN - IMPLIED_ONE;
    // = 0x7ff0000000000000L;
}
