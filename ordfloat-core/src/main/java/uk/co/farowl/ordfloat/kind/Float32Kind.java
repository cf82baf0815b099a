// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.kind;

import uk.co.farowl.ordfloat.stringlib.RadixFloatParser;

/**
 * The {@link FloatKind} of Java {@code float}. Arithmetic is carried
 * out in {@code float}, as Java does when both operands are
 * {@code float}, so results round exactly as they would in-line.
 */
final class Float32Kind implements FloatKind<Float> {

    /** The only instance. Published as {@link FloatKind#FLOAT32}. */
    static final Float32Kind INSTANCE = new Float32Kind();

    private static final Float ZERO = 0.0f;
    private static final Float ONE = 1.0f;
    private static final Float NAN = Float.NaN;

    private Float32Kind() {}

    @Override
    public String name() { return "float32"; }

    @Override
    public Class<Float> type() { return Float.class; }

    @Override
    public boolean isNaN(Float v) { return Float.isNaN(v); }

    @Override
    public boolean isInfinite(Float v) { return Float.isInfinite(v); }

    @Override
    public boolean signBit(Float v) {
        return (Float.floatToRawIntBits(v) & SIGN) != 0;
    }

    @Override
    public FloatDecomposition decompose(Float v) {
        int raw = Float.floatToRawIntBits(v);
        byte sign = (raw & SIGN) == 0 ? (byte)1 : (byte)-1;
        int e = (raw & EXPONENT) >>> SIGNIFICAND_BITS;
        int mantissa = e == 0 ? (raw & SIGNIFICAND) << 1
                : (raw & SIGNIFICAND) | IMPLIED_ONE;
        short exponent = (short)(e - EXPONENT_BIAS - SIGNIFICAND_BITS);
        return new FloatDecomposition(mantissa, exponent, sign);
    }

    @Override
    public Float zero() { return ZERO; }

    @Override
    public Float one() { return ONE; }

    @Override
    public Float nan() { return NAN; }

    @Override
    public Float minValue() { return -Float.MAX_VALUE; }

    @Override
    public Float maxValue() { return Float.MAX_VALUE; }

    @Override
    public Float minPositive() { return Float.MIN_NORMAL; }

    @Override
    public Float add(Float a, Float b) { return a + b; }

    @Override
    public Float subtract(Float a, Float b) { return a - b; }

    @Override
    public Float multiply(Float a, Float b) { return a * b; }

    @Override
    public Float divide(Float a, Float b) { return a / b; }

    @Override
    public Float remainder(Float a, Float b) { return a % b; }

    @Override
    public Float negate(Float a) { return -a; }

    @Override
    public Float abs(Float a) { return Math.abs(a); }

    @Override
    public Float signum(Float a) {
        float v = a;
        return Float.isNaN(v) ? NAN : Math.copySign(1.0f, v);
    }

    @Override
    public int compareOrdered(Float a, Float b) {
        float x = a, y = b;
        return x < y ? -1 : (x > y ? 1 : 0);
    }

    @Override
    public boolean equalValues(Float a, Float b) {
        return a.floatValue() == b.floatValue();
    }

    @Override
    public Float fromDouble(double v) { return (float)v; }

    @Override
    public Float fromLong(long v) { return (float)v; }

    @Override
    public double toDouble(Float v) { return v; }

    @Override
    public Float parse(String text, int radix)
            throws NumberFormatException {
        return RadixFloatParser.parseFloat(text, radix);
    }

    @Override
    public String toString() { return name(); }

    // IEE-754 32-bit floating point parameters
    private static final int SIGNIFICAND_BITS = 23; // exc. implied 1
    private static final int EXPONENT_BITS = 8;
    private static final int EXPONENT_BIAS = 127;

    // Masks derived from the 32-bit floating point parameters
    private static final int IMPLIED_ONE = 1 << SIGNIFICAND_BITS;
    // = 0x00800000
    private static final int SIGNIFICAND = IMPLIED_ONE - 1;
    // = 0x007fffff
    private static final int SIGN = IMPLIED_ONE << EXPONENT_BITS;
    // = 0x80000000
    private static final int EXPONENT = SIGN - IMPLIED_ONE;
    // = 0x7f800000
}
