// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.kind;

/**
 * The integer decomposition of a finite floating-point value into a
 * mantissa, a binary exponent and a sign, such that the value is
 * {@code sign * mantissa * 2**exponent}. The mantissa includes the
 * implied leading bit of a normal number. For a sub-normal number the
 * raw fraction is shifted left one place, so that both cases share the
 * exponent of the smallest normal binade.
 */
public final class FloatDecomposition {

    /** Unsigned integer significand. */
    private final long mantissa;
    /** Binary exponent applying to {@link #mantissa}. */
    private final short exponent;
    /** {@code +1} or {@code -1}. */
    private final byte sign;

    /**
     * Construct from the parts.
     *
     * @param mantissa unsigned significand
     * @param exponent binary exponent
     * @param sign {@code +1} or {@code -1}
     */
    public FloatDecomposition(long mantissa, short exponent, byte sign) {
        this.mantissa = mantissa;
        this.exponent = exponent;
        this.sign = sign;
    }

    /** @return the unsigned significand */
    public long mantissa() { return mantissa; }

    /** @return the binary exponent */
    public short exponent() { return exponent; }

    /** @return {@code +1} or {@code -1} */
    public byte sign() { return sign; }

    /** @return whether the sign is negative */
    public boolean isNegative() { return sign < 0; }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof FloatDecomposition) {
            FloatDecomposition other = (FloatDecomposition)obj;
            return mantissa == other.mantissa
                    && exponent == other.exponent && sign == other.sign;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(mantissa) * 31 + exponent * 3 + sign;
    }

    @Override
    public String toString() {
        return String.format("(%#x, %d, %d)", mantissa, exponent, sign);
    }
}
