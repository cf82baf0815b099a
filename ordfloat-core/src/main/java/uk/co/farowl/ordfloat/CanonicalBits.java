// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

import uk.co.farowl.ordfloat.kind.FloatDecomposition;
import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * Computation of a canonical 64-bit word from a floating-point value,
 * for use in hashing. The canonical word has the layout of an IEEE-754
 * 64-bit {@code double}, and:
 * <ul>
 * <li>every NaN, whatever its sign and payload, maps to
 * {@link #CANONICAL_NAN_BITS},</li>
 * <li>both zeros map to {@link #CANONICAL_ZERO_BITS},</li>
 * <li>every other value maps to a word reassembled from the sign,
 * exponent and mantissa of its integer decomposition.</li>
 * </ul>
 * The decomposition is first normalised to a 53-bit significand, so
 * that the result depends only on the mathematical value and not on
 * the width of the type that holds it. Thus a {@code float} and the
 * {@code double} obtained by widening it have the same canonical word,
 * and for any finite non-zero {@code double} (normal or sub-normal) the
 * canonical word is simply its IEEE-754 bit pattern.
 */
public final class CanonicalBits {

    private CanonicalBits() {}  // no instances

    /** The canonical word of every NaN. */
    public static final long CANONICAL_NAN_BITS = 0x7ff8000000000000L;

    /** The canonical word of both zeros. */
    public static final long CANONICAL_ZERO_BITS = 0x0L;

    /**
     * Compute the canonical word of a value of any kind.
     *
     * @param <T> boxed type of the value
     * @param kind of the value
     * @param v the value
     * @return canonical 64-bit word
     */
    public static <T extends Number> long of(FloatKind<T> kind, T v) {
        if (kind.isNaN(v)) {
            return CANONICAL_NAN_BITS;
        } else if (kind.isInfinite(v)) {
            // No finite decomposition means the same in every width
            return kind.signBit(v) ? SIGN_MASK | EXP_MASK : EXP_MASK;
        }

        FloatDecomposition d = kind.decompose(v);
        long mantissa = d.mantissa();
        if (mantissa == 0L) { return CANONICAL_ZERO_BITS; }

        // Normalise so the leading 1 sits at the implied-one position
        int shift = Long.numberOfLeadingZeros(mantissa) - NORMAL_ZEROS;
        long exponent = d.exponent() - shift;
        mantissa = shift >= 0 ? mantissa << shift : mantissa >>> -shift;

        long biased = exponent + EXPONENT_OFFSET;
        long sign = d.isNegative() ? SIGN_MASK : 0L;
        if (biased <= 0) {
            // Sub-normal as a double: exponent field 0, implied one kept
            return (mantissa >>> (1 - biased)) | sign;
        }
        return (mantissa & MAN_MASK) | ((biased << 52) & EXP_MASK) | sign;
    }

    /**
     * Compute the canonical word of a {@code double}.
     *
     * @param v the value
     * @return canonical 64-bit word
     */
    public static long of(double v) { return of(FloatKind.FLOAT64, v); }

    /**
     * Compute the canonical word of a {@code float}.
     *
     * @param v the value
     * @return canonical 64-bit word
     */
    public static long of(float v) { return of(FloatKind.FLOAT32, v); }

    /**
     * Fold the canonical word of a value into a Java hash code, in the
     * same way as {@link Long#hashCode(long)}.
     *
     * @param <T> boxed type of the value
     * @param kind of the value
     * @param v the value
     * @return hash of the canonical word
     */
    public static <T extends Number> int hash(FloatKind<T> kind, T v) {
        return Long.hashCode(of(kind, v));
    }

    // Masks for the parts of an IEEE-754 64-bit float
    static final long SIGN_MASK = 0x8000000000000000L;
    static final long EXP_MASK = 0x7ff0000000000000L;
    static final long MAN_MASK = 0x000fffffffffffffL;

    /** Leading zeros of a normalised 53-bit significand. */
    private static final int NORMAL_ZEROS = 11;

    /**
     * Add to the exponent of a normalised decomposition to obtain the
     * biased exponent field of a {@code double} (1023 + 52).
     */
    private static final int EXPONENT_OFFSET = 1075;
}
