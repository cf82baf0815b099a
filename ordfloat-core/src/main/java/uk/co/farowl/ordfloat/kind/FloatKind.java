// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat.kind;

/**
 * The capabilities of a floating-point kind on which the ordered
 * wrappers depend. A {@code FloatKind} is a stateless strategy object
 * over the boxed Java type {@code T}: the wrappers hold a value of type
 * {@code T} and consult the kind for every operation that depends on
 * the representation.
 * <p>
 * Two kinds are provided, {@link #FLOAT32} over {@code Float} and
 * {@link #FLOAT64} over {@code Double}. Other float-like types may be
 * supported by implementing this interface, provided they have a NaN
 * predicate and an integer decomposition.
 * <p>
 * Unless stated otherwise, arguments must not be {@code null}, and the
 * arithmetic follows IEEE-754 as Java does, producing NaN (never
 * throwing) for an undefined result.
 *
 * @param <T> the boxed Java type of the values
 */
public interface FloatKind<T extends Number> {

    /*
     * Note that this interface has no default methods. Were it to have
     * any, initialising an implementation class would initialise this
     * interface, which refers back to the implementation.
     */

    /** The kind of IEEE-754 32-bit {@code float}. */
    FloatKind<Float> FLOAT32 = Float32Kind.INSTANCE;

    /** The kind of IEEE-754 64-bit {@code double}. */
    FloatKind<Double> FLOAT64 = Float64Kind.INSTANCE;

    /**
     * Return the kind for the given boxed class.
     *
     * @param <T> boxed Java type
     * @param type {@code Float.class} or {@code Double.class}
     * @return the corresponding kind
     * @throws IllegalArgumentException if the type is not supported
     */
    @SuppressWarnings("unchecked")
    static <T extends Number> FloatKind<T> of(Class<T> type)
            throws IllegalArgumentException {
        if (type == Double.class || type == double.class)
            return (FloatKind<T>)FLOAT64;
        else if (type == Float.class || type == float.class)
            return (FloatKind<T>)FLOAT32;
        else
            throw new IllegalArgumentException(
                    "no float kind for " + type.getTypeName());
    }

    /** @return short name of the kind (e.g. "float64") */
    String name();

    /** @return the boxed Java class of values of this kind */
    Class<T> type();

    // Classification ------------------------------------------------

    /**
     * @param v value to test
     * @return whether {@code v} is any NaN
     */
    boolean isNaN(T v);

    /**
     * @param v value to test
     * @return whether {@code v} is a positive or negative infinity
     */
    boolean isInfinite(T v);

    /**
     * @param v value to test
     * @return whether the sign bit of {@code v} is set
     */
    boolean signBit(T v);

    /**
     * Decompose a value into mantissa, exponent and sign. The result is
     * not meaningful for NaN or infinities, which callers should deal
     * with first.
     *
     * @param v value to decompose
     * @return the decomposition
     */
    FloatDecomposition decompose(T v);

    // Constants -----------------------------------------------------

    /** @return positive zero of this kind */
    T zero();

    /** @return one of this kind */
    T one();

    /** @return the representative (quiet, positive) NaN of this kind */
    T nan();

    /** @return the most negative finite value of this kind */
    T minValue();

    /** @return the largest finite value of this kind */
    T maxValue();

    /** @return the smallest positive normal value of this kind */
    T minPositive();

    // Arithmetic ----------------------------------------------------

    /**
     * @param a left operand
     * @param b right operand
     * @return {@code a + b}
     */
    T add(T a, T b);

    /**
     * @param a left operand
     * @param b right operand
     * @return {@code a - b}
     */
    T subtract(T a, T b);

    /**
     * @param a left operand
     * @param b right operand
     * @return {@code a * b}
     */
    T multiply(T a, T b);

    /**
     * @param a left operand
     * @param b right operand
     * @return {@code a / b}
     */
    T divide(T a, T b);

    /**
     * Remainder as Java {@code %} computes it: the result has the sign
     * of the dividend.
     *
     * @param a left operand
     * @param b right operand
     * @return {@code a % b}
     */
    T remainder(T a, T b);

    /**
     * @param a operand
     * @return {@code -a}
     */
    T negate(T a);

    /**
     * @param a operand
     * @return absolute value of {@code a}
     */
    T abs(T a);

    /**
     * Signum in the sense of a signed number: {@code 1.0} for positive
     * values (including {@code +0.0} and {@code +inf}), {@code -1.0} for
     * negative values (including {@code -0.0}), NaN for NaN.
     *
     * @param a operand
     * @return the signum of {@code a}
     */
    T signum(T a);

    // Comparison ----------------------------------------------------

    /**
     * Compare two values neither of which is NaN, by the ordinary
     * floating-point order, in which {@code -0.0 == +0.0}.
     *
     * @param a left operand (not NaN)
     * @param b right operand (not NaN)
     * @return negative, zero or positive as {@code a<b}, {@code a==b}
     *     or {@code a>b}
     */
    int compareOrdered(T a, T b);

    /**
     * Test two values for ordinary floating-point equality (so NaN is
     * not equal to itself and signed zeros are equal).
     *
     * @param a left operand
     * @param b right operand
     * @return {@code a == b}
     */
    boolean equalValues(T a, T b);

    // Conversion ----------------------------------------------------

    /**
     * @param v to convert
     * @return nearest value of this kind
     */
    T fromDouble(double v);

    /**
     * @param v to convert
     * @return nearest value of this kind
     */
    T fromLong(long v);

    /**
     * @param v to convert
     * @return exact {@code double} equivalent
     */
    double toDouble(T v);

    /**
     * Parse a numeric literal in the given radix. See
     * {@link uk.co.farowl.ordfloat.stringlib.RadixFloatParser} for the
     * accepted syntax.
     *
     * @param text to parse
     * @param radix in the range 2 to 36 inclusive
     * @return the value (possibly NaN if the text says so)
     * @throws NumberFormatException if the text is not a valid literal
     */
    T parse(String text, int radix) throws NumberFormatException;
}
