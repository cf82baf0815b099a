// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * A wrapper around a floating-point value, of any {@link FloatKind},
 * that is never NaN. Because NaN is excluded, the ordinary order and
 * equality of the float type are already total, and it may be used as
 * the key of a {@code TreeMap} or {@code HashMap}, or sorted. As in the
 * float type, {@code -0.0} and {@code +0.0} are equal (and hash
 * equally).
 * <p>
 * The invariant is established by the factory methods:
 * <ul>
 * <li>{@link #of(double)} and its overloads throw the recoverable
 * {@link FloatIsNaNException} when given NaN,</li>
 * <li>{@link #from(double)} and its overloads convert a plain value and
 * throw the fatal {@link NaNInvariantError} when given NaN,</li>
 * <li>{@link #uncheckedOf(double)} and its overloads trust the caller
 * and do not check (except by a Java {@code assert}).</li>
 * </ul>
 * The invariant is maintained by the arithmetic methods, which return a
 * new instance. Each throws {@link NaNInvariantError} if a raw operand
 * is NaN, or if the result of the operation would be NaN (as for
 * {@code 0/0}, {@code inf-inf} or {@code 0*inf}). Results that are
 * infinite are not errors: {@code 1/0} is positive infinity.
 * <p>
 * Instances are immutable. For arithmetic that updates a variable in
 * place, see {@link MutableNonNaNFloat}.
 *
 * @param <T> boxed type of the wrapped value
 */
public final class NonNaNFloat<T extends Number> extends Number
        implements Comparable<NonNaNFloat<T>> {
    private static final long serialVersionUID = 1L;

    /** The kind of float wrapped. */
    private final transient FloatKind<T> kind;

    /** Value of this {@code NonNaNFloat}, never NaN. */
    private final T value;

    private NonNaNFloat(FloatKind<T> kind, T value) {
        this.kind = kind;
        this.value = value;
    }

    // Construction ---------------------------------------------------

    /**
     * Wrap a value of the given kind, which must not be NaN.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param value to wrap
     * @return the wrapped value
     * @throws FloatIsNaNException if {@code value} is NaN
     */
    public static <T extends Number> NonNaNFloat<T> of(FloatKind<T> kind,
            T value) throws FloatIsNaNException {
        Objects.requireNonNull(value);
        if (kind.isNaN(value)) { throw new FloatIsNaNException(); }
        return new NonNaNFloat<>(kind, value);
    }

    /**
     * Wrap a {@code double}, which must not be NaN.
     *
     * @param value to wrap
     * @return the wrapped value
     * @throws FloatIsNaNException if {@code value} is NaN
     */
    public static NonNaNFloat<Double> of(double value)
            throws FloatIsNaNException {
        return of(FloatKind.FLOAT64, value);
    }

    /**
     * Wrap a {@code float}, which must not be NaN.
     *
     * @param value to wrap
     * @return the wrapped value
     * @throws FloatIsNaNException if {@code value} is NaN
     */
    public static NonNaNFloat<Float> of(float value)
            throws FloatIsNaNException {
        return of(FloatKind.FLOAT32, value);
    }

    /**
     * Wrap a value the caller has already proved is not NaN, without
     * checking it.
     * <p>
     * <b>The behaviour is undefined if {@code value} is NaN.</b> The
     * result would violate the invariant of the class: its order,
     * equality and hash would be inconsistent, and operations on it
     * may fail unpredictably. When Java assertions are enabled
     * ({@code -ea}) the precondition is checked with an
     * {@code assert}.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param value to wrap (not NaN)
     * @return the wrapped value
     */
    public static <T extends Number> NonNaNFloat<T> uncheckedOf(
            FloatKind<T> kind, T value) {
        assert !kind.isNaN(value) : "uncheckedOf() given NaN";
        return new NonNaNFloat<>(kind, value);
    }

    /**
     * Wrap a {@code double} the caller has already proved is not NaN,
     * without checking it. <b>The behaviour is undefined if
     * {@code value} is NaN.</b>
     *
     * @param value to wrap (not NaN)
     * @return the wrapped value
     * @see #uncheckedOf(FloatKind, Number)
     */
    public static NonNaNFloat<Double> uncheckedOf(double value) {
        return uncheckedOf(FloatKind.FLOAT64, value);
    }

    /**
     * Wrap a {@code float} the caller has already proved is not NaN,
     * without checking it. <b>The behaviour is undefined if
     * {@code value} is NaN.</b>
     *
     * @param value to wrap (not NaN)
     * @return the wrapped value
     * @see #uncheckedOf(FloatKind, Number)
     */
    public static NonNaNFloat<Float> uncheckedOf(float value) {
        return uncheckedOf(FloatKind.FLOAT32, value);
    }

    /**
     * Convert a plain value to a {@code NonNaNFloat}, treating NaN as a
     * fatal error. This suits call sites where a NaN would be a bug,
     * and a checked exception would be noise. Where NaN is a
     * possibility to be handled, use {@link #of(FloatKind, Number)}.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param value to convert
     * @return the wrapped value
     * @throws NaNInvariantError if {@code value} is NaN
     */
    public static <T extends Number> NonNaNFloat<T> from(FloatKind<T> kind,
            T value) throws NaNInvariantError {
        Objects.requireNonNull(value);
        if (kind.isNaN(value)) {
            throw new NaNInvariantError(CONVERTED_NAN, kind);
        }
        return new NonNaNFloat<>(kind, value);
    }

    /**
     * Convert a plain {@code double}, treating NaN as a fatal error.
     *
     * @param value to convert
     * @return the wrapped value
     * @throws NaNInvariantError if {@code value} is NaN
     * @see #from(FloatKind, Number)
     */
    public static NonNaNFloat<Double> from(double value)
            throws NaNInvariantError {
        return from(FloatKind.FLOAT64, value);
    }

    /**
     * Convert a plain {@code float}, treating NaN as a fatal error.
     *
     * @param value to convert
     * @return the wrapped value
     * @throws NaNInvariantError if {@code value} is NaN
     * @see #from(FloatKind, Number)
     */
    public static NonNaNFloat<Float> from(float value)
            throws NaNInvariantError {
        return from(FloatKind.FLOAT32, value);
    }

    /** @return the wrapped value (never NaN) */
    public T value() { return value; }

    /** @return the kind of float wrapped */
    public FloatKind<T> kind() { return kind; }

    /**
     * The canonical 64-bit word from which the hash is computed: the
     * same for both zeros.
     *
     * @return canonical word of the value
     * @see CanonicalBits
     */
    public long canonicalBits() { return CanonicalBits.of(kind, value); }

    // Arithmetic -----------------------------------------------------

    /*
     * Each operation has a wrapper-to-wrapper and a wrapper-to-raw
     * form. A raw operand is checked before use. The result is checked
     * in every case, since two non-NaN operands may still produce NaN.
     */

    /**
     * @param other right operand
     * @return {@code this + other}
     * @throws NaNInvariantError if the result is NaN
     */
    public NonNaNFloat<T> add(NonNaNFloat<T> other)
            throws NaNInvariantError {
        return checked(kind.add(value, other.value), Op.ADD);
    }

    /**
     * @param other right operand (not NaN)
     * @return {@code this + other}
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public NonNaNFloat<T> add(T other) throws NaNInvariantError {
        return checked(kind.add(value, operand(other)), Op.ADD);
    }

    /**
     * @param other right operand
     * @return {@code this - other}
     * @throws NaNInvariantError if the result is NaN
     */
    public NonNaNFloat<T> subtract(NonNaNFloat<T> other)
            throws NaNInvariantError {
        return checked(kind.subtract(value, other.value), Op.SUBTRACT);
    }

    /**
     * @param other right operand (not NaN)
     * @return {@code this - other}
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public NonNaNFloat<T> subtract(T other) throws NaNInvariantError {
        return checked(kind.subtract(value, operand(other)),
                Op.SUBTRACT);
    }

    /**
     * @param other right operand
     * @return {@code this * other}
     * @throws NaNInvariantError if the result is NaN
     */
    public NonNaNFloat<T> multiply(NonNaNFloat<T> other)
            throws NaNInvariantError {
        return checked(kind.multiply(value, other.value), Op.MULTIPLY);
    }

    /**
     * @param other right operand (not NaN)
     * @return {@code this * other}
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public NonNaNFloat<T> multiply(T other) throws NaNInvariantError {
        return checked(kind.multiply(value, operand(other)),
                Op.MULTIPLY);
    }

    /**
     * Divide by another value. Division of a non-zero value by zero is
     * not an error: the result is an infinity. Division of zero by zero
     * (or infinity by infinity) is, because the result is NaN.
     *
     * @param other right operand
     * @return {@code this / other}
     * @throws NaNInvariantError if the result is NaN
     */
    public NonNaNFloat<T> divide(NonNaNFloat<T> other)
            throws NaNInvariantError {
        return checked(kind.divide(value, other.value), Op.DIVIDE);
    }

    /**
     * Divide by a raw value. See {@link #divide(NonNaNFloat)}.
     *
     * @param other right operand (not NaN)
     * @return {@code this / other}
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public NonNaNFloat<T> divide(T other) throws NaNInvariantError {
        return checked(kind.divide(value, operand(other)), Op.DIVIDE);
    }

    /**
     * Remainder as Java {@code %} computes it. A remainder modulo zero,
     * or of an infinity, is NaN and therefore an error.
     *
     * @param other right operand
     * @return {@code this % other}
     * @throws NaNInvariantError if the result is NaN
     */
    public NonNaNFloat<T> remainder(NonNaNFloat<T> other)
            throws NaNInvariantError {
        return checked(kind.remainder(value, other.value), Op.REMAINDER);
    }

    /**
     * Remainder with a raw value. See {@link #remainder(NonNaNFloat)}.
     *
     * @param other right operand (not NaN)
     * @return {@code this % other}
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public NonNaNFloat<T> remainder(T other) throws NaNInvariantError {
        return checked(kind.remainder(value, operand(other)),
                Op.REMAINDER);
    }

    /**
     * @return {@code -this}
     * @throws NaNInvariantError if the result is NaN (which cannot
     *     happen while the invariant holds)
     */
    public NonNaNFloat<T> negate() throws NaNInvariantError {
        return checked(kind.negate(value), Op.NEGATE);
    }

    // Signed number --------------------------------------------------

    /** @return the absolute value of this */
    public NonNaNFloat<T> abs() {
        return new NonNaNFloat<>(kind, kind.abs(value));
    }

    /**
     * The positive difference: {@code this - other} if that is
     * positive, otherwise zero.
     *
     * @param other value to subtract
     * @return {@code max(this - other, 0)}
     * @throws NaNInvariantError if the subtraction is NaN
     */
    public NonNaNFloat<T> absSub(NonNaNFloat<T> other)
            throws NaNInvariantError {
        NonNaNFloat<T> d = subtract(other);
        return d.isPositive() && !d.isZero() ? d : zero(kind);
    }

    /**
     * Signum of a signed number: {@code 1.0} if the sign is positive
     * (including {@code +0.0} and {@code +inf}) and {@code -1.0} if
     * negative (including {@code -0.0}).
     *
     * @return {@code 1.0} or {@code -1.0}
     */
    public NonNaNFloat<T> signum() {
        return new NonNaNFloat<>(kind, kind.signum(value));
    }

    /** @return whether the sign bit is clear (including {@code +0.0}) */
    public boolean isPositive() { return !kind.signBit(value); }

    /** @return whether the sign bit is set (including {@code -0.0}) */
    public boolean isNegative() { return kind.signBit(value); }

    /** @return whether this is either zero */
    public boolean isZero() {
        return kind.equalValues(value, kind.zero());
    }

    /** @return whether this is an infinity */
    public boolean isInfinite() { return kind.isInfinite(value); }

    // Identities and bounds ------------------------------------------

    /**
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @return positive zero of the kind
     */
    public static <T extends Number> NonNaNFloat<T> zero(
            FloatKind<T> kind) {
        return new NonNaNFloat<>(kind, kind.zero());
    }

    /**
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @return one of the kind
     */
    public static <T extends Number> NonNaNFloat<T> one(
            FloatKind<T> kind) {
        return new NonNaNFloat<>(kind, kind.one());
    }

    /**
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @return the most negative finite value of the kind
     */
    public static <T extends Number> NonNaNFloat<T> minValue(
            FloatKind<T> kind) {
        return new NonNaNFloat<>(kind, kind.minValue());
    }

    /**
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @return the largest finite value of the kind
     */
    public static <T extends Number> NonNaNFloat<T> maxValue(
            FloatKind<T> kind) {
        return new NonNaNFloat<>(kind, kind.maxValue());
    }

    // Conversion from and to primitives ------------------------------

    /**
     * Convert a {@code long} to the nearest value of the kind.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param v to convert
     * @return the converted value, or empty if it would be NaN
     */
    public static <T extends Number> Optional<NonNaNFloat<T>> fromLong(
            FloatKind<T> kind, long v) {
        return ofOptional(kind, kind.fromLong(v));
    }

    /**
     * Convert a {@code double} to the nearest value of the kind.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param v to convert
     * @return the converted value, or empty if it is NaN
     */
    public static <T extends Number> Optional<NonNaNFloat<T>> fromDouble(
            FloatKind<T> kind, double v) {
        return ofOptional(kind, kind.fromDouble(v));
    }

    /**
     * Convert to a {@code long} by truncation, if the result is
     * representable.
     *
     * @return the integer part, or empty if infinite or out of range
     */
    public OptionalLong toLong() {
        double v = kind.toDouble(value);
        // 2**63 is exact in double, and is the first value out of range
        if (v >= -TWO_TO_63 && v < TWO_TO_63)
            return OptionalLong.of((long)v);
        else
            return OptionalLong.empty();
    }

    /**
     * Convert to an {@code int} by truncation, if the result is
     * representable.
     *
     * @return the integer part, or empty if infinite or out of range
     */
    public OptionalInt toInt() {
        double v = kind.toDouble(value);
        if (v > Integer.MIN_VALUE - 1.0 && v < Integer.MAX_VALUE + 1.0)
            return OptionalInt.of((int)v);
        else
            return OptionalInt.empty();
    }

    private static final double TWO_TO_63 = 0x1p63;

    /**
     * Parse a literal in the given radix as a {@code NonNaNFloat} of
     * the given kind. The syntax is that of
     * {@link uk.co.farowl.ordfloat.stringlib.RadixFloatParser}.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param text to parse
     * @param radix of the digits (2 to 36)
     * @return the parsed value
     * @throws ParseNotNaNException of kind {@code PARSE_FLOAT_ERROR} if
     *     the text is not a valid literal, or {@code IS_NAN} if it
     *     denotes NaN
     */
    public static <T extends Number> NonNaNFloat<T> parse(
            FloatKind<T> kind, String text, int radix)
            throws ParseNotNaNException {
        T v;
        try {
            v = kind.parse(text, radix);
        } catch (NumberFormatException e) {
            throw new ParseNotNaNException(e);
        }
        if (kind.isNaN(v)) { throw new ParseNotNaNException(text); }
        return new NonNaNFloat<>(kind, v);
    }

    /**
     * Parse a decimal literal as a {@code NonNaNFloat<Double>}.
     *
     * @param text to parse
     * @return the parsed value
     * @throws ParseNotNaNException if the text is invalid or NaN
     * @see #parse(FloatKind, String, int)
     */
    public static NonNaNFloat<Double> parse(String text)
            throws ParseNotNaNException {
        return parse(FloatKind.FLOAT64, text, 10);
    }

    // Order, equality and hash ---------------------------------------

    /**
     * {@inheritDoc}
     * <p>
     * This is the order of the float type, in which {@code -0.0} and
     * {@code +0.0} are equal.
     */
    @Override
    public int compareTo(NonNaNFloat<T> other) {
        return kind.compareOrdered(value, other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof NonNaNFloat) {
            NonNaNFloat<?> other = (NonNaNFloat<?>)obj;
            if (other.kind != kind) { return false; }
            @SuppressWarnings("unchecked")
            T otherValue = (T)other.value;
            return kind.equalValues(value, otherValue);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() { return Long.hashCode(canonicalBits()); }

    @Override
    public String toString() { return value.toString(); }

    // Number ---------------------------------------------------------

    @Override
    public int intValue() { return value.intValue(); }

    @Override
    public long longValue() { return value.longValue(); }

    @Override
    public float floatValue() { return value.floatValue(); }

    @Override
    public double doubleValue() { return value.doubleValue(); }

    // plumbing -------------------------------------------------------

    /** Arithmetic operations, for their messages. */
    enum Op {
        ADD("Addition"), SUBTRACT("Subtraction"),
        MULTIPLY("Multiplication"), DIVIDE("Division"), REMAINDER("Rem"),
        NEGATE("Negation");

        /** Message when this operation produces NaN. */
        final String resultedInNaN;

        Op(String name) { this.resultedInNaN = name + " resulted in NaN"; }
    }

    /**
     * Check a raw operand is not NaN.
     *
     * @param v operand
     * @return {@code v}
     * @throws NaNInvariantError if {@code v} is NaN
     */
    private T operand(T v) throws NaNInvariantError {
        if (kind.isNaN(Objects.requireNonNull(v))) {
            throw new NaNInvariantError(NAN_OPERAND);
        }
        return v;
    }

    /**
     * Wrap the result of an operation, having checked it is not NaN.
     *
     * @param result of the operation
     * @param op the operation (for the message)
     * @return wrapped result
     * @throws NaNInvariantError if {@code result} is NaN
     */
    private NonNaNFloat<T> checked(T result, Op op)
            throws NaNInvariantError {
        if (kind.isNaN(result)) {
            throw new NaNInvariantError(op.resultedInNaN);
        }
        return new NonNaNFloat<>(kind, result);
    }

    /**
     * Wrap a value if it is not NaN.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param v to wrap
     * @return {@code v} wrapped, or empty if NaN
     */
    private static <T extends Number> Optional<NonNaNFloat<T>> ofOptional(
            FloatKind<T> kind, T v) {
        return kind.isNaN(v) ? Optional.empty()
                : Optional.of(new NonNaNFloat<>(kind, v));
    }

    /**
     * Recover the kind after Java deserialization, and check the
     * invariant, since the stream may have been tampered with.
     *
     * @return equivalent instance with the kind restored
     * @throws java.io.InvalidObjectException if the value is NaN
     */
    private Object readResolve() throws java.io.InvalidObjectException {
        FloatKind<T> k = TotalOrderFloat.kindOf(value);
        if (k.isNaN(value)) {
            throw new java.io.InvalidObjectException(
                    FloatIsNaNException.MESSAGE);
        }
        return new NonNaNFloat<>(k, value);
    }

    private static final String NAN_OPERAND = "Operand is NaN";
    private static final String CONVERTED_NAN =
            "NaN converted to NonNaNFloat (%s)";
}
