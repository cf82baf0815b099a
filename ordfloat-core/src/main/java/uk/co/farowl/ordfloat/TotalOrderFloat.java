// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

import java.util.Objects;

import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * A wrapper around a floating-point value, of any {@link FloatKind},
 * that provides a total order and a hash consistent with equality. It
 * may therefore be used as the key of a {@code TreeMap} or
 * {@code HashMap}, or sorted, where the bare {@code float} or
 * {@code double} would misbehave.
 * <p>
 * The semantics differ from IEEE-754 only in respect of NaN:
 * <ul>
 * <li>every NaN (whatever its sign or payload) is equal to every other
 * NaN, and to nothing else,</li>
 * <li>NaN is greater than every other value, including positive
 * infinity,</li>
 * <li>otherwise, equality and order are those of the float type, so
 * {@code -0.0} and {@code +0.0} are equal.</li>
 * </ul>
 * This also differs from {@link Double#compareTo(Double)}, which
 * orders {@code -0.0} before {@code +0.0}.
 * <p>
 * Instances are immutable. The wrapped value, including the bits of a
 * NaN, is returned unchanged by {@link #value()}.
 *
 * @param <T> boxed type of the wrapped value
 */
public final class TotalOrderFloat<T extends Number> extends Number
        implements Comparable<TotalOrderFloat<T>> {
    private static final long serialVersionUID = 1L;

    /** The kind of float wrapped. */
    private final transient FloatKind<T> kind;

    /** Value of this {@code TotalOrderFloat}. */
    private final T value;

    private TotalOrderFloat(FloatKind<T> kind, T value) {
        this.kind = Objects.requireNonNull(kind);
        this.value = Objects.requireNonNull(value);
    }

    /**
     * Wrap a value of the given kind. Any value is accepted, including
     * NaN.
     *
     * @param <T> boxed type of the wrapped value
     * @param kind of float
     * @param value to wrap
     * @return the wrapped value
     */
    public static <T extends Number> TotalOrderFloat<T> of(
            FloatKind<T> kind, T value) {
        return new TotalOrderFloat<>(kind, value);
    }

    /**
     * Wrap a {@code double}. Any value is accepted, including NaN.
     *
     * @param value to wrap
     * @return the wrapped value
     */
    public static TotalOrderFloat<Double> of(double value) {
        return new TotalOrderFloat<>(FloatKind.FLOAT64, value);
    }

    /**
     * Wrap a {@code float}. Any value is accepted, including NaN.
     *
     * @param value to wrap
     * @return the wrapped value
     */
    public static TotalOrderFloat<Float> of(float value) {
        return new TotalOrderFloat<>(FloatKind.FLOAT32, value);
    }

    /** @return the wrapped value, exactly as it was wrapped */
    public T value() { return value; }

    /** @return the kind of float wrapped */
    public FloatKind<T> kind() { return kind; }

    /** @return whether the wrapped value is (any) NaN */
    public boolean isNaN() { return kind.isNaN(value); }

    /**
     * The canonical 64-bit word from which the hash is computed: the
     * same for all NaNs, and the same for both zeros.
     *
     * @return canonical word of the value
     * @see CanonicalBits
     */
    public long canonicalBits() {
        // Every NaN hashes as the kind's representative NaN
        return CanonicalBits.of(kind, isNaN() ? kind.nan() : value);
    }

    // Total order, equality and hash ---------------------------------

    /**
     * {@inheritDoc}
     * <p>
     * Where neither value is NaN, this is the order of the float type.
     * A NaN is greater than any other value and equal to another NaN.
     */
    @Override
    public int compareTo(TotalOrderFloat<T> other) {
        boolean nan = isNaN(), otherNaN = other.isNaN();
        if (nan)
            return otherNaN ? 0 : 1;
        else if (otherNaN)
            return -1;
        else
            return kind.compareOrdered(value, other.value);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Two wrappers of the same kind are equal if both hold NaN, or
     * neither holds NaN and their values are equal as floats.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        } else if (obj instanceof TotalOrderFloat) {
            TotalOrderFloat<?> other = (TotalOrderFloat<?>)obj;
            if (other.kind != kind) { return false; }
            @SuppressWarnings("unchecked")
            T otherValue = (T)other.value;
            boolean nan = isNaN();
            if (nan || kind.isNaN(otherValue))
                return nan && kind.isNaN(otherValue);
            else
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

    // Serialization --------------------------------------------------

    /**
     * Recover the kind after Java deserialization.
     *
     * @return equivalent instance with the kind restored
     */
    private Object readResolve() {
        return new TotalOrderFloat<>(kindOf(value), value);
    }

    /**
     * Look up the kind of a boxed value.
     *
     * @param <T> boxed type
     * @param value whose kind is needed
     * @return kind for the class of {@code value}
     */
    @SuppressWarnings("unchecked")
    static <T extends Number> FloatKind<T> kindOf(T value) {
        return FloatKind.of((Class<T>)value.getClass());
    }
}
