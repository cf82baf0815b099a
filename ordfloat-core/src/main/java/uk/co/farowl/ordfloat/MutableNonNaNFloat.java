// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

import java.util.Objects;

import uk.co.farowl.ordfloat.kind.FloatKind;

/**
 * A variable holding a {@link NonNaNFloat}, with assignment-style
 * arithmetic ({@code x += y} and so on) that updates it in place.
 * <p>
 * Each in-place operation computes its result and checks it before
 * storing it. If the result would be NaN, {@link NaNInvariantError} is
 * thrown and the variable keeps its previous value, so the invariant is
 * never observed broken, even by code that catches the error.
 * <p>
 * Unlike {@code NonNaNFloat}, this class is mutable, and so is not a
 * suitable key for a map. It is not thread-safe.
 *
 * @param <T> boxed type of the held value
 */
public class MutableNonNaNFloat<T extends Number> {

    /** Current value of the variable. */
    private NonNaNFloat<T> value;

    /**
     * Create a variable with the given initial value.
     *
     * @param value initial value
     */
    public MutableNonNaNFloat(NonNaNFloat<T> value) {
        this.value = Objects.requireNonNull(value);
    }

    /**
     * Create a variable initialised to zero of the given kind.
     *
     * @param kind of float
     */
    public MutableNonNaNFloat(FloatKind<T> kind) {
        this(NonNaNFloat.zero(kind));
    }

    /** @return the current value */
    public NonNaNFloat<T> get() { return value; }

    /**
     * Replace the value.
     *
     * @param value new value
     */
    public void set(NonNaNFloat<T> value) {
        this.value = Objects.requireNonNull(value);
    }

    /** @return the kind of float held */
    public FloatKind<T> kind() { return value.kind(); }

    // In-place arithmetic --------------------------------------------

    /**
     * {@code this += other}
     *
     * @param other right operand
     * @return this variable
     * @throws NaNInvariantError if the result would be NaN
     */
    public MutableNonNaNFloat<T> addAssign(NonNaNFloat<T> other)
            throws NaNInvariantError {
        value = value.add(other);
        return this;
    }

    /**
     * {@code this += other}
     *
     * @param other right operand (not NaN)
     * @return this variable
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public MutableNonNaNFloat<T> addAssign(T other)
            throws NaNInvariantError {
        value = value.add(other);
        return this;
    }

    /**
     * {@code this -= other}
     *
     * @param other right operand
     * @return this variable
     * @throws NaNInvariantError if the result would be NaN
     */
    public MutableNonNaNFloat<T> subtractAssign(NonNaNFloat<T> other)
            throws NaNInvariantError {
        value = value.subtract(other);
        return this;
    }

    /**
     * {@code this -= other}
     *
     * @param other right operand (not NaN)
     * @return this variable
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public MutableNonNaNFloat<T> subtractAssign(T other)
            throws NaNInvariantError {
        value = value.subtract(other);
        return this;
    }

    /**
     * {@code this *= other}
     *
     * @param other right operand
     * @return this variable
     * @throws NaNInvariantError if the result would be NaN
     */
    public MutableNonNaNFloat<T> multiplyAssign(NonNaNFloat<T> other)
            throws NaNInvariantError {
        value = value.multiply(other);
        return this;
    }

    /**
     * {@code this *= other}
     *
     * @param other right operand (not NaN)
     * @return this variable
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public MutableNonNaNFloat<T> multiplyAssign(T other)
            throws NaNInvariantError {
        value = value.multiply(other);
        return this;
    }

    /**
     * {@code this /= other}
     *
     * @param other right operand
     * @return this variable
     * @throws NaNInvariantError if the result would be NaN
     */
    public MutableNonNaNFloat<T> divideAssign(NonNaNFloat<T> other)
            throws NaNInvariantError {
        value = value.divide(other);
        return this;
    }

    /**
     * {@code this /= other}
     *
     * @param other right operand (not NaN)
     * @return this variable
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public MutableNonNaNFloat<T> divideAssign(T other)
            throws NaNInvariantError {
        value = value.divide(other);
        return this;
    }

    /**
     * {@code this %= other}
     *
     * @param other right operand
     * @return this variable
     * @throws NaNInvariantError if the result would be NaN
     */
    public MutableNonNaNFloat<T> remainderAssign(NonNaNFloat<T> other)
            throws NaNInvariantError {
        value = value.remainder(other);
        return this;
    }

    /**
     * {@code this %= other}
     *
     * @param other right operand (not NaN)
     * @return this variable
     * @throws NaNInvariantError if {@code other} or the result is NaN
     */
    public MutableNonNaNFloat<T> remainderAssign(T other)
            throws NaNInvariantError {
        value = value.remainder(other);
        return this;
    }

    @Override
    public String toString() { return value.toString(); }
}
