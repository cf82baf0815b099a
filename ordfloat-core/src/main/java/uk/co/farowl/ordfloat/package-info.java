/**
 * The {@code ordfloat} package contains wrappers for floating-point
 * values that may be sorted, and used as keys in hashed and ordered
 * collections.
 * <p>
 * {@link uk.co.farowl.ordfloat.TotalOrderFloat} accepts any value and
 * places NaN after every other value.
 * {@link uk.co.farowl.ordfloat.NonNaNFloat} excludes NaN altogether,
 * and keeps it excluded through arithmetic. Both hash through
 * {@link uk.co.farowl.ordfloat.CanonicalBits}.
 */
package uk.co.farowl.ordfloat;
