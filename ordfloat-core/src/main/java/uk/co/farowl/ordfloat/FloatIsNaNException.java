// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

/**
 * A NaN was supplied where a non-NaN value was required, typically to
 * {@link NonNaNFloat#of(double)}. The exception carries no information
 * beyond its type: the offending value is always (some) NaN.
 */
public class FloatIsNaNException extends Exception {
    private static final long serialVersionUID = 1L;

    /** The message of every instance. */
    public static final String MESSAGE = "NotNaN constructed with NaN";

    /** Construct with the standard message. */
    public FloatIsNaNException() { super(MESSAGE); }
}
