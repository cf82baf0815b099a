// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

/**
 * An error parsing the text of a {@link NonNaNFloat}. There are two
 * kinds, given by {@link #getKind()}: either the text was not a valid
 * floating-point literal, in which case the {@link #getCause() cause}
 * is the {@code NumberFormatException} from the underlying parser, or
 * the text was valid but denoted NaN.
 */
public class ParseNotNaNException extends Exception {
    private static final long serialVersionUID = 1L;

    /** The ways in which parsing may fail. */
    public enum Kind {
        /** A plain parse error from the underlying float type. */
        PARSE_FLOAT_ERROR,
        /** The parsed float value was NaN. */
        IS_NAN
    }

    private final Kind kind;

    /**
     * Wrap the error from the underlying parser.
     *
     * @param cause from the underlying parser
     */
    public ParseNotNaNException(NumberFormatException cause) {
        super("Error parsing a not-NaN floating point value: "
                + cause.getMessage(), cause);
        this.kind = Kind.PARSE_FLOAT_ERROR;
    }

    /**
     * Signal that the text parsed to NaN.
     *
     * @param text that was parsed
     */
    public ParseNotNaNException(String text) {
        // A null cause here fixes the cause, so initCause is refused
        super(String.format("Error parsing a not-NaN floating point "
                + "value: '%s' is NaN", text), null);
        this.kind = Kind.IS_NAN;
    }

    /** @return which kind of failure this is */
    public Kind getKind() { return kind; }

    @Override
    public synchronized NumberFormatException getCause() {
        return (NumberFormatException)super.getCause();
    }
}
