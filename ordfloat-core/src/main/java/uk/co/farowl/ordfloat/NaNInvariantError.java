// Copyright (c)2025 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ordfloat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Error thrown when an operation on a {@link NonNaNFloat} would break
 * its invariant, that the value is never NaN. This is a fatal
 * condition: arithmetic that produces NaN, a NaN operand supplied to
 * arithmetic, or a NaN passed to a conversion that cannot report
 * failure any other way. A recoverable failure of construction is
 * signalled instead by {@link FloatIsNaNException}.
 * <p>
 * As an {@code Error}, this is not meant to be caught by ordinary
 * application code.
 */
public class NaNInvariantError extends Error {
    private static final long serialVersionUID = 1L;

    /**
     * Logger for invariant errors. These are raised from deep inside
     * arithmetic and may be lost if an application catches
     * {@code Throwable} carelessly: this gives us a second chance to
     * notice.
     */
    static final Logger logger =
            LoggerFactory.getLogger(NaNInvariantError.class);

    /**
     * Constructor specifying a message.
     *
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public NaNInvariantError(String msg, Object... args) {
        super(String.format(msg, args));
        logger.atError().log(getMessage());
    }

    /**
     * Constructor specifying a cause and a message.
     *
     * @param cause a Java exception behind the error
     * @param msg a Java format string for the message
     * @param args to insert in the format string
     */
    public NaNInvariantError(Throwable cause, String msg,
            Object... args) {
        super(String.format(msg, args), cause);
        logger.atError().setCause(cause).log(getMessage());
    }
}
