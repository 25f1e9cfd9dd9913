package org.jouca.darwin_feed.exceptions;

/**
 * Thrown when a non-empty time-of-day value matches neither {@code HH:mm} nor {@code HH:mm:ss}.
 *
 * <p>A delay is never defaulted to zero when this happens; the exception propagates and the
 * current message is abandoned.
 *
 * @author Jouca
 * @since 1.0
 */
public class TimeFormatException extends FeedProcessingException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new time format exception with the specified detail message.
     *
     * @param message the detail message explaining the error
     */
    public TimeFormatException(String message) {
        super(message);
    }

    /**
     * Constructs a new time format exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the error
     * @param cause the underlying parser error
     */
    public TimeFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new time format exception with the specified cause.
     *
     * @param cause the underlying parser error
     */
    public TimeFormatException(Throwable cause) {
        super(cause);
    }
}
