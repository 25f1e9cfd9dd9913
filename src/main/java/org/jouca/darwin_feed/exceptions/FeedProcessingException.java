package org.jouca.darwin_feed.exceptions;

/**
 * Exception thrown when a single Darwin feed message cannot be turned into a rendered summary.
 *
 * <p>The failure is always local to the message being processed. Typical causes:
 * <ul>
 *   <li>A message body that is not a valid gzip stream</li>
 *   <li>A payload that is not well-formed XML ({@link MalformedPayloadException})</li>
 *   <li>A time-of-day value in an unrecognised layout ({@link TimeFormatException})</li>
 * </ul>
 *
 * @author Jouca
 * @since 1.0
 */
public class FeedProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new feed processing exception with the specified detail message.
     *
     * @param message the detail message explaining the error
     */
    public FeedProcessingException(String message) {
        super(message);
    }

    /**
     * Constructs a new feed processing exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the error
     * @param cause the underlying cause of the error
     */
    public FeedProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new feed processing exception with the specified cause.
     *
     * @param cause the underlying cause of the error
     */
    public FeedProcessingException(Throwable cause) {
        super(cause);
    }
}
