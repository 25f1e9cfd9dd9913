package org.jouca.darwin_feed.exceptions;

/**
 * Thrown when a decompressed message body is not well-formed XML.
 *
 * <p>Missing optional elements or attributes never raise this exception; it is reserved
 * for empty, truncated or syntactically invalid payloads. The message carrying the payload
 * is dropped.
 *
 * @author Jouca
 * @since 1.0
 */
public class MalformedPayloadException extends FeedProcessingException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new malformed payload exception with the specified detail message.
     *
     * @param message the detail message explaining the error
     */
    public MalformedPayloadException(String message) {
        super(message);
    }

    /**
     * Constructs a new malformed payload exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the error
     * @param cause the underlying parser error
     */
    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new malformed payload exception with the specified cause.
     *
     * @param cause the underlying parser error
     */
    public MalformedPayloadException(Throwable cause) {
        super(cause);
    }
}
