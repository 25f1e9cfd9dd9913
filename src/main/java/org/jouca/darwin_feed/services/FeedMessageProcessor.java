package org.jouca.darwin_feed.services;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.jouca.darwin_feed.exceptions.FeedProcessingException;
import org.jouca.darwin_feed.fetchers.PayloadDecompressor;
import org.jouca.darwin_feed.parsers.MessageDecoder;
import org.jouca.darwin_feed.records.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns raw feed message bodies into rendered summaries.
 *
 * <p>Each body goes through the same steps:
 * <ol>
 *   <li>Decompression of the gzip body</li>
 *   <li>Decoding of the Push Port XML into a {@link Message}</li>
 *   <li>Rendering of the message, which computes arrival delays per location</li>
 * </ol>
 *
 * <p>The processor keeps no state between messages, so a failure in one body has no effect
 * on the next and bodies may be processed from any thread.
 *
 * @author Jouca
 * @since 1.0
 *
 * @see MessageDecoder
 * @see PayloadDecompressor
 */
@Service
public class FeedMessageProcessor {
    private static final Logger logger = LoggerFactory.getLogger(FeedMessageProcessor.class);

    private final MessageDecoder decoder;

    public FeedMessageProcessor(MessageDecoder decoder) {
        this.decoder = decoder;
    }

    /**
     * Decompresses and decodes a message body.
     *
     * @param body the raw body, gzip-compressed or plain XML
     * @return the decoded message
     * @throws FeedProcessingException if the body cannot be decompressed or decoded
     */
    public Message decode(byte[] body) {
        byte[] xml = PayloadDecompressor.decompress(body);
        if (logger.isDebugEnabled() && xml != null) {
            logger.debug("Raw payload: {}", new String(xml, StandardCharsets.UTF_8));
        }
        return decoder.decode(xml);
    }

    /**
     * Decompresses, decodes and renders a message body.
     *
     * @param body the raw body, gzip-compressed or plain XML
     * @return the rendered summary of the message
     * @throws FeedProcessingException if any step fails; the error is specific to this body
     */
    public String render(byte[] body) {
        return decode(body).render();
    }

    /**
     * Renders a message body received from the feed and logs the result.
     * <p>
     * Failures are logged and reported as an empty result; the message is dropped and
     * processing of later messages continues unaffected.
     * </p>
     *
     * @param body the raw body, gzip-compressed or plain XML
     * @return the rendered summary, or empty if the body could not be processed
     */
    public Optional<String> handle(byte[] body) {
        try {
            String rendered = render(body);
            logger.info("{}\n", rendered);
            return Optional.of(rendered);
        } catch (FeedProcessingException e) {
            logger.error("Dropping feed message: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }
}
