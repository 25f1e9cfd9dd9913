package org.jouca.darwin_feed.fetchers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

import org.jouca.darwin_feed.exceptions.FeedProcessingException;

/**
 * Inflates message bodies received from the Push Port feed.
 *
 * <p>The feed delivers every message body as a gzip stream. Bodies that do not start with
 * the gzip magic bytes (for example XML replayed from disk or posted over HTTP) are returned
 * unchanged, so callers can pass any body through this class.
 *
 * @author Jouca
 * @since 1.0
 */
public class PayloadDecompressor {

    /** First two bytes of every gzip stream (RFC 1952) */
    private static final int GZIP_MAGIC_1 = 0x1f;
    private static final int GZIP_MAGIC_2 = 0x8b;

    private PayloadDecompressor() {
    }

    /**
     * Returns the decompressed body.
     *
     * @param body the raw message body
     * @return the inflated bytes for a gzip body, the body itself otherwise
     * @throws FeedProcessingException if the body claims to be gzip but cannot be inflated
     */
    public static byte[] decompress(byte[] body) {
        if (!isGzip(body)) {
            return body;
        }

        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new FeedProcessingException("Failed to decompress message body", e);
        }
    }

    /**
     * @param body the raw message body, may be null
     * @return whether the body starts with the gzip magic bytes
     */
    public static boolean isGzip(byte[] body) {
        return body != null
                && body.length >= 2
                && (body[0] & 0xff) == GZIP_MAGIC_1
                && (body[1] & 0xff) == GZIP_MAGIC_2;
    }
}
