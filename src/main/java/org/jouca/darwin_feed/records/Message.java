package org.jouca.darwin_feed.records;

import java.util.Objects;

/**
 * Represents one decoded Push Port ({@code Pport}) message received from the feed.
 * <p>
 * A message is built once by {@link org.jouca.darwin_feed.parsers.MessageDecoder} and never
 * modified afterwards. When the payload carried no update response, {@link #uniqueResponse()}
 * is {@link UniqueResponse#empty()}.
 * </p>
 *
 * @param namespace      The default XML namespace declared on the root element, or empty.
 * @param namespace2     The namespace bound to the {@code ns2} prefix, or empty.
 * @param namespace3     The namespace bound to the {@code ns3} prefix, or empty.
 * @param timestamp      The message timestamp ({@code ts}).
 * @param version        The Push Port schema version.
 * @param uniqueResponse The update response carried by the message.
 *
 * @author Jouca
 * @since 1.0
 */
public record Message(
        String namespace,
        String namespace2,
        String namespace3,
        String timestamp,
        String version,
        UniqueResponse uniqueResponse) implements Renderable {

    public Message {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(namespace2, "namespace2");
        Objects.requireNonNull(namespace3, "namespace3");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(uniqueResponse, "uniqueResponse");
    }

    @Override
    public String render() {
        String s = "[" + timestamp + " v" + version + "]:";

        if (!uniqueResponse.updateOrigin().isEmpty()) {
            s = s + "\n\t" + uniqueResponse.render();
        }

        return s;
    }
}
