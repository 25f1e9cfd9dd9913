package org.jouca.darwin_feed.parsers;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.jouca.darwin_feed.exceptions.MalformedPayloadException;
import org.jouca.darwin_feed.records.Event;
import org.jouca.darwin_feed.records.Location;
import org.jouca.darwin_feed.records.Message;
import org.jouca.darwin_feed.records.Timestamp;
import org.jouca.darwin_feed.records.UniqueResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

/**
 * Decodes Push Port XML payloads into {@link Message} trees.
 *
 * <p>The payload is read into a Jackson tree with {@link XmlMapper}; attributes and child
 * elements both appear as fields keyed by their local name, so namespace prefixes such as
 * {@code ns5:Location} are irrelevant. Repeated elements arrive as arrays and are kept in
 * document order.
 *
 * <p>Decoding is lenient about content and strict about syntax:
 * <ul>
 *   <li>Missing attributes become empty strings</li>
 *   <li>Missing {@code arr}, {@code dep} and {@code pass} elements become absent events</li>
 *   <li>Unknown elements and attributes are ignored</li>
 *   <li>Only an empty or non-well-formed payload is rejected</li>
 * </ul>
 *
 * <p>Instances are stateless apart from the thread-safe mapper and may be shared between threads.
 *
 * @author Jouca
 * @since 1.0
 */
@Component
public class MessageDecoder {
    private static final Logger logger = LoggerFactory.getLogger(MessageDecoder.class);

    /** Fails on anything after the root element: a second root, stray tags or junk text */
    private final XmlMapper xmlMapper = XmlMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /**
     * Decodes one decompressed message body.
     *
     * @param payload the XML bytes of a single Push Port message
     * @return the decoded message
     * @throws MalformedPayloadException if the payload is empty or is not well-formed XML
     */
    public Message decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MalformedPayloadException("Payload is empty");
        }

        JsonNode root;
        try {
            root = xmlMapper.readTree(payload);
        } catch (IOException e) {
            throw new MalformedPayloadException("Payload is not well-formed XML: " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new MalformedPayloadException("Payload contains no root element");
        }

        String[] namespaces = readRootNamespaces(payload);

        JsonNode ur = first(root.path("uR"));
        UniqueResponse uniqueResponse = ur.isMissingNode()
                ? UniqueResponse.empty()
                : new UniqueResponse(text(ur, "updateOrigin"), decodeTimestamp(first(ur.path("TS"))));

        Message message = new Message(
                namespaces[0],
                namespaces[1],
                namespaces[2],
                text(root, "ts"),
                text(root, "version"),
                uniqueResponse);

        logger.debug("Decoded message {} with {} location(s)", message.timestamp(),
                uniqueResponse.ts().locations().size());
        return message;
    }

    private Timestamp decodeTimestamp(JsonNode ts) {
        if (ts.isMissingNode()) {
            return Timestamp.empty();
        }

        List<Location> locations = new ArrayList<>();
        JsonNode locationNodes = ts.path("Location");
        if (locationNodes.isArray()) {
            locationNodes.forEach(node -> locations.add(decodeLocation(node)));
        } else if (!locationNodes.isMissingNode()) {
            locations.add(decodeLocation(locationNodes));
        }

        return new Timestamp(text(ts, "rid"), text(ts, "ssd"), text(ts, "uid"), locations);
    }

    private Location decodeLocation(JsonNode node) {
        return new Location(
                text(node, "tpl"),
                text(node, "pta"),
                text(node, "ptd"),
                text(node, "wta"),
                text(node, "wtd"),
                text(node, "wtp"),
                decodeEvent(node.path("arr")),
                decodeEvent(node.path("dep")),
                decodeEvent(node.path("pass")));
    }

    private Optional<Event> decodeEvent(JsonNode node) {
        JsonNode event = first(node);
        if (event.isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(new Event(text(event, "at"), text(event, "et"), text(event, "src")));
    }

    /**
     * Reads the default, {@code ns2} and {@code ns3} namespace declarations of the root element.
     * Only called once the payload is known to be well-formed.
     */
    private String[] readRootNamespaces(byte[] payload) {
        String[] namespaces = {"", "", ""};
        XMLStreamReader reader = null;
        try {
            reader = xmlMapper.getFactory().getXMLInputFactory()
                    .createXMLStreamReader(new ByteArrayInputStream(payload));
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                    for (int i = 0; i < reader.getNamespaceCount(); i++) {
                        String prefix = reader.getNamespacePrefix(i);
                        String uri = reader.getNamespaceURI(i) == null ? "" : reader.getNamespaceURI(i);
                        if (prefix == null || prefix.isEmpty()) {
                            namespaces[0] = uri;
                        } else if ("ns2".equals(prefix)) {
                            namespaces[1] = uri;
                        } else if ("ns3".equals(prefix)) {
                            namespaces[2] = uri;
                        }
                    }
                    break;
                }
            }
        } catch (XMLStreamException e) {
            throw new MalformedPayloadException("Unable to read root element namespaces", e);
        } finally {
            closeQuietly(reader);
        }
        return namespaces;
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            logger.warn("Failed to close XML reader: {}", e.getMessage());
        }
    }

    /**
     * Returns the first element of a repeated node, the node itself otherwise.
     */
    private static JsonNode first(JsonNode node) {
        if (node.isArray()) {
            return node.size() > 0 ? node.get(0) : MissingNode.getInstance();
        }
        return node;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : "";
    }
}
