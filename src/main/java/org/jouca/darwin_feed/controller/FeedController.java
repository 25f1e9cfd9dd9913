package org.jouca.darwin_feed.controller;

import java.util.OptionalDouble;

import org.jouca.darwin_feed.calculators.DelayCalculator;
import org.jouca.darwin_feed.exceptions.FeedProcessingException;
import org.jouca.darwin_feed.exceptions.TimeFormatException;
import org.jouca.darwin_feed.records.Location;
import org.jouca.darwin_feed.records.Message;
import org.jouca.darwin_feed.services.FeedMessageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * REST controller for rendering Push Port messages on demand.
 *
 * <p>Both endpoints accept a single message body, either gzip-compressed as delivered by the
 * feed or as plain XML. Nothing is stored between requests.</p>
 *
 * <p>Error mapping:</p>
 * <ul>
 *   <li>400 (BAD_REQUEST) - the body is not well-formed XML or not a valid gzip stream</li>
 *   <li>422 (UNPROCESSABLE_ENTITY) - a time value in the message has an unrecognised layout</li>
 * </ul>
 *
 * @author Jouca
 * @since 1.0
 */
@RestController
public class FeedController {
    private static final Logger logger = LoggerFactory.getLogger(FeedController.class);

    private final FeedMessageProcessor processor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public FeedController(FeedMessageProcessor processor) {
        this.processor = processor;
    }

    /**
     * Renders a message as the same text block that is logged for feed messages.
     *
     * <p><b>Example usage:</b></p>
     * <pre>
     * curl -X POST --data-binary @message.xml http://localhost:8080/render
     * </pre>
     *
     * @param body the message body
     * @return ResponseEntity containing the rendered text with HTTP status 200 (OK), or an
     *         error status as described in the class documentation
     */
    @PostMapping("/render")
    public ResponseEntity<String> render(@RequestBody byte[] body) {
        String rendered;
        try {
            rendered = processor.render(body);
        } catch (FeedProcessingException e) {
            return errorResponse(e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CONTENT_TYPE, "text/plain; charset=UTF-8");
        return new ResponseEntity<>(rendered, headers, HttpStatus.OK);
    }

    /**
     * Computes the arrival and departure delay of every location in a message.
     *
     * <p>The response is a JSON array in stopping order, for example:</p>
     * <pre>
     * [ { "tpl": "RDNGSTN", "arrivalDelay": 7.0, "departureDelay": null } ]
     * </pre>
     * <p>A delay is {@code null} when it cannot be computed for that location.</p>
     *
     * @param body the message body
     * @return ResponseEntity containing the JSON delay summary with HTTP status 200 (OK), or an
     *         error status as described in the class documentation
     */
    @PostMapping("/delays")
    public ResponseEntity<String> delays(@RequestBody byte[] body) {
        ArrayNode result = objectMapper.createArrayNode();
        try {
            Message message = processor.decode(body);
            for (Location location : message.uniqueResponse().ts().locations()) {
                ObjectNode entry = result.addObject();
                entry.put("tpl", location.tpl());
                putDelay(entry, "arrivalDelay", DelayCalculator.arrivalDelay(location));
                putDelay(entry, "departureDelay", DelayCalculator.departureDelay(location));
            }
        } catch (FeedProcessingException e) {
            return errorResponse(e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CONTENT_TYPE, "application/json");
        try {
            return new ResponseEntity<>(objectMapper.writeValueAsString(result), headers, HttpStatus.OK);
        } catch (JsonProcessingException e) {
            logger.error("Error writing delay summary: {}", e.getMessage(), e);
            return new ResponseEntity<>(HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    private static void putDelay(ObjectNode entry, String field, OptionalDouble delay) {
        if (delay.isPresent()) {
            entry.put(field, delay.getAsDouble());
        } else {
            entry.putNull(field);
        }
    }

    private static ResponseEntity<String> errorResponse(FeedProcessingException e) {
        HttpStatus status = e instanceof TimeFormatException
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        logger.warn("Rejected message body ({}): {}", status.value(), e.getMessage());

        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.CONTENT_TYPE, "text/plain; charset=UTF-8");
        return new ResponseEntity<>(e.getMessage(), headers, status);
    }
}
