package org.jouca.darwin_feed.records;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Represents an observed or forecast occurrence of a train at a location
 * (an {@code arr}, {@code dep} or {@code pass} element of a train status update).
 * <p>
 * Either time may be empty: an event can carry only a forecast, only an observation,
 * or both while the feed transitions from one to the other. Whether an event exists at all
 * is tracked by its owning {@link Location}, not by the emptiness of these fields.
 * </p>
 *
 * @param actual    The actual time ({@code at}), empty if the event has not been observed yet.
 * @param estimated The estimated time ({@code et}), empty if no forecast is available.
 * @param source    The provenance of the data ({@code src}, e.g. "TD" or "Darwin"), empty if unknown.
 *
 * @author Jouca
 * @since 1.0
 */
public record Event(String actual, String estimated, String source) implements Renderable {

    public Event {
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(estimated, "estimated");
        Objects.requireNonNull(source, "source");
    }

    @Override
    public String render() {
        List<String> parts = new ArrayList<>(3);
        if (!actual.isEmpty()) {
            parts.add("ACTUAL " + actual);
        }
        if (!estimated.isEmpty()) {
            parts.add("ESTIMATED " + estimated);
        }
        if (!source.isEmpty()) {
            parts.add("(Source: " + source + ")");
        }
        return String.join(" ", parts);
    }
}
