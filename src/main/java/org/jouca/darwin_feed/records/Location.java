package org.jouca.darwin_feed.records;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

import org.jouca.darwin_feed.calculators.DelayCalculator;

/**
 * Represents one stopping or timing point of a service within a train status update.
 * <p>
 * Scheduled times are kept as the raw strings found in the feed; they are only parsed
 * when a delay is computed. Events are explicitly optional: an {@code arr}, {@code dep}
 * or {@code pass} element that was present in the payload yields a present event even
 * when all of its attributes are empty.
 * </p>
 *
 * @param tpl       The timing point location code (TIPLOC).
 * @param pta       Public scheduled time of arrival, or empty.
 * @param ptd       Public scheduled time of departure, or empty.
 * @param wta       Working scheduled time of arrival, or empty.
 * @param wtd       Working scheduled time of departure, or empty.
 * @param wtp       Working scheduled time of passing, or empty.
 * @param arrival   The arrival event, if one was reported.
 * @param departure The departure event, if one was reported.
 * @param pass      The passing event, if one was reported.
 *
 * @author Jouca
 * @since 1.0
 *
 * @see DelayCalculator
 */
public record Location(
        String tpl,
        String pta,
        String ptd,
        String wta,
        String wtd,
        String wtp,
        Optional<Event> arrival,
        Optional<Event> departure,
        Optional<Event> pass) implements Renderable {

    public Location {
        Objects.requireNonNull(tpl, "tpl");
        Objects.requireNonNull(pta, "pta");
        Objects.requireNonNull(ptd, "ptd");
        Objects.requireNonNull(wta, "wta");
        Objects.requireNonNull(wtd, "wtd");
        Objects.requireNonNull(wtp, "wtp");
        Objects.requireNonNull(arrival, "arrival");
        Objects.requireNonNull(departure, "departure");
        Objects.requireNonNull(pass, "pass");
    }

    /**
     * Renders the location code, every scheduled time and event that is set, and a delay
     * line when the train arrived late.
     *
     * @throws org.jouca.darwin_feed.exceptions.TimeFormatException if the arrival delay
     *         cannot be computed because a time value is malformed
     */
    @Override
    public String render() {
        StringBuilder s = new StringBuilder("\n\t-- ").append(tpl);

        appendField(s, "Public Time Arrive", pta);
        appendField(s, "Public Time Depart", ptd);
        appendField(s, "Working Time Arrive", wta);
        appendField(s, "Working Time Depart", wtd);
        appendField(s, "Working Time Pass", wtp);

        appendEvent(s, "Arrival", arrival);
        appendEvent(s, "Departure", departure);
        appendEvent(s, "Pass", pass);

        // Only late arrivals are surfaced; early and on-time ones are computed but not shown
        OptionalDouble delay = DelayCalculator.arrivalDelay(this);
        if (delay.isPresent() && delay.getAsDouble() > 0) {
            s.append(String.format(Locale.ROOT, "\n\t   DELAY: %f", delay.getAsDouble()));
        }

        s.append('\n');
        return s.toString();
    }

    private static void appendField(StringBuilder s, String label, String value) {
        if (!value.isEmpty()) {
            s.append(" | ").append(label).append(": ").append(value);
        }
    }

    private static void appendEvent(StringBuilder s, String label, Optional<Event> event) {
        event.ifPresent(e -> {
            s.append(" | ").append(label).append(':');
            String rendered = e.render();
            if (!rendered.isEmpty()) {
                s.append(' ').append(rendered);
            }
        });
    }
}
