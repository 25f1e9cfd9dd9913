package org.jouca.darwin_feed.records;

import org.jouca.darwin_feed.exceptions.TimeFormatException;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Location rendering.
 */
class LocationTest {

    private static Location arrivalAt(String pta, String actual) {
        return new Location("RDNGSTN", pta, "", "", "", "",
                Optional.of(new Event(actual, "", "")), Optional.empty(), Optional.empty());
    }

    @Test
    void testRenderWithOnlyLocationCode() {
        Location location = new Location("RDNGSTN", "", "", "", "", "",
                Optional.empty(), Optional.empty(), Optional.empty());

        assertEquals("\n\t-- RDNGSTN\n", location.render());
    }

    @Test
    void testRenderAllScheduledTimes() {
        Location location = new Location("RDNGSTN", "10:00", "10:02", "09:59:30", "10:02:30", "10:01",
                Optional.empty(), Optional.empty(), Optional.empty());

        assertEquals("\n\t-- RDNGSTN"
                + " | Public Time Arrive: 10:00"
                + " | Public Time Depart: 10:02"
                + " | Working Time Arrive: 09:59:30"
                + " | Working Time Depart: 10:02:30"
                + " | Working Time Pass: 10:01\n", location.render());
    }

    @Test
    void testRenderLateArrivalAddsDelayLine() {
        String rendered = arrivalAt("10:00", "10:07").render();

        assertEquals("\n\t-- RDNGSTN | Public Time Arrive: 10:00 | Arrival: ACTUAL 10:07"
                + "\n\t   DELAY: 7.000000\n", rendered);
    }

    @Test
    void testRenderEarlyArrivalHasNoDelayLine() {
        String rendered = arrivalAt("10:00", "09:58").render();

        assertFalse(rendered.contains("DELAY"));
    }

    @Test
    void testRenderOnTimeArrivalHasNoDelayLine() {
        String rendered = arrivalAt("09:05", "09:05").render();

        assertFalse(rendered.contains("DELAY"));
    }

    @Test
    void testRenderArrivalWithoutScheduleHasNoDelayLine() {
        String rendered = arrivalAt("", "10:07").render();

        assertEquals("\n\t-- RDNGSTN | Arrival: ACTUAL 10:07\n", rendered);
    }

    @Test
    void testRenderAllEvents() {
        Location location = new Location("TWYFORD", "", "", "", "", "10:06",
                Optional.of(new Event("", "10:05", "Darwin")),
                Optional.of(new Event("10:06", "10:05", "TD")),
                Optional.of(new Event("", "", "")));

        assertEquals("\n\t-- TWYFORD | Working Time Pass: 10:06"
                + " | Arrival: ESTIMATED 10:05 (Source: Darwin)"
                + " | Departure: ACTUAL 10:06 ESTIMATED 10:05 (Source: TD)"
                + " | Pass:\n", location.render());
    }

    @Test
    void testRenderMalformedTimePropagates() {
        Location location = arrivalAt("10:00", "9:5");

        assertThrows(TimeFormatException.class, location::render);
    }

    @Test
    void testRenderIsRepeatable() {
        Location location = arrivalAt("10:00", "10:07");

        assertEquals(location.render(), location.render());
    }

    @Test
    void testNullFieldsRejected() {
        assertThrows(NullPointerException.class, () -> new Location(null, "", "", "", "", "",
                Optional.empty(), Optional.empty(), Optional.empty()));
        assertThrows(NullPointerException.class, () -> new Location("RDNGSTN", "", "", "", "", "",
                null, Optional.empty(), Optional.empty()));
    }
}
