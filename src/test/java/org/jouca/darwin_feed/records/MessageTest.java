package org.jouca.darwin_feed.records;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Message, UniqueResponse and Timestamp rendering.
 */
class MessageTest {

    private static Location location(String tpl) {
        return new Location(tpl, "", "", "", "", "", Optional.empty(), Optional.empty(), Optional.empty());
    }

    @Test
    void testRenderHeaderOnlyWithoutUpdateOrigin() {
        Message message = new Message("", "", "", "2024-03-12T10:07:41Z", "16.0", UniqueResponse.empty());

        assertEquals("[2024-03-12T10:07:41Z v16.0]:", message.render());
    }

    @Test
    void testRenderSkipsResponseWithEmptyOrigin() {
        Timestamp ts = new Timestamp("202403127654321", "", "", List.of(location("RDNGSTN")));
        Message message = new Message("", "", "", "ts", "16.0", new UniqueResponse("", ts));

        assertEquals("[ts v16.0]:", message.render());
    }

    @Test
    void testRenderFullMessage() {
        Timestamp ts = new Timestamp("202403127654321", "2024-03-12", "C12345",
                List.of(location("RDNGSTN"), location("TWYFORD")));
        Message message = new Message("", "", "", "ts", "16.0", new UniqueResponse("TD", ts));

        String expected = "[ts v16.0]:"
                + "\n\t"
                + "\nUpdate Origin: TD\n\n"
                + "RID: 202403127654321 SSD: 2024-03-12 UID: C12345 "
                + "\n\n\t-- RDNGSTN\n"
                + "\n\n\t-- TWYFORD\n";
        assertEquals(expected, message.render());
    }

    @Test
    void testTimestampRendersOnlyPresentIdentifiers() {
        assertEquals("SSD: 2024-03-12 ", new Timestamp("", "2024-03-12", "", List.of()).render());
        assertEquals("RID: 1 UID: C1 ", new Timestamp("1", "", "C1", List.of()).render());
        assertEquals("", Timestamp.empty().render());
    }

    @Test
    void testTimestampKeepsLocationOrder() {
        Timestamp ts = new Timestamp("", "", "", List.of(location("A"), location("B"), location("C")));
        String rendered = ts.render();

        assertTrue(rendered.indexOf("-- A") < rendered.indexOf("-- B"));
        assertTrue(rendered.indexOf("-- B") < rendered.indexOf("-- C"));
    }

    @Test
    void testTimestampLocationsAreImmutableCopy() {
        List<Location> locations = new ArrayList<>(List.of(location("A")));
        Timestamp ts = new Timestamp("", "", "", locations);
        locations.add(location("B"));

        assertEquals(1, ts.locations().size());
        assertThrows(UnsupportedOperationException.class, () -> ts.locations().add(location("C")));
    }

    @Test
    void testUniqueResponseRender() {
        UniqueResponse response = new UniqueResponse("CIS", new Timestamp("9", "", "", List.of()));

        assertEquals("\nUpdate Origin: CIS\n\nRID: 9 ", response.render());
    }

    @Test
    void testRenderIsIdempotent() {
        Timestamp ts = new Timestamp("1", "", "", List.of(location("RDNGSTN")));
        Message message = new Message("", "", "", "ts", "16.0", new UniqueResponse("TD", ts));

        assertEquals(message.render(), message.render());
    }
}
