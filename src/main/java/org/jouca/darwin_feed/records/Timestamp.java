package org.jouca.darwin_feed.records;

import java.util.List;
import java.util.Objects;

/**
 * Represents a train status ({@code TS}) block: a batch of schedule changes for one service.
 *
 * @param rid       The RTTI train identifier, or empty.
 * @param ssd       The scheduled start date of the service, or empty.
 * @param uid       The train UID, or empty.
 * @param locations The locations of the update in document order, which is stopping order.
 *
 * @author Jouca
 * @since 1.0
 */
public record Timestamp(String rid, String ssd, String uid, List<Location> locations) implements Renderable {

    public Timestamp {
        Objects.requireNonNull(rid, "rid");
        Objects.requireNonNull(ssd, "ssd");
        Objects.requireNonNull(uid, "uid");
        locations = List.copyOf(locations);
    }

    /**
     * @return a batch with no identifiers and no locations
     */
    public static Timestamp empty() {
        return new Timestamp("", "", "", List.of());
    }

    @Override
    public String render() {
        StringBuilder s = new StringBuilder();

        if (!rid.isEmpty()) {
            s.append("RID: ").append(rid).append(' ');
        }
        if (!ssd.isEmpty()) {
            s.append("SSD: ").append(ssd).append(' ');
        }
        if (!uid.isEmpty()) {
            s.append("UID: ").append(uid).append(' ');
        }

        for (Location location : locations) {
            s.append('\n').append(location.render());
        }

        return s.toString();
    }
}
