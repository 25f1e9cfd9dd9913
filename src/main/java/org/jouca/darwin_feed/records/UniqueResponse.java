package org.jouca.darwin_feed.records;

import java.util.Objects;

/**
 * Represents the update response ({@code uR}) element of a Push Port message.
 *
 * @param updateOrigin The system the update originated from (e.g. "TD", "CIS", "Trust"), or empty.
 * @param ts           The train status block carried by the response.
 *
 * @author Jouca
 * @since 1.0
 */
public record UniqueResponse(String updateOrigin, Timestamp ts) implements Renderable {

    public UniqueResponse {
        Objects.requireNonNull(updateOrigin, "updateOrigin");
        Objects.requireNonNull(ts, "ts");
    }

    /**
     * @return a response with no origin and an empty train status block
     */
    public static UniqueResponse empty() {
        return new UniqueResponse("", Timestamp.empty());
    }

    @Override
    public String render() {
        return "\nUpdate Origin: " + updateOrigin + "\n\n" + ts.render();
    }
}
