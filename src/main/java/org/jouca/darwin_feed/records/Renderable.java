package org.jouca.darwin_feed.records;

/**
 * A node of a decoded feed message that can describe itself as readable text.
 *
 * <p>Implementations build their text only from their own fields and the renderings of
 * their children. Rendering the same node twice yields identical output.
 *
 * @author Jouca
 * @since 1.0
 */
public interface Renderable {

    /**
     * @return the human-readable text for this node, including its children
     */
    String render();
}
