package org.Aayush.arclookup.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Storage sizing hints for a {@link ListDigraph}.
 * <p>
 * Hints only pre-size internal arrays; graphs grow past them on demand.
 */
@Value
@Builder
public class DigraphConfig {

    /**
     * Number of nodes to reserve room for.
     */
    @Builder.Default
    int expectedNodes = 16;

    /**
     * Number of arcs to reserve room for.
     */
    @Builder.Default
    int expectedArcs = 64;

    /**
     * Returns the default sizing (16 nodes, 64 arcs).
     */
    public static DigraphConfig defaults() {
        return DigraphConfig.builder().build();
    }

    /**
     * Validates hint ranges.
     *
     * @throws IllegalArgumentException if either hint is negative.
     */
    void validate() {
        if (expectedNodes < 0) {
            throw new IllegalArgumentException("expectedNodes must be >= 0");
        }
        if (expectedArcs < 0) {
            throw new IllegalArgumentException("expectedArcs must be >= 0");
        }
    }
}
