package com.flowscribe.core.model;

import java.util.Objects;

/**
 * A directed edge between two nodes.
 *
 * <p>Several edges between the same ordered pair are allowed and kept independently.
 *
 * @param sourceId source node ID
 * @param targetId target node ID
 * @param label edge label (may be empty)
 */
public record GraphEdge(
    String sourceId,
    String targetId,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public GraphEdge {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        if (label == null) {
            label = "";
        }
    }

    /**
     * Creates an unlabeled edge.
     *
     * @param sourceId source node ID
     * @param targetId target node ID
     * @return new edge
     */
    public static GraphEdge of(String sourceId, String targetId) {
        return new GraphEdge(sourceId, targetId, "");
    }
}
