package com.flowscribe.core.model;

import java.util.List;

/**
 * Plain node/edge graph produced by a loader.
 *
 * @param nodes nodes in document order
 * @param edges edges in document order
 */
public record DiagramGraph(
    List<GraphNode> nodes,
    List<GraphEdge> edges
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Returns a graph without nodes or edges.
     *
     * @return empty graph
     */
    public static DiagramGraph empty() {
        return new DiagramGraph(List.of(), List.of());
    }

    /**
     * Checks whether the graph has no nodes.
     *
     * @return true if there are no nodes
     */
    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
