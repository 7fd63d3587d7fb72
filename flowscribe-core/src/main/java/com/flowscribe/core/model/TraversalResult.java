package com.flowscribe.core.model;

import java.util.List;
import java.util.Map;

/**
 * Visiting order computed by the traverser.
 *
 * <p>{@code order} contains every node ID exactly once: reachable IDs in breadth-first order
 * from the start node, unreachable IDs afterwards. {@code legacyRoles} maps every node to
 * "Unknown"; it predates the role classifier and is kept for callers of the old two-value
 * result.
 *
 * @param order node IDs in visiting order
 * @param legacyRoles deprecated placeholder roles
 */
public record TraversalResult(
    List<String> order,
    @Deprecated Map<String, String> legacyRoles
) {
    /**
     * Compact constructor with validation.
     */
    public TraversalResult {
        order = order == null ? List.of() : List.copyOf(order);
        legacyRoles = legacyRoles == null ? Map.of() : Map.copyOf(legacyRoles);
    }

    /**
     * Returns the result for a diagram without nodes.
     *
     * @return empty result
     */
    public static TraversalResult empty() {
        return new TraversalResult(List.of(), Map.of());
    }
}
