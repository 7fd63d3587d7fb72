package com.flowscribe.core.traverser;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.model.GraphEdge;
import com.flowscribe.core.model.GraphNode;
import com.flowscribe.core.model.TraversalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Computes a deterministic, cycle-bounded visiting order over a diagram.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Pick the start node: the first node labelled "start" or shaped as a terminator
 *       ({@code start1}, {@code terminator}, {@code ellipse}); otherwise the first node</li>
 *   <li>Breadth-first search over the directed adjacency built from the edges, in edge order</li>
 *   <li>Each node may be enqueued at most {@code maxRevisits} times, which bounds the work on
 *       cyclic graphs while letting re-converging paths be explored a few times</li>
 *   <li>Nodes never reached are appended in input order</li>
 * </ol>
 *
 * <p>Edges whose endpoints are not declared nodes are ignored. The resulting order therefore
 * contains every node ID exactly once.
 */
public class GraphTraverser {

    private static final Logger log = LoggerFactory.getLogger(GraphTraverser.class);

    /** Default number of times a node may be put back on the queue. */
    public static final int DEFAULT_MAX_REVISITS = 3;

    private static final Set<String> START_SHAPES = Set.of("start1", "terminator", "ellipse");

    private final int maxRevisits;

    /**
     * Creates a traverser with the default revisit cap.
     */
    public GraphTraverser() {
        this(DEFAULT_MAX_REVISITS);
    }

    /**
     * Creates a traverser with a custom revisit cap.
     *
     * @param maxRevisits how many times a node may be enqueued
     */
    public GraphTraverser(int maxRevisits) {
        if (maxRevisits < 1) {
            throw new IllegalArgumentException("maxRevisits must be at least 1, was " + maxRevisits);
        }
        this.maxRevisits = maxRevisits;
    }

    /**
     * Computes the traversal order.
     *
     * @param nodes diagram nodes
     * @param edges diagram edges
     * @return order plus legacy placeholder roles; empty when there are no nodes
     */
    public TraversalResult traverse(List<GraphNode> nodes, List<GraphEdge> edges) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");

        Optional<String> start = findStartNode(nodes);
        if (start.isEmpty()) {
            log.debug("No nodes to traverse");
            return TraversalResult.empty();
        }

        Set<String> nodeIds = new LinkedHashSet<>();
        nodes.forEach(node -> nodeIds.add(node.id()));

        log.debug("Traversing from start node {}", start.get());
        Walk walk = walk(start.get(), buildAdjacency(edges, nodeIds));
        Set<String> visited = walk.visited();

        List<String> order = new ArrayList<>(visited);
        for (String id : nodeIds) {
            if (!visited.contains(id)) {
                order.add(id);
            }
        }
        if (order.size() > visited.size()) {
            log.debug("Appended {} unreachable nodes", order.size() - visited.size());
        }

        Map<String, String> legacyRoles = new LinkedHashMap<>();
        nodeIds.forEach(id -> legacyRoles.put(id, NodeRoles.UNKNOWN));

        return new TraversalResult(order, legacyRoles);
    }

    /**
     * Finds the most likely start node.
     *
     * @param nodes diagram nodes
     * @return ID of the start node, empty if there are no nodes
     */
    public Optional<String> findStartNode(List<GraphNode> nodes) {
        for (GraphNode node : nodes) {
            String label = node.label().toLowerCase(Locale.ROOT);
            String shape = node.shape().toLowerCase(Locale.ROOT);
            if (label.contains("start") || START_SHAPES.contains(shape)) {
                return Optional.of(node.id());
            }
        }
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0).id());
    }

    /**
     * Returns the revisit cap of this traverser.
     *
     * @return maximum number of enqueues per node
     */
    public int getMaxRevisits() {
        return maxRevisits;
    }

    /**
     * Runs the bounded breadth-first search.
     *
     * @param start start node ID
     * @param adjacency successor lists by node ID
     * @return admitted nodes in visiting order and how often each node was enqueued
     */
    Walk walk(String start, Map<String, List<String>> adjacency) {
        Set<String> visited = new LinkedHashSet<>();
        Map<String, Integer> enqueueCounts = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            visited.add(current);

            for (String neighbor : adjacency.getOrDefault(current, List.of())) {
                int count = enqueueCounts.getOrDefault(neighbor, 0);
                if (count < maxRevisits) {
                    queue.add(neighbor);
                    enqueueCounts.put(neighbor, count + 1);
                } else {
                    log.trace("Revisit cap reached for {}", neighbor);
                }
            }
        }
        return new Walk(visited, enqueueCounts);
    }

    Map<String, List<String>> buildAdjacency(List<GraphEdge> edges, Set<String> nodeIds) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (GraphEdge edge : edges) {
            if (!nodeIds.contains(edge.sourceId()) || !nodeIds.contains(edge.targetId())) {
                log.debug("Ignoring edge {} -> {} with an undeclared endpoint", edge.sourceId(), edge.targetId());
                continue;
            }
            adjacency.computeIfAbsent(edge.sourceId(), id -> new ArrayList<>()).add(edge.targetId());
        }
        return adjacency;
    }

    /**
     * Outcome of one bounded breadth-first search.
     *
     * @param visited admitted node IDs in visiting order
     * @param enqueueCounts number of times each node was put on the queue
     */
    record Walk(Set<String> visited, Map<String, Integer> enqueueCounts) {
    }
}
