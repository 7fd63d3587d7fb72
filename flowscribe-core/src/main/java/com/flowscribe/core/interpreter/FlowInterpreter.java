package com.flowscribe.core.interpreter;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.model.Branch;
import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.model.DocumentEdge;
import com.flowscribe.core.model.DocumentNode;
import com.flowscribe.core.model.ExecutionFlowStep;
import com.flowscribe.core.model.FlowType;
import com.flowscribe.core.model.FlowchartDocument;
import com.flowscribe.core.model.GraphEdge;
import com.flowscribe.core.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the {@link FlowchartDocument} for a classified, ordered diagram.
 *
 * <p><b>Traversal:</b> the supplied traversal order seeds a depth-first expansion. Each seed
 * not yet visited is expanded by following outgoing edges in edge order, so the steps come out
 * in depth-first pre-order, which may differ from the seed order. A visited set guarantees at
 * most one step per node.
 *
 * <p><b>Per step:</b>
 * <ul>
 *   <li>{@code flow_type} from the role (see {@link FlowType#forRole(String)})</li>
 *   <li>{@code logic_template} from the injected {@link LogicTemplates}</li>
 *   <li>{@code branches} for decision nodes, one per outgoing edge, with normalized
 *       yes/no conditions</li>
 *   <li>{@code next_id} when the node has exactly one outgoing edge and is not a decision or
 *       end node</li>
 * </ul>
 *
 * <p>Instances hold only the immutable template table and can be shared between threads.
 */
public class FlowInterpreter {

    private static final Logger log = LoggerFactory.getLogger(FlowInterpreter.class);

    private final LogicTemplates templates;

    /**
     * Creates an interpreter without logic templates.
     */
    public FlowInterpreter() {
        this(LogicTemplates.empty());
    }

    /**
     * Creates an interpreter with a logic-template table.
     *
     * @param templates template table used to tag steps
     */
    public FlowInterpreter(LogicTemplates templates) {
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
    }

    /**
     * Interprets a diagram into its execution flow.
     *
     * @param nodes diagram nodes
     * @param edges diagram edges
     * @param roles role by node ID; missing entries count as "Unknown"
     * @param traversalOrder node IDs seeding the expansion
     * @param diagramType classified diagram type
     * @return the structured document
     */
    public FlowchartDocument interpret(
            List<GraphNode> nodes,
            List<GraphEdge> edges,
            Map<String, String> roles,
            List<String> traversalOrder,
            DiagramType diagramType) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        Objects.requireNonNull(roles, "roles must not be null");
        Objects.requireNonNull(traversalOrder, "traversalOrder must not be null");
        Objects.requireNonNull(diagramType, "diagramType must not be null");

        Map<String, GraphNode> nodesById = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            nodesById.putIfAbsent(node.id(), node);
        }
        Map<String, List<Successor>> successors = buildSuccessors(edges);

        List<ExecutionFlowStep> steps = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String seed : traversalOrder) {
            expand(seed, nodesById, successors, roles, visited, steps);
        }

        FlowchartDocument document = new FlowchartDocument(
            diagramType,
            documentNodes(nodes, roles),
            documentEdges(edges),
            steps
        );
        log.info("Interpreted {} diagram into {} execution steps", diagramType, steps.size());
        return document;
    }

    /**
     * Depth-first pre-order expansion from one seed, iterative so long chains cannot exhaust
     * the call stack.
     */
    private void expand(
            String seed,
            Map<String, GraphNode> nodesById,
            Map<String, List<Successor>> successors,
            Map<String, String> roles,
            Set<String> visited,
            List<ExecutionFlowStep> steps) {
        Deque<Iterator<Successor>> stack = new ArrayDeque<>();
        visit(seed, nodesById, successors, roles, visited, steps, stack);

        while (!stack.isEmpty()) {
            Iterator<Successor> pending = stack.peek();
            if (!pending.hasNext()) {
                stack.pop();
                continue;
            }
            visit(pending.next().targetId(), nodesById, successors, roles, visited, steps, stack);
        }
    }

    private void visit(
            String nodeId,
            Map<String, GraphNode> nodesById,
            Map<String, List<Successor>> successors,
            Map<String, String> roles,
            Set<String> visited,
            List<ExecutionFlowStep> steps,
            Deque<Iterator<Successor>> stack) {
        if (!visited.add(nodeId)) {
            return;
        }
        GraphNode node = nodesById.get(nodeId);
        if (node == null) {
            log.debug("Skipping undeclared node {}", nodeId);
            return;
        }
        List<Successor> next = successors.getOrDefault(nodeId, List.of());
        steps.add(buildStep(node, next, roles, nodesById));
        stack.push(next.iterator());
    }

    private ExecutionFlowStep buildStep(
            GraphNode node,
            List<Successor> next,
            Map<String, String> roles,
            Map<String, GraphNode> nodesById) {
        String label = node.label().trim();
        String shape = node.shape().trim();
        String role = roles.getOrDefault(node.id(), NodeRoles.UNKNOWN);
        FlowType flowType = FlowType.forRole(role);
        String logic = templates.match(label, role);

        List<Branch> branches = null;
        if (flowType == FlowType.DECISION) {
            branches = new ArrayList<>(next.size());
            for (Successor successor : next) {
                GraphNode target = nodesById.get(successor.targetId());
                branches.add(new Branch(
                    successor.label(),
                    BranchConditions.normalize(successor.label()),
                    successor.targetId(),
                    target == null ? "" : target.label().trim()
                ));
            }
        }

        String nextId = null;
        if (next.size() == 1 && flowType != FlowType.DECISION && flowType != FlowType.END) {
            nextId = next.get(0).targetId();
        }

        return new ExecutionFlowStep(node.id(), label, shape, role, flowType, logic, nextId, branches);
    }

    private Map<String, List<Successor>> buildSuccessors(List<GraphEdge> edges) {
        Map<String, List<Successor>> successors = new HashMap<>();
        for (GraphEdge edge : edges) {
            successors.computeIfAbsent(edge.sourceId(), id -> new ArrayList<>())
                .add(new Successor(edge.targetId(), edge.label().trim().toLowerCase(Locale.ROOT)));
        }
        return successors;
    }

    private List<DocumentNode> documentNodes(List<GraphNode> nodes, Map<String, String> roles) {
        List<DocumentNode> result = new ArrayList<>(nodes.size());
        for (GraphNode node : nodes) {
            result.add(new DocumentNode(
                node.id(),
                node.label().trim(),
                node.shape().trim(),
                roles.getOrDefault(node.id(), NodeRoles.UNKNOWN)
            ));
        }
        return result;
    }

    private List<DocumentEdge> documentEdges(List<GraphEdge> edges) {
        List<DocumentEdge> result = new ArrayList<>(edges.size());
        for (GraphEdge edge : edges) {
            result.add(new DocumentEdge(edge.sourceId(), edge.targetId(), edge.label().trim()));
        }
        return result;
    }

    /**
     * Outgoing edge as seen from its source node.
     *
     * @param targetId target node ID
     * @param label lowercased, trimmed edge label
     */
    private record Successor(String targetId, String label) {
    }
}
