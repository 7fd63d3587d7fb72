package com.flowscribe.core.classifier;

import com.flowscribe.core.classifier.rules.ActivityRoleRules;
import com.flowscribe.core.classifier.rules.ClassDiagramRoleRules;
import com.flowscribe.core.classifier.rules.ErRoleRules;
import com.flowscribe.core.classifier.rules.FlowchartRoleRules;
import com.flowscribe.core.classifier.rules.RoleRules;
import com.flowscribe.core.classifier.rules.SequenceRoleRules;
import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.model.GraphEdge;
import com.flowscribe.core.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns every node a semantic role conditioned on the diagram type.
 *
 * <p>Dispatches to one {@link RoleRules} cascade per diagram type. Nodes of an
 * {@link DiagramType#UNKNOWN} diagram all receive {@link NodeRoles#UNKNOWN}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * RoleClassifier classifier = new RoleClassifier();
 * Map<String, String> roles = classifier.classify(graph.nodes(), DiagramType.FLOWCHART);
 * roles.get("n1"); // "Start"
 * }</pre>
 */
public class RoleClassifier {

    private static final Logger log = LoggerFactory.getLogger(RoleClassifier.class);

    private static final RoleRules FLOWCHART_RULES = new FlowchartRoleRules();
    private static final RoleRules CLASS_DIAGRAM_RULES = new ClassDiagramRoleRules();
    private static final RoleRules SEQUENCE_RULES = new SequenceRoleRules();
    private static final RoleRules ER_RULES = new ErRoleRules();
    private static final RoleRules ACTIVITY_RULES = new ActivityRoleRules();
    private static final RoleRules UNKNOWN_RULES = node -> NodeRoles.UNKNOWN;

    /**
     * Classifies node roles.
     *
     * @param nodes diagram nodes
     * @param diagramType classified diagram type
     * @return role by node ID, in node order
     */
    public Map<String, String> classify(List<GraphNode> nodes, DiagramType diagramType) {
        return classify(nodes, diagramType, List.of());
    }

    /**
     * Classifies node roles with edge context.
     *
     * <p>Edges are accepted so callers can pass the whole graph; roles are currently decided
     * from each node's own label and shape only.
     *
     * @param nodes diagram nodes
     * @param diagramType classified diagram type
     * @param edges diagram edges, may be null
     * @return role by node ID, in node order
     */
    public Map<String, String> classify(List<GraphNode> nodes, DiagramType diagramType, List<GraphEdge> edges) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(diagramType, "diagramType must not be null");

        RoleRules rules = rulesFor(diagramType);
        Map<String, String> roles = new LinkedHashMap<>();
        for (GraphNode node : nodes) {
            String role = rules.roleOf(node);
            roles.put(node.id(), role);
            log.debug("Node {} ('{}', {}) -> {}", node.id(), node.label(), node.shape(), role);
        }
        log.debug("Assigned {} roles for {} diagram ({} edges supplied)",
            roles.size(), diagramType, edges == null ? 0 : edges.size());
        return roles;
    }

    /**
     * Returns the rule cascade for a diagram type.
     *
     * @param diagramType diagram type
     * @return rules for that type
     */
    static RoleRules rulesFor(DiagramType diagramType) {
        return switch (diagramType) {
            case FLOWCHART -> FLOWCHART_RULES;
            case UML_CLASS -> CLASS_DIAGRAM_RULES;
            case UML_SEQUENCE -> SEQUENCE_RULES;
            case ER -> ER_RULES;
            case UML_ACTIVITY -> ACTIVITY_RULES;
            case UNKNOWN -> UNKNOWN_RULES;
        };
    }
}
