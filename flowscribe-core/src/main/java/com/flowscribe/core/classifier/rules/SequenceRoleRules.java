package com.flowscribe.core.classifier.rules;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.model.GraphNode;

/**
 * UML sequence diagram cascade: Lifeline, Message, else Actor.
 */
public class SequenceRoleRules implements RoleRules {

    @Override
    public String roleOf(GraphNode node) {
        String label = RoleRules.normalizedLabel(node);
        if (label.contains("lifeline")) {
            return NodeRoles.LIFELINE;
        }
        if (label.contains("message") || label.contains("-->")) {
            return NodeRoles.MESSAGE;
        }
        return NodeRoles.ACTOR;
    }
}
