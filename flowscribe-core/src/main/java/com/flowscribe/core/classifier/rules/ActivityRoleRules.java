package com.flowscribe.core.classifier.rules;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.model.GraphNode;

/**
 * UML activity diagram cascade: Fork, Join, Action, Swimlane, else Unknown.
 */
public class ActivityRoleRules implements RoleRules {

    @Override
    public String roleOf(GraphNode node) {
        String label = RoleRules.normalizedLabel(node);
        if (label.contains("fork")) {
            return NodeRoles.FORK;
        }
        if (label.contains("join")) {
            return NodeRoles.JOIN;
        }
        if (label.contains("action") || label.contains("activity")) {
            return NodeRoles.ACTION;
        }
        if (label.contains("swimlane")) {
            return NodeRoles.SWIMLANE;
        }
        return NodeRoles.UNKNOWN;
    }
}
