package com.flowscribe.core.classifier.rules;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.model.GraphNode;

/**
 * ER diagram cascade: Entity, Attribute, Relationship, else Unknown.
 */
public class ErRoleRules implements RoleRules {

    @Override
    public String roleOf(GraphNode node) {
        String label = RoleRules.normalizedLabel(node);
        if (label.contains("entity")) {
            return NodeRoles.ENTITY;
        }
        if (label.contains("attribute")) {
            return NodeRoles.ATTRIBUTE;
        }
        // "relation" also covers "relationship"
        if (label.contains("relation")) {
            return NodeRoles.RELATIONSHIP;
        }
        return NodeRoles.UNKNOWN;
    }
}
