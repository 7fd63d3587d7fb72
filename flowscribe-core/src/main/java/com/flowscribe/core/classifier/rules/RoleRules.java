package com.flowscribe.core.classifier.rules;

import com.flowscribe.core.model.GraphNode;

import java.util.List;
import java.util.Locale;

/**
 * First-match rule cascade assigning a role to a single node of one diagram type.
 *
 * <p>Implementations are stateless and look only at the node's own label and shape.
 */
public interface RoleRules {

    /**
     * Resolves the role of a node.
     *
     * @param node node to classify
     * @return role name from the type's vocabulary, never null
     */
    String roleOf(GraphNode node);

    /**
     * Returns the trimmed, lowercased label of a node.
     *
     * @param node node
     * @return normalized label
     */
    static String normalizedLabel(GraphNode node) {
        return node.label().trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the trimmed, lowercased shape of a node.
     *
     * @param node node
     * @return normalized shape
     */
    static String normalizedShape(GraphNode node) {
        return node.shape().trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Checks whether any keyword occurs in the text.
     *
     * @param text text to search
     * @param keywords substrings to look for
     * @return true on the first hit
     */
    static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
