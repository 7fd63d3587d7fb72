package com.flowscribe.core.classifier.rules;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.model.GraphNode;

import java.util.List;
import java.util.regex.Pattern;

import static com.flowscribe.core.classifier.rules.RoleRules.containsAny;

/**
 * UML class diagram cascade: Interface, Class, Method, Attribute, else "Unknown UML Part".
 */
public class ClassDiagramRoleRules implements RoleRules {

    private static final Pattern METHOD_SIGNATURE = Pattern.compile("^\\w+\\(.*\\)$");

    private static final List<String> INTERFACE_MARKERS = List.of(
        "<<interface>>", "<<abstract>>", "«interface»", "«abstract»", "interface", "abstract");
    private static final List<String> PRIMITIVE_TYPES = List.of(
        "int", "str", "float", "bool", "string", "boolean", "void");

    @Override
    public String roleOf(GraphNode node) {
        String label = RoleRules.normalizedLabel(node);
        String shape = RoleRules.normalizedShape(node);

        if (containsAny(label, INTERFACE_MARKERS)) {
            return NodeRoles.INTERFACE;
        }
        if (label.contains("class") || (label.contains("{") && label.contains("}"))) {
            return NodeRoles.CLASS;
        }
        if (METHOD_SIGNATURE.matcher(label).matches()) {
            return NodeRoles.METHOD;
        }
        if (label.contains(":") || label.contains("=") || containsAny(label, PRIMITIVE_TYPES)) {
            return NodeRoles.ATTRIBUTE;
        }
        if ("rectangle".equals(shape) && isIdentifier(label)) {
            return NodeRoles.ATTRIBUTE;
        }
        return NodeRoles.UNKNOWN_UML_PART;
    }

    /**
     * Checks for a bare identifier: a letter or underscore followed by letters, digits or
     * underscores.
     *
     * @param text candidate text
     * @return true if the text is a non-empty identifier
     */
    static boolean isIdentifier(String text) {
        if (text.isEmpty()) {
            return false;
        }
        char first = text.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }
}
