package com.flowscribe.core.interpreter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Keyword-to-logic lookup table, grouped by node role.
 *
 * <p>Matching for a (label, role) pair runs two passes over the role's entries in order:
 * <ol>
 *   <li>exact: the lowercased label equals a keyword</li>
 *   <li>substring: a keyword occurs in the lowercased label</li>
 * </ol>
 * The first hit wins. Keywords are compared case-insensitively.
 */
public final class LogicTemplates {

    private static final LogicTemplates EMPTY = new LogicTemplates(Map.of());

    private final Map<String, List<LogicTemplate>> templatesByRole;

    /**
     * Creates a table.
     *
     * @param templatesByRole entries by role name; entry order is match order, null entries are skipped
     */
    public LogicTemplates(Map<String, List<LogicTemplate>> templatesByRole) {
        Objects.requireNonNull(templatesByRole, "templatesByRole must not be null");
        Map<String, List<LogicTemplate>> copy = new LinkedHashMap<>();
        templatesByRole.forEach((role, entries) -> copy.put(role, entries == null
            ? List.of()
            : entries.stream().filter(Objects::nonNull).toList()));
        this.templatesByRole = Map.copyOf(copy);
    }

    /**
     * Returns a table without entries; nothing ever matches.
     *
     * @return empty table
     */
    public static LogicTemplates empty() {
        return EMPTY;
    }

    /**
     * Finds the logic hint for a node.
     *
     * @param label node label
     * @param role node role
     * @return matched logic, or null if no entry matches
     */
    public String match(String label, String role) {
        List<LogicTemplate> entries = templatesByRole.getOrDefault(role, List.of());
        if (entries.isEmpty()) {
            return null;
        }
        String labelLower = label == null ? "" : label.toLowerCase(Locale.ROOT);

        for (LogicTemplate entry : entries) {
            for (String keyword : entry.keywords()) {
                if (labelLower.equals(keyword.toLowerCase(Locale.ROOT))) {
                    return entry.logic();
                }
            }
        }

        for (LogicTemplate entry : entries) {
            for (String keyword : entry.keywords()) {
                if (labelLower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return entry.logic();
                }
            }
        }
        return null;
    }

    /**
     * Checks whether the table has no roles.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return templatesByRole.isEmpty();
    }

    /**
     * Returns the number of roles with entries.
     *
     * @return role count
     */
    public int roleCount() {
        return templatesByRole.size();
    }
}
