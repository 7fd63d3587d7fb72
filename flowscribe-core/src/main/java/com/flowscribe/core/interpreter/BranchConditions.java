package com.flowscribe.core.interpreter;

import java.util.Locale;
import java.util.Set;

/**
 * Normalizes decision edge labels to "yes", "no" or "".
 */
final class BranchConditions {

    static final String YES = "yes";
    static final String NO = "no";
    static final String UNRECOGNIZED = "";

    private static final Set<String> YES_LABELS = Set.of("yes", "true", "y");
    private static final Set<String> NO_LABELS = Set.of("no", "false", "n");

    private BranchConditions() {
        // Utility class
    }

    static String normalize(String edgeLabel) {
        String label = edgeLabel == null ? "" : edgeLabel.trim().toLowerCase(Locale.ROOT);
        if (YES_LABELS.contains(label)) {
            return YES;
        }
        if (NO_LABELS.contains(label)) {
            return NO;
        }
        return UNRECOGNIZED;
    }
}
