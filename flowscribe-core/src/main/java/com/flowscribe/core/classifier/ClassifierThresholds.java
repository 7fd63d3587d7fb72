package com.flowscribe.core.classifier;

/**
 * Decision thresholds of the {@link DiagramClassifier}.
 *
 * @param decisiveMargin minimum lead of the top score over the runner-up to accept the top type
 * @param strongScore top score accepted regardless of the margin
 * @param flowchartOverrideMinScore Flowchart score that must be exceeded before a narrow
 *                                  UML-Class win is handed to Flowchart
 * @param flowchartOverrideMaxGap largest UML-Class lead over Flowchart that is still handed
 *                                to Flowchart
 */
public record ClassifierThresholds(
    int decisiveMargin,
    int strongScore,
    int flowchartOverrideMinScore,
    int flowchartOverrideMaxGap
) {
    /**
     * Compact constructor with validation.
     */
    public ClassifierThresholds {
        if (decisiveMargin < 0 || strongScore < 0 || flowchartOverrideMinScore < 0 || flowchartOverrideMaxGap < 0) {
            throw new IllegalArgumentException("classifier thresholds must not be negative");
        }
    }

    /**
     * Returns the tuned default thresholds (2, 4, 2, 1).
     *
     * @return default thresholds
     */
    public static ClassifierThresholds defaults() {
        return new ClassifierThresholds(2, 4, 2, 1);
    }
}
