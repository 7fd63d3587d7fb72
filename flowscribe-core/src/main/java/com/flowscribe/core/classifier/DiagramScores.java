package com.flowscribe.core.classifier;

import com.flowscribe.core.model.DiagramType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-type evidence accumulated by the {@link DiagramClassifier}.
 *
 * <p>Holds one non-negative score for each concrete diagram type; all start at zero.
 * {@link DiagramType#UNKNOWN} has no bucket.
 */
public final class DiagramScores {

    /** Scored types in tie-break order: on equal scores the earlier type ranks first. */
    static final List<DiagramType> SCORED_TYPES = List.of(
        DiagramType.UML_CLASS,
        DiagramType.FLOWCHART,
        DiagramType.UML_SEQUENCE,
        DiagramType.ER,
        DiagramType.UML_ACTIVITY
    );

    private final EnumMap<DiagramType, Integer> scores = new EnumMap<>(DiagramType.class);

    DiagramScores() {
        SCORED_TYPES.forEach(type -> scores.put(type, 0));
    }

    void add(DiagramType type, int points) {
        scores.merge(type, points, Integer::sum);
    }

    /**
     * Returns the score of a type.
     *
     * @param type diagram type
     * @return score, 0 for {@link DiagramType#UNKNOWN}
     */
    public int get(DiagramType type) {
        return scores.getOrDefault(type, 0);
    }

    /**
     * Returns the type with the highest score, ties broken by {@link #SCORED_TYPES} order.
     *
     * @return leading type
     */
    public DiagramType top() {
        DiagramType best = SCORED_TYPES.get(0);
        for (DiagramType type : SCORED_TYPES) {
            if (get(type) > get(best)) {
                best = type;
            }
        }
        return best;
    }

    /**
     * Returns the second-highest score value (may equal the top score).
     *
     * @return runner-up score
     */
    public int secondScore() {
        int first = Integer.MIN_VALUE;
        int second = Integer.MIN_VALUE;
        for (DiagramType type : SCORED_TYPES) {
            int score = get(type);
            if (score > first) {
                second = first;
                first = score;
            } else if (score > second) {
                second = score;
            }
        }
        return second;
    }

    /**
     * Returns all scores as an unmodifiable map in enum order.
     *
     * @return scores by type
     */
    public Map<DiagramType, Integer> asMap() {
        return Collections.unmodifiableMap(new EnumMap<>(scores));
    }

    @Override
    public String toString() {
        return scores.toString();
    }
}
