package com.flowscribe.core.classifier;

import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.model.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Decides what kind of diagram a node set describes.
 *
 * <h2>Scoring</h2>
 * Every node contributes independently to five scores:
 * <ul>
 *   <li><b>Shape:</b> flowchart shapes +2 Flowchart; rectangles +1 Flowchart and +1 UML-Class;
 *       hexagon +2 Activity</li>
 *   <li><b>Keywords:</b> +2 to each type whose keyword set hits the label (sets overlap, e.g.
 *       "attribute" counts for UML-Class and ER)</li>
 *   <li><b>Structure:</b> {@code ::} or a brace-delimited label +3 UML-Class; a method-like
 *       label with {@code (}, {@code )} and {@code :} +2 UML-Class</li>
 * </ul>
 *
 * <h2>Decision</h2>
 * <ol>
 *   <li>All scores zero → {@link DiagramType#UNKNOWN}</li>
 *   <li>UML-Class leads but Flowchart is above the override minimum and within the override gap
 *       → {@link DiagramType#FLOWCHART} (generic tokens such as "int" inflate UML-Class)</li>
 *   <li>Top type leads by the decisive margin, or reaches the strong score → top type</li>
 *   <li>Otherwise → {@link DiagramType#FLOWCHART}</li>
 * </ol>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public class DiagramClassifier {

    private static final Logger log = LoggerFactory.getLogger(DiagramClassifier.class);

    private static final Set<String> FLOWCHART_SHAPES = Set.of("diamond", "parallelogram", "ellipse", "document", "offpageconnector");
    private static final Set<String> AMBIGUOUS_BOX_SHAPES = Set.of("rectangle", "roundrectangle");
    private static final String ACTIVITY_SHAPE = "hexagon";

    private static final List<String> FLOWCHART_KEYWORDS = List.of("start", "stop", "input", "output", "decision", "process", "end");
    private static final List<String> UML_CLASS_KEYWORDS = List.of("class", "attribute", "method", "<<interface>>", "<<abstract>>", "«interface»", "«abstract»");
    private static final List<String> SEQUENCE_KEYWORDS = List.of("activate", "deactivate", "message", "return", "lifeline");
    private static final List<String> ER_KEYWORDS = List.of("entity", "relation", "attribute", "primary key", "foreign key");
    private static final List<String> ACTIVITY_KEYWORDS = List.of("activity", "fork", "join", "action", "swimlane");

    private static final int STRONG_SHAPE_POINTS = 2;
    private static final int AMBIGUOUS_SHAPE_POINTS = 1;
    private static final int KEYWORD_POINTS = 2;
    private static final int STRUCTURE_POINTS = 3;
    private static final int SIGNATURE_POINTS = 2;

    private final ClassifierThresholds thresholds;

    /**
     * Creates a classifier with default thresholds.
     */
    public DiagramClassifier() {
        this(ClassifierThresholds.defaults());
    }

    /**
     * Creates a classifier with custom thresholds.
     *
     * @param thresholds decision thresholds
     */
    public DiagramClassifier(ClassifierThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
    }

    /**
     * Classifies a node set.
     *
     * @param nodes diagram nodes
     * @return detected diagram type, {@link DiagramType#UNKNOWN} when nothing scored
     */
    public DiagramType classify(List<GraphNode> nodes) {
        DiagramScores scores = score(nodes);
        DiagramType type = decide(scores);
        log.info("Classified diagram as {} (scores: {})", type, scores);
        return type;
    }

    /**
     * Accumulates the per-type scores for a node set.
     *
     * @param nodes diagram nodes
     * @return scores for the five concrete types
     */
    public DiagramScores score(List<GraphNode> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        DiagramScores scores = new DiagramScores();
        for (GraphNode node : nodes) {
            String label = node.label().toLowerCase(Locale.ROOT);
            String shape = node.shape().toLowerCase(Locale.ROOT);
            scoreShape(shape, scores);
            scoreKeywords(label, scores);
            scoreStructure(label, scores);
        }
        return scores;
    }

    /**
     * Applies the decision rules to accumulated scores.
     *
     * @param scores accumulated scores
     * @return chosen diagram type
     */
    public DiagramType decide(DiagramScores scores) {
        DiagramType top = scores.top();
        int topScore = scores.get(top);
        int secondScore = scores.secondScore();

        if (topScore == 0) {
            return DiagramType.UNKNOWN;
        }

        int flowchartScore = scores.get(DiagramType.FLOWCHART);
        if (top == DiagramType.UML_CLASS
                && flowchartScore > thresholds.flowchartOverrideMinScore()
                && topScore - flowchartScore <= thresholds.flowchartOverrideMaxGap()) {
            log.debug("UML-Class lead over Flowchart too narrow ({} vs {}), choosing Flowchart", topScore, flowchartScore);
            return DiagramType.FLOWCHART;
        }

        if (topScore - secondScore >= thresholds.decisiveMargin() || topScore >= thresholds.strongScore()) {
            return top;
        }
        return DiagramType.FLOWCHART;
    }

    private void scoreShape(String shape, DiagramScores scores) {
        if (FLOWCHART_SHAPES.contains(shape)) {
            scores.add(DiagramType.FLOWCHART, STRONG_SHAPE_POINTS);
        } else if (AMBIGUOUS_BOX_SHAPES.contains(shape)) {
            scores.add(DiagramType.FLOWCHART, AMBIGUOUS_SHAPE_POINTS);
            scores.add(DiagramType.UML_CLASS, AMBIGUOUS_SHAPE_POINTS);
        } else if (ACTIVITY_SHAPE.equals(shape)) {
            scores.add(DiagramType.UML_ACTIVITY, STRONG_SHAPE_POINTS);
        }
    }

    private void scoreKeywords(String label, DiagramScores scores) {
        if (containsAny(label, FLOWCHART_KEYWORDS)) {
            scores.add(DiagramType.FLOWCHART, KEYWORD_POINTS);
        }
        if (containsAny(label, UML_CLASS_KEYWORDS)) {
            scores.add(DiagramType.UML_CLASS, KEYWORD_POINTS);
        }
        if (containsAny(label, SEQUENCE_KEYWORDS)) {
            scores.add(DiagramType.UML_SEQUENCE, KEYWORD_POINTS);
        }
        if (containsAny(label, ER_KEYWORDS)) {
            scores.add(DiagramType.ER, KEYWORD_POINTS);
        }
        if (containsAny(label, ACTIVITY_KEYWORDS)) {
            scores.add(DiagramType.UML_ACTIVITY, KEYWORD_POINTS);
        }
    }

    private void scoreStructure(String label, DiagramScores scores) {
        if (label.contains("::") || isBraceDelimited(label)) {
            scores.add(DiagramType.UML_CLASS, STRUCTURE_POINTS);
        }
        if (label.contains("(") && label.contains(")") && label.contains(":")) {
            scores.add(DiagramType.UML_CLASS, SIGNATURE_POINTS);
        }
    }

    /**
     * Checks for a class-body style label such as {@code "User { id: int }"}.
     *
     * @param label lowercased label
     * @return true if the label contains both braces
     */
    static boolean isBraceDelimited(String label) {
        return label.contains("{") && label.contains("}");
    }

    static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
