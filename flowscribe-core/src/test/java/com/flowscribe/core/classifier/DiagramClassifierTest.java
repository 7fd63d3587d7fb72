package com.flowscribe.core.classifier;

import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.model.GraphNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DiagramClassifier}.
 */
class DiagramClassifierTest {

    private DiagramClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new DiagramClassifier();
    }

    @Test
    void classify_startInputOutputEnd_returnsFlowchart() {
        List<GraphNode> nodes = List.of(
            GraphNode.of("n1", "Start", "ellipse"),
            GraphNode.of("n2", "Input Value", "parallelogram"),
            GraphNode.of("n3", "Print Result", "parallelogram"),
            GraphNode.of("n4", "End", "ellipse")
        );

        assertThat(classifier.classify(nodes)).isEqualTo(DiagramType.FLOWCHART);
    }

    @Test
    void classify_braceDelimitedClassBody_returnsUmlClass() {
        List<GraphNode> nodes = List.of(
            GraphNode.of("c1", "UserAccount { id: int, name: str }", "roundrectangle"));

        DiagramScores scores = classifier.score(nodes);

        assertThat(scores.get(DiagramType.UML_CLASS)).isEqualTo(4);
        assertThat(scores.get(DiagramType.FLOWCHART)).isEqualTo(1);
        assertThat(classifier.decide(scores)).isEqualTo(DiagramType.UML_CLASS);
    }

    @Test
    void classify_emptyLabelsAndShapes_returnsUnknown() {
        List<GraphNode> nodes = List.of(
            GraphNode.of("a", "", ""),
            GraphNode.of("b", "", ""),
            GraphNode.of("c", "", "")
        );

        DiagramScores scores = classifier.score(nodes);

        assertThat(scores.asMap().values()).containsOnly(0);
        assertThat(classifier.classify(nodes)).isEqualTo(DiagramType.UNKNOWN);
    }

    @Test
    void classify_noNodes_returnsUnknown() {
        assertThat(classifier.classify(List.of())).isEqualTo(DiagramType.UNKNOWN);
    }

    @Test
    void classify_sequenceKeywords_returnsSequence() {
        List<GraphNode> nodes = List.of(
            GraphNode.of("s1", "Client lifeline", ""),
            GraphNode.of("s2", "Server lifeline", ""),
            GraphNode.of("s3", "login message", "")
        );

        assertThat(classifier.classify(nodes)).isEqualTo(DiagramType.UML_SEQUENCE);
    }

    @Test
    void classify_entityKeywords_returnsEr() {
        List<GraphNode> nodes = List.of(
            GraphNode.of("e1", "Customer entity", ""),
            GraphNode.of("e2", "Order entity", ""),
            GraphNode.of("e3", "primary key", "")
        );

        assertThat(classifier.classify(nodes)).isEqualTo(DiagramType.ER);
    }

    @Test
    void classify_hexagonsWithActions_returnsActivity() {
        List<GraphNode> nodes = List.of(
            GraphNode.of("a1", "Fork", "hexagon"),
            GraphNode.of("a2", "Join", "hexagon")
        );

        assertThat(classifier.classify(nodes)).isEqualTo(DiagramType.UML_ACTIVITY);
    }

    @Test
    void score_doubleColon_addsStructurePointsToUmlClass() {
        DiagramScores scores = classifier.score(List.of(GraphNode.of("m", "Account::balance", "")));

        assertThat(scores.get(DiagramType.UML_CLASS)).isEqualTo(3);
    }

    @Test
    void score_methodSignatureWithType_addsSignaturePoints() {
        DiagramScores scores = classifier.score(List.of(GraphNode.of("m", "getName(): String", "")));

        assertThat(scores.get(DiagramType.UML_CLASS)).isEqualTo(2);
    }

    @Test
    void score_guillemetInterfaceMarker_countsAsUmlKeyword() {
        DiagramScores scores = classifier.score(List.of(GraphNode.of("i", "«interface» Repository", "")));

        assertThat(scores.get(DiagramType.UML_CLASS)).isEqualTo(2);
    }

    @Test
    void score_attributeKeyword_countsForUmlClassAndEr() {
        DiagramScores scores = classifier.score(List.of(GraphNode.of("x", "attribute", "")));

        assertThat(scores.get(DiagramType.UML_CLASS)).isEqualTo(2);
        assertThat(scores.get(DiagramType.ER)).isEqualTo(2);
    }

    @Nested
    class Decision {

        @Test
        void decide_umlLeadsFlowchartClosely_prefersFlowchart() {
            DiagramScores scores = new DiagramScores();
            scores.add(DiagramType.UML_CLASS, 4);
            scores.add(DiagramType.FLOWCHART, 3);

            assertThat(classifier.decide(scores)).isEqualTo(DiagramType.FLOWCHART);
        }

        @Test
        void decide_umlLeadsByTwo_keepsUmlClass() {
            DiagramScores scores = new DiagramScores();
            scores.add(DiagramType.UML_CLASS, 5);
            scores.add(DiagramType.FLOWCHART, 3);

            assertThat(classifier.decide(scores)).isEqualTo(DiagramType.UML_CLASS);
        }

        @Test
        void decide_weakNarrowLead_fallsBackToFlowchart() {
            DiagramScores scores = new DiagramScores();
            scores.add(DiagramType.ER, 3);
            scores.add(DiagramType.UML_SEQUENCE, 2);

            assertThat(classifier.decide(scores)).isEqualTo(DiagramType.FLOWCHART);
        }

        @Test
        void decide_strongScoreWithoutMargin_keepsTopType() {
            DiagramScores scores = new DiagramScores();
            scores.add(DiagramType.ER, 4);
            scores.add(DiagramType.UML_ACTIVITY, 4);

            assertThat(classifier.decide(scores)).isEqualTo(DiagramType.ER);
        }

        @Test
        void decide_tie_resolvesInFixedTypeOrder() {
            DiagramScores scores = new DiagramScores();
            scores.add(DiagramType.UML_ACTIVITY, 6);
            scores.add(DiagramType.UML_SEQUENCE, 6);

            assertThat(scores.top()).isEqualTo(DiagramType.UML_SEQUENCE);
            assertThat(classifier.decide(scores)).isEqualTo(DiagramType.UML_SEQUENCE);
        }

        @Test
        void decide_customThresholds_changeOutcome() {
            DiagramClassifier strict = new DiagramClassifier(new ClassifierThresholds(3, 10, 2, 1));
            DiagramScores scores = new DiagramScores();
            scores.add(DiagramType.ER, 6);
            scores.add(DiagramType.UML_ACTIVITY, 4);

            assertThat(classifier.decide(scores)).isEqualTo(DiagramType.ER);
            assertThat(strict.decide(scores)).isEqualTo(DiagramType.FLOWCHART);
        }
    }

    @Test
    void thresholds_negativeValue_throwsException() {
        assertThatThrownBy(() -> new ClassifierThresholds(-1, 4, 2, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scores_alwaysContainAllFiveTypes() {
        DiagramScores scores = new DiagramScores();

        assertThat(scores.asMap()).containsOnlyKeys(
            DiagramType.UML_CLASS, DiagramType.FLOWCHART, DiagramType.UML_SEQUENCE,
            DiagramType.ER, DiagramType.UML_ACTIVITY);
        assertThat(scores.secondScore()).isZero();
    }
}
