package com.flowscribe.core.pipeline;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.config.FlowScribeConfig;
import com.flowscribe.core.interpreter.LogicTemplateLoader;
import com.flowscribe.core.interpreter.LogicTemplates;
import com.flowscribe.core.model.DiagramGraph;
import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.model.DocumentNode;
import com.flowscribe.core.model.ExecutionFlowStep;
import com.flowscribe.core.model.FlowchartDocument;
import com.flowscribe.core.model.GraphNode;
import com.flowscribe.core.output.FlowchartDocumentWriter;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * End-to-end tests for {@link DiagramPipeline}.
 */
class DiagramPipelineTest {

    private final DiagramPipeline pipeline = DiagramPipeline.withTemplates(LogicTemplates.empty());

    @Test
    void run_linearFlowchart_producesChainedSteps() throws URISyntaxException {
        FlowchartDocument document = pipeline.run(fixture("linear-flowchart.graphml"));

        assertThat(document.diagramType()).isEqualTo(DiagramType.FLOWCHART);
        assertThat(document.nodes())
            .extracting(DocumentNode::id, DocumentNode::role)
            .containsExactly(
                tuple("n1", NodeRoles.START),
                tuple("n2", NodeRoles.INPUT),
                tuple("n3", NodeRoles.OUTPUT),
                tuple("n4", NodeRoles.END)
            );
        assertThat(document.executionFlow())
            .extracting(ExecutionFlowStep::nodeId, ExecutionFlowStep::nextId)
            .containsExactly(
                tuple("n1", "n2"),
                tuple("n2", "n3"),
                tuple("n3", "n4"),
                tuple("n4", null)
            );
    }

    @Test
    void run_decisionFlowchart_branchesOnNormalizedConditions() throws URISyntaxException {
        FlowchartDocument document = pipeline.run(fixture("decision-flowchart.graphml"));

        assertThat(document.diagramType()).isEqualTo(DiagramType.FLOWCHART);
        assertThat(document.executionFlow())
            .extracting(ExecutionFlowStep::nodeId)
            .containsExactly("n1", "n2", "n3", "n4", "n6", "n5");

        ExecutionFlowStep decision = document.executionFlow().get(2);
        assertThat(decision.role()).isEqualTo(NodeRoles.DECISION);
        assertThat(decision.branches()).hasSize(2);
        assertThat(decision.branches().get(0).condition()).isEqualTo("yes");
        assertThat(decision.branches().get(1).condition()).isEqualTo("no");
    }

    @Test
    void run_umlClassBody_resolvesClassRole() throws URISyntaxException {
        FlowchartDocument document = pipeline.run(fixture("uml-class.graphml"));

        assertThat(document.diagramType()).isEqualTo(DiagramType.UML_CLASS);
        assertThat(document.nodes().get(0).role()).isEqualTo(NodeRoles.CLASS);
        assertThat(document.executionFlow().get(0).flowType().tag()).isEqualTo("uml_element");
    }

    @Test
    void run_documentWithoutGraph_returnsEmptyUnknownDocument() throws URISyntaxException {
        FlowchartDocument document = pipeline.run(fixture("no-graph.graphml"));

        assertThat(document.diagramType()).isEqualTo(DiagramType.UNKNOWN);
        assertThat(document.nodes()).isEmpty();
        assertThat(document.edges()).isEmpty();
        assertThat(document.executionFlow()).isEmpty();
    }

    @Test
    void run_inputStream_matchesPathResult() throws Exception {
        Path file = fixture("decision-flowchart.graphml");

        FlowchartDocument fromStream;
        try (InputStream input = DiagramPipelineTest.class.getResourceAsStream("/diagrams/decision-flowchart.graphml")) {
            fromStream = pipeline.run(input);
        }

        assertThat(fromStream).isEqualTo(pipeline.run(file));
    }

    @Test
    void run_sameDiagramTwice_producesByteIdenticalJson() throws URISyntaxException {
        FlowchartDocumentWriter writer = new FlowchartDocumentWriter();
        DiagramPipeline withDefaults = DiagramPipeline.withTemplates(LogicTemplateLoader.loadDefaults());

        String first = writer.toJson(withDefaults.run(fixture("decision-flowchart.graphml")));
        String second = writer.toJson(withDefaults.run(fixture("decision-flowchart.graphml")));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void interpret_allEmptyLabelsAndShapes_isUnknownWithUnknownRoles() {
        DiagramGraph graph = new DiagramGraph(
            List.of(GraphNode.of("a", "", ""), GraphNode.of("b", "", "")), List.of());

        FlowchartDocument document = pipeline.interpret(graph);

        assertThat(document.diagramType()).isEqualTo(DiagramType.UNKNOWN);
        assertThat(document.nodes()).extracting(DocumentNode::role).containsOnly(NodeRoles.UNKNOWN);
        assertThat(document.executionFlow()).extracting(ExecutionFlowStep::nodeId).containsExactly("a", "b");
    }

    @Test
    void fromConfig_defaults_useBundledTemplates() throws URISyntaxException {
        DiagramPipeline configured = DiagramPipeline.fromConfig(FlowScribeConfig.defaults());

        FlowchartDocument document = configured.run(fixture("linear-flowchart.graphml"));

        assertThat(document.executionFlow())
            .extracting(ExecutionFlowStep::logicTemplate)
            .containsExactly("def main():", "value = input()", "print(result)", "return");
    }

    @Test
    void fromConfig_templatesDisabled_leavesLogicEmpty() throws URISyntaxException {
        FlowScribeConfig config = new FlowScribeConfig(
            null, null, new FlowScribeConfig.TemplateSettings(false, null), null);

        FlowchartDocument document = DiagramPipeline.fromConfig(config).run(fixture("linear-flowchart.graphml"));

        assertThat(document.executionFlow()).extracting(ExecutionFlowStep::logicTemplate).containsOnlyNulls();
    }

    @Test
    void fromConfig_templatePath_loadsExternalTable() throws URISyntaxException {
        Path templates = Paths.get(DiagramPipelineTest.class.getResource("/templates/even-odd.json").toURI());
        FlowScribeConfig config = new FlowScribeConfig(
            null, null, new FlowScribeConfig.TemplateSettings(true, templates.toString()), null);

        FlowchartDocument document = DiagramPipeline.fromConfig(config).run(fixture("decision-flowchart.graphml"));

        assertThat(document.executionFlow())
            .filteredOn(step -> step.nodeId().equals("n3"))
            .extracting(ExecutionFlowStep::logicTemplate)
            .containsExactly("if is_even(n):");
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Paths.get(DiagramPipelineTest.class.getResource("/diagrams/" + name).toURI());
    }
}
