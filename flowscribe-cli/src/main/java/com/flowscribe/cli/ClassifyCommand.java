package com.flowscribe.cli;

import com.flowscribe.core.classifier.DiagramScores;
import com.flowscribe.core.config.ConfigLoader;
import com.flowscribe.core.config.FlowScribeConfig;
import com.flowscribe.core.model.DiagramGraph;
import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.model.GraphNode;
import com.flowscribe.core.pipeline.DiagramPipeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to show how a diagram is classified.
 *
 * <p>Prints the per-type scores, the decided diagram type and, with {@code --roles},
 * the role assigned to every node. Classifier thresholds come from the same configuration
 * file {@code interpret} reads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowscribe classify login.graphml
 * flowscribe classify login.graphml --roles
 * flowscribe classify login.graphml -c tuned.yaml
 * }</pre>
 */
@Command(
    name = "classify",
    description = "Show diagram type scores and node roles for a diagram",
    mixinStandardHelpOptions = true
)
public class ClassifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ClassifyCommand.class);

    @Parameters(
        index = "0",
        description = "Diagram file"
    )
    private Path diagramFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: flowscribe.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-r", "--roles"},
        description = "Also print the role of every node"
    )
    private boolean showRoles;

    @Override
    public Integer call() {
        if (!Files.isRegularFile(diagramFile)) {
            log.error("Diagram file not found: {}", diagramFile.toAbsolutePath());
            System.err.println("✗ Diagram file not found: " + diagramFile);
            return 1;
        }

        FlowScribeConfig config = ConfigLoader.load(configPath);
        DiagramPipeline pipeline = DiagramPipeline.fromConfig(config);
        DiagramGraph graph = pipeline.getLoader().load(diagramFile);
        DiagramScores scores = pipeline.getDiagramClassifier().score(graph.nodes());
        DiagramType type = pipeline.getDiagramClassifier().decide(scores);

        System.out.println("Diagram: " + diagramFile.getFileName());
        System.out.printf("Nodes: %d, Edges: %d%n", graph.nodes().size(), graph.edges().size());
        System.out.println();
        System.out.println("Scores:");
        scores.asMap().forEach((scoredType, score) ->
            System.out.printf("  %-22s %d%n", scoredType.displayName(), score));
        System.out.println();
        System.out.println("Diagram type: " + type.displayName());

        if (showRoles) {
            Map<String, String> roles = pipeline.getRoleClassifier().classify(graph.nodes(), type, graph.edges());
            System.out.println();
            System.out.println("Roles:");
            for (GraphNode node : graph.nodes()) {
                System.out.printf("  %-12s %-30s %s%n", node.id(), "\"" + node.label() + "\"", roles.get(node.id()));
            }
        }
        return 0;
    }
}
