package com.flowscribe.core.pipeline;

import com.flowscribe.core.classifier.ClassifierThresholds;
import com.flowscribe.core.classifier.DiagramClassifier;
import com.flowscribe.core.classifier.RoleClassifier;
import com.flowscribe.core.config.FlowScribeConfig;
import com.flowscribe.core.interpreter.FlowInterpreter;
import com.flowscribe.core.interpreter.LogicTemplateLoader;
import com.flowscribe.core.interpreter.LogicTemplates;
import com.flowscribe.core.loader.DiagramLoader;
import com.flowscribe.core.loader.GraphMlLoader;
import com.flowscribe.core.model.DiagramGraph;
import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.model.FlowchartDocument;
import com.flowscribe.core.model.TraversalResult;
import com.flowscribe.core.traverser.GraphTraverser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the full interpretation pipeline for one diagram.
 *
 * <p>Stages, left to right:
 * <ol>
 *   <li>{@link DiagramLoader} - markup to nodes and edges</li>
 *   <li>{@link DiagramClassifier} - diagram type from the node set</li>
 *   <li>{@link GraphTraverser} - visiting order</li>
 *   <li>{@link RoleClassifier} - role per node, given the type</li>
 *   <li>{@link FlowInterpreter} - the {@link FlowchartDocument}</li>
 * </ol>
 *
 * <p>Each run is independent: stages keep no state between diagrams, so one pipeline can
 * serve concurrent callers. Malformed input never raises; it degrades to an empty document of
 * type {@link DiagramType#UNKNOWN}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DiagramPipeline pipeline = DiagramPipeline.fromConfig(ConfigLoader.load(configPath));
 * FlowchartDocument document = pipeline.run(Path.of("diagrams/sum.graphml"));
 * }</pre>
 */
public class DiagramPipeline {

    private static final Logger log = LoggerFactory.getLogger(DiagramPipeline.class);

    private final DiagramLoader loader;
    private final DiagramClassifier diagramClassifier;
    private final GraphTraverser traverser;
    private final RoleClassifier roleClassifier;
    private final FlowInterpreter interpreter;

    /**
     * Creates a pipeline from explicit stages.
     *
     * @param loader diagram loader
     * @param diagramClassifier diagram type classifier
     * @param traverser graph traverser
     * @param roleClassifier node role classifier
     * @param interpreter flow interpreter
     */
    public DiagramPipeline(
            DiagramLoader loader,
            DiagramClassifier diagramClassifier,
            GraphTraverser traverser,
            RoleClassifier roleClassifier,
            FlowInterpreter interpreter) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.diagramClassifier = Objects.requireNonNull(diagramClassifier, "diagramClassifier must not be null");
        this.traverser = Objects.requireNonNull(traverser, "traverser must not be null");
        this.roleClassifier = Objects.requireNonNull(roleClassifier, "roleClassifier must not be null");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter must not be null");
    }

    /**
     * Creates a pipeline with default stages and the given logic templates.
     *
     * @param templates logic-template table
     * @return pipeline
     */
    public static DiagramPipeline withTemplates(LogicTemplates templates) {
        return new DiagramPipeline(
            new GraphMlLoader(),
            new DiagramClassifier(),
            new GraphTraverser(),
            new RoleClassifier(),
            new FlowInterpreter(templates)
        );
    }

    /**
     * Creates a pipeline from configuration.
     *
     * <p>Config paths are resolved against the working directory.
     *
     * @param config configuration
     * @return pipeline
     */
    public static DiagramPipeline fromConfig(FlowScribeConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        FlowScribeConfig.ClassifierSettings classifier = config.classifier();
        ClassifierThresholds thresholds = new ClassifierThresholds(
            classifier.decisiveMargin(),
            classifier.strongScore(),
            classifier.flowchartOverrideMinScore(),
            classifier.flowchartOverrideMaxGap()
        );
        return new DiagramPipeline(
            new GraphMlLoader(),
            new DiagramClassifier(thresholds),
            new GraphTraverser(config.traversal().maxRevisits()),
            new RoleClassifier(),
            new FlowInterpreter(loadTemplates(config.templates()))
        );
    }

    /**
     * Loads, classifies and interprets a diagram file.
     *
     * @param diagramFile diagram document
     * @return interpreted document
     */
    public FlowchartDocument run(Path diagramFile) {
        log.info("Interpreting diagram: {}", diagramFile);
        return interpret(loader.load(diagramFile));
    }

    /**
     * Loads, classifies and interprets a diagram from a byte stream.
     *
     * @param input diagram document bytes (not closed)
     * @return interpreted document
     */
    public FlowchartDocument run(InputStream input) {
        return interpret(loader.load(input));
    }

    /**
     * Classifies and interprets an already loaded graph.
     *
     * @param graph nodes and edges
     * @return interpreted document
     */
    public FlowchartDocument interpret(DiagramGraph graph) {
        Objects.requireNonNull(graph, "graph must not be null");
        DiagramType type = diagramClassifier.classify(graph.nodes());
        TraversalResult traversal = traverser.traverse(graph.nodes(), graph.edges());
        Map<String, String> roles = roleClassifier.classify(graph.nodes(), type, graph.edges());
        return interpreter.interpret(graph.nodes(), graph.edges(), roles, traversal.order(), type);
    }

    /**
     * Returns the loader used by this pipeline.
     *
     * @return diagram loader
     */
    public DiagramLoader getLoader() {
        return loader;
    }

    /**
     * Returns the diagram classifier used by this pipeline.
     *
     * @return diagram classifier
     */
    public DiagramClassifier getDiagramClassifier() {
        return diagramClassifier;
    }

    /**
     * Returns the role classifier used by this pipeline.
     *
     * @return role classifier
     */
    public RoleClassifier getRoleClassifier() {
        return roleClassifier;
    }

    private static LogicTemplates loadTemplates(FlowScribeConfig.TemplateSettings settings) {
        if (!settings.enabled()) {
            log.debug("Logic templates disabled by configuration");
            return LogicTemplates.empty();
        }
        if (settings.path() == null || settings.path().isBlank()) {
            return LogicTemplateLoader.loadDefaults();
        }
        return LogicTemplateLoader.load(Paths.get(settings.path()));
    }
}
