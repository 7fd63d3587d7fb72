package com.flowscribe.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowscribe.core.model.DiagramGraph;
import com.flowscribe.core.model.GraphEdge;
import com.flowscribe.core.model.GraphNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loader for GraphML documents as written by yEd.
 *
 * <p><b>Parsing Strategy:</b>
 * <ol>
 *   <li>Parse XML using Jackson XmlMapper</li>
 *   <li>Locate the {@code <graph>} element; without one the document yields an empty graph</li>
 *   <li>For each top-level {@code <node>}: label from the first {@code y:NodeLabel}, shape from
 *       {@code y:Shape}, then {@code y:FlowchartShape}, then the {@code y:GenericNode}
 *       configuration string</li>
 *   <li>For each {@code <edge>}: source and target attributes plus the first
 *       {@code y:EdgeLabel}, lowercased</li>
 * </ol>
 *
 * <p><b>Generic node configurations</b> are mapped by substring:
 * <ul>
 *   <li>{@code terminator}, {@code start} → ellipse</li>
 *   <li>{@code decision} → diamond</li>
 *   <li>{@code data}, {@code input} → parallelogram</li>
 *   <li>{@code process} → rectangle</li>
 *   <li>anything else → last dot-separated segment, e.g.
 *       {@code com.yworks.flowchart.document} → document</li>
 * </ul>
 *
 * <p>Every node records the shape it settled on and the raw configuration string in its
 * metadata, whichever branch produced the shape.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * DiagramLoader loader = new GraphMlLoader();
 * DiagramGraph graph = loader.load(Path.of("diagrams/login.graphml"));
 * graph.nodes().forEach(n -> System.out.println(n.id() + " " + n.shape()));
 * }</pre>
 */
public class GraphMlLoader extends AbstractJacksonLoader {

    private static final String LOADER_ID = "graphml";
    private static final String LOADER_DISPLAY_NAME = "GraphML Diagram Loader";
    private static final String GRAPHML_FILE_PATTERN = "**/*.graphml";

    private static final String KEY_GRAPH = "graph";
    private static final String KEY_NODE = "node";
    private static final String KEY_EDGE = "edge";
    private static final String KEY_ID = "id";
    private static final String KEY_SOURCE = "source";
    private static final String KEY_TARGET = "target";
    private static final String KEY_TYPE = "type";
    private static final String KEY_CONFIGURATION = "configuration";

    private static final String NODE_LABEL = "NodeLabel";
    private static final String EDGE_LABEL = "EdgeLabel";
    private static final String SHAPE = "Shape";
    private static final String FLOWCHART_SHAPE = "FlowchartShape";
    private static final String GENERIC_NODE = "GenericNode";

    private static final String SHAPE_ELLIPSE = "ellipse";
    private static final String SHAPE_DIAMOND = "diamond";
    private static final String SHAPE_PARALLELOGRAM = "parallelogram";
    private static final String SHAPE_RECTANGLE = "rectangle";

    @Override
    public String getId() {
        return LOADER_ID;
    }

    @Override
    public String getDisplayName() {
        return LOADER_DISPLAY_NAME;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of(GRAPHML_FILE_PATTERN);
    }

    @Override
    protected DiagramGraph parse(JsonNode root) {
        JsonNode graph = root.isObject() ? root.get(KEY_GRAPH) : null;
        if (graph == null) {
            log.warn("No <graph> element found in GraphML.");
            return DiagramGraph.empty();
        }
        if (graph.isArray()) {
            graph = graph.get(0);
        }

        List<GraphNode> nodes = new ArrayList<>();
        for (JsonNode nodeElement : normalizeToArray(graph.get(KEY_NODE))) {
            nodes.add(parseNode(nodeElement));
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (JsonNode edgeElement : normalizeToArray(graph.get(KEY_EDGE))) {
            edges.add(parseEdge(edgeElement));
        }

        log.info("Parsed {} nodes and {} edges.", nodes.size(), edges.size());
        return new DiagramGraph(nodes, edges);
    }

    private GraphNode parseNode(JsonNode element) {
        String id = requireAttribute(element, KEY_ID, KEY_NODE);
        String label = textOf(findDescendant(element, NODE_LABEL)).trim();

        String shape = lowercase(extractAttribute(findDescendant(element, SHAPE), KEY_TYPE));
        if (shape.isEmpty()) {
            shape = lowercase(extractAttribute(findDescendant(element, FLOWCHART_SHAPE), KEY_TYPE));
        }

        JsonNode genericNode = findDescendant(element, GENERIC_NODE);
        String rawConfig = genericNode != null ? extractAttribute(genericNode, KEY_CONFIGURATION) : null;
        if (rawConfig == null) {
            rawConfig = "";
        }
        if (shape.isEmpty() && genericNode != null) {
            shape = shapeFromConfiguration(lowercase(rawConfig));
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(GraphNode.META_RAW_SHAPE, shape);
        metadata.put(GraphNode.META_RAW_CONFIG, rawConfig);

        log.debug("Node {}: label='{}', shape='{}'", id, label, shape);
        return new GraphNode(id, label, shape, metadata);
    }

    private GraphEdge parseEdge(JsonNode element) {
        String source = requireAttribute(element, KEY_SOURCE, KEY_EDGE);
        String target = requireAttribute(element, KEY_TARGET, KEY_EDGE);
        String label = lowercase(textOf(findDescendant(element, EDGE_LABEL)).trim());
        return new GraphEdge(source, target, label);
    }

    /**
     * Derives a shape from a lowercased generic-node configuration string.
     *
     * @param config configuration such as {@code com.yworks.flowchart.decision}
     * @return derived shape
     */
    static String shapeFromConfiguration(String config) {
        if (config.contains("terminator") || config.contains("start")) {
            return SHAPE_ELLIPSE;
        }
        if (config.contains("decision")) {
            return SHAPE_DIAMOND;
        }
        if (config.contains("data") || config.contains("input")) {
            return SHAPE_PARALLELOGRAM;
        }
        if (config.contains("process")) {
            return SHAPE_RECTANGLE;
        }
        return config.substring(config.lastIndexOf('.') + 1);
    }

    private static String lowercase(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
