package com.flowscribe.core.loader;

import com.flowscribe.core.model.DiagramGraph;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Set;

/**
 * Interface for loaders that turn a diagram-markup document into a plain node/edge graph.
 *
 * <p>Loaders never throw for malformed input. A document that cannot be read or parsed, or that
 * has no graph root, yields {@link DiagramGraph#empty()} and the problem is logged.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class GraphMlLoader extends AbstractJacksonLoader {
 *     @Override
 *     public String getId() {
 *         return "graphml";
 *     }
 *
 *     @Override
 *     protected DiagramGraph parse(JsonNode root) {
 *         // walk <graph>, collect nodes and edges
 *     }
 * }
 * }</pre>
 *
 * @see DiagramGraph
 */
public interface DiagramLoader {

    /**
     * Returns unique identifier for this loader (e.g., "graphml").
     *
     * @return loader identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this loader.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns glob patterns for files this loader reads.
     *
     * @return glob patterns such as {@code **}{@code /*.graphml}
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Loads a diagram from a file.
     *
     * @param file path to the diagram document
     * @return parsed graph, or an empty graph if the file cannot be loaded
     */
    DiagramGraph load(Path file);

    /**
     * Loads a diagram from a byte stream. The stream is not closed.
     *
     * @param input diagram document bytes
     * @return parsed graph, or an empty graph if the input cannot be loaded
     */
    DiagramGraph load(InputStream input);
}
