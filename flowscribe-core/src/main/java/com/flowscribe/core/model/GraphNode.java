package com.flowscribe.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A diagram node as read from the markup.
 *
 * <p>Nodes are created once by a loader and never mutated afterwards. The metadata map records
 * where the shape came from; loaders always populate {@link #META_RAW_SHAPE} and
 * {@link #META_RAW_CONFIG}.
 *
 * @param id node identifier, unique within one diagram
 * @param label display label (may be empty)
 * @param shape normalized lowercase shape tag (may be empty)
 * @param metadata open-ended loader metadata, in insertion order
 */
public record GraphNode(
    String id,
    String label,
    String shape,
    Map<String, String> metadata
) {
    /** Metadata key holding the shape the loader settled on. */
    public static final String META_RAW_SHAPE = "raw_shape";

    /** Metadata key holding the raw generic-node configuration string. */
    public static final String META_RAW_CONFIG = "raw_config";

    /**
     * Compact constructor with validation.
     */
    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        if (label == null) {
            label = "";
        }
        if (shape == null) {
            shape = "";
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a node without metadata.
     *
     * @param id node identifier
     * @param label display label
     * @param shape shape tag
     * @return new node
     */
    public static GraphNode of(String id, String label, String shape) {
        return new GraphNode(id, label, shape, Map.of());
    }
}
