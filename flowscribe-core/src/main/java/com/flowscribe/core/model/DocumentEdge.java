package com.flowscribe.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Edge entry of a {@link FlowchartDocument}.
 *
 * @param sourceId source node ID
 * @param targetId target node ID
 * @param label trimmed edge label
 */
@JsonPropertyOrder({"source_id", "target_id", "label"})
public record DocumentEdge(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("target_id") String targetId,
    @JsonProperty("label") String label
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentEdge {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
    }
}
