package com.flowscribe.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Node entry of a {@link FlowchartDocument}, annotated with its resolved role.
 *
 * @param id node ID
 * @param label trimmed label
 * @param shape trimmed shape tag
 * @param role resolved role
 */
@JsonPropertyOrder({"id", "label", "shape", "role"})
public record DocumentNode(
    @JsonProperty("id") String id,
    @JsonProperty("label") String label,
    @JsonProperty("shape") String shape,
    @JsonProperty("role") String role
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }
}
