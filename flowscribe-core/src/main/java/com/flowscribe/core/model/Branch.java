package com.flowscribe.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One outgoing path of a decision step.
 *
 * @param conditionLabel raw edge label (lowercased, trimmed)
 * @param condition normalized condition: "yes", "no", or "" when the label is not recognized
 * @param targetNodeId ID of the node the branch leads to
 * @param targetLabel trimmed label of the target node ("" if the target is not a known node)
 */
@JsonPropertyOrder({"condition_label", "condition", "target_node_id", "target_label"})
public record Branch(
    @JsonProperty("condition_label") String conditionLabel,
    @JsonProperty("condition") String condition,
    @JsonProperty("target_node_id") String targetNodeId,
    @JsonProperty("target_label") String targetLabel
) {
    /**
     * Compact constructor with validation.
     */
    public Branch {
        Objects.requireNonNull(targetNodeId, "targetNodeId must not be null");
        if (conditionLabel == null) {
            conditionLabel = "";
        }
        if (condition == null) {
            condition = "";
        }
        if (targetLabel == null) {
            targetLabel = "";
        }
    }
}
