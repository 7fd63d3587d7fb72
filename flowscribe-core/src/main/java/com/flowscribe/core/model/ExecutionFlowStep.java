package com.flowscribe.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Structured description of one node's control-flow behavior.
 *
 * <p>{@code nextId} is only set for nodes with exactly one outgoing edge that are neither
 * decisions nor end nodes. {@code branches} is only set for decision nodes and then holds one
 * entry per outgoing edge, in edge order.
 *
 * @param nodeId node ID
 * @param label trimmed node label
 * @param shape trimmed shape tag
 * @param role resolved node role
 * @param flowType control-flow category derived from the role
 * @param logicTemplate matched logic template, or null
 * @param nextId single successor, or null
 * @param branches decision branches, or null for non-decision steps
 */
@JsonPropertyOrder({"node_id", "label", "shape", "role", "flow_type", "logic_template", "next_id", "branches"})
public record ExecutionFlowStep(
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("label") String label,
    @JsonProperty("shape") String shape,
    @JsonProperty("role") String role,
    @JsonProperty("flow_type") FlowType flowType,
    @JsonProperty("logic_template") String logicTemplate,
    @JsonProperty("next_id") @JsonInclude(JsonInclude.Include.NON_NULL) String nextId,
    @JsonProperty("branches") @JsonInclude(JsonInclude.Include.NON_NULL) List<Branch> branches
) {
    /**
     * Compact constructor with validation.
     */
    public ExecutionFlowStep {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(flowType, "flowType must not be null");
        if (label == null) {
            label = "";
        }
        if (shape == null) {
            shape = "";
        }
        if (branches != null) {
            branches = List.copyOf(branches);
        }
    }

    /**
     * Checks whether this step is a decision carrying branches.
     *
     * @return true for decision steps
     */
    @JsonIgnore
    public boolean isDecision() {
        return branches != null;
    }
}
