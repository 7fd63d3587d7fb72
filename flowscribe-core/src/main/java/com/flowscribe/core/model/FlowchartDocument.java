package com.flowscribe.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * The interpreted diagram handed to external renderers.
 *
 * <p>This is the only output artifact of the pipeline. It carries no timestamps or other
 * run-specific data, so interpreting the same diagram twice yields equal documents.
 *
 * @param diagramType classified diagram type
 * @param nodes all nodes with resolved roles, in input order
 * @param edges all edges, in input order
 * @param executionFlow one step per visited node, in depth-first expansion order
 */
@JsonPropertyOrder({"diagram_type", "nodes", "edges", "execution_flow"})
public record FlowchartDocument(
    @JsonProperty("diagram_type") DiagramType diagramType,
    @JsonProperty("nodes") List<DocumentNode> nodes,
    @JsonProperty("edges") List<DocumentEdge> edges,
    @JsonProperty("execution_flow") List<ExecutionFlowStep> executionFlow
) {
    /**
     * Compact constructor with validation.
     */
    public FlowchartDocument {
        Objects.requireNonNull(diagramType, "diagramType must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        executionFlow = executionFlow == null ? List.of() : List.copyOf(executionFlow);
    }
}
