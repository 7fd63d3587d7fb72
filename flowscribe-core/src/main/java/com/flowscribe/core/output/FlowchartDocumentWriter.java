package com.flowscribe.core.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowscribe.core.model.FlowchartDocument;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes {@link FlowchartDocument}s for external renderers.
 *
 * <p>Output uses snake_case keys ({@code diagram_type}, {@code execution_flow},
 * {@code next_id}, ...) and is byte-for-byte stable for equal documents.
 */
public class FlowchartDocumentWriter {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final boolean prettyPrint;

    /**
     * Creates a writer producing indented JSON.
     */
    public FlowchartDocumentWriter() {
        this(true);
    }

    /**
     * Creates a writer.
     *
     * @param prettyPrint whether to indent the JSON
     */
    public FlowchartDocumentWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.objectMapper = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    /**
     * Serializes a document to JSON.
     *
     * @param document document to serialize
     * @return JSON text
     * @throws UncheckedIOException if serialization fails
     */
    public String toJson(FlowchartDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize flowchart document", e);
        }
    }

    /**
     * Converts a document into plain nested maps and lists.
     *
     * @param document document to convert
     * @return map with keys {@code diagram_type}, {@code nodes}, {@code edges},
     *         {@code execution_flow}
     */
    public Map<String, Object> toMap(FlowchartDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        return objectMapper.convertValue(document, MAP_TYPE);
    }

    /**
     * Writes a document as JSON to a file, creating parent directories.
     *
     * @param document document to write
     * @param target target file
     * @throws UncheckedIOException if the file cannot be written
     */
    public void write(FlowchartDocument document, Path target) {
        String json = toJson(document);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write flowchart document: " + target, e);
        }
    }

    /**
     * Returns whether this writer indents its output.
     *
     * @return true for indented JSON
     */
    public boolean isPrettyPrint() {
        return prettyPrint;
    }
}
