package com.flowscribe.core.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.flowscribe.core.model.DiagramGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Abstract base class for loaders that read XML diagram markup using Jackson.
 *
 * <p>This class provides:
 * <ul>
 *   <li>A shared {@link XmlMapper} producing a {@link JsonNode} tree</li>
 *   <li>The never-throw contract: any failure while reading or walking the tree is logged and
 *       turned into {@link DiagramGraph#empty()}</li>
 *   <li>Tree helpers for attributes, element text and descendant lookup</li>
 * </ul>
 *
 * <p>In the Jackson tree, attributes and child elements both appear as object fields keyed by
 * their local name (namespace prefixes are dropped). An element carrying attributes and text
 * stores the text under the empty field name. Repeated sibling elements become arrays.
 *
 * @see DiagramLoader
 */
public abstract class AbstractJacksonLoader implements DiagramLoader {

    /** Field name Jackson uses for the text of an element that also has attributes. */
    private static final String TEXT_FIELD = "";

    /**
     * Logger instance for this loader.
     * Automatically initialized with the concrete loader class name.
     */
    protected final Logger log;

    /**
     * XML mapper for parsing diagram documents.
     * Thread-safe and reusable across parse operations.
     */
    protected final XmlMapper xmlMapper;

    /**
     * Constructor that initializes the logger and the XML mapper.
     */
    protected AbstractJacksonLoader() {
        this.log = LoggerFactory.getLogger(getClass());
        this.xmlMapper = new XmlMapper();
    }

    @Override
    public DiagramGraph load(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream input = Files.newInputStream(file)) {
            log.debug("Loading diagram from: {}", file);
            return load(input);
        } catch (IOException e) {
            log.error("Failed to read diagram file {}: {}", file, e.getMessage());
            return DiagramGraph.empty();
        }
    }

    @Override
    public DiagramGraph load(InputStream input) {
        Objects.requireNonNull(input, "input must not be null");
        try {
            JsonNode root = xmlMapper.readTree(input);
            if (root == null || root.isMissingNode()) {
                log.warn("Diagram document is empty");
                return DiagramGraph.empty();
            }
            return parse(root);
        } catch (Exception e) {
            log.error("Error parsing {} document: {}", getId(), e.getMessage());
            return DiagramGraph.empty();
        }
    }

    /**
     * Builds the graph from the parsed document tree.
     *
     * <p>Implementations may throw; {@link #load(InputStream)} converts any exception into an
     * empty graph.
     *
     * @param root root element of the document (its own tag name is not part of the tree)
     * @return parsed graph
     */
    protected abstract DiagramGraph parse(JsonNode root);

    // ==================== Tree Navigation Utilities ====================

    /**
     * Extracts an attribute value from an element.
     *
     * @param element element node
     * @param attributeName attribute local name
     * @return attribute value, or null if absent
     */
    protected String extractAttribute(JsonNode element, String attributeName) {
        if (element == null || !element.isObject()) {
            return null;
        }
        JsonNode attrNode = element.get(attributeName);
        if (attrNode != null && attrNode.isValueNode()) {
            return attrNode.asText();
        }
        return null;
    }

    /**
     * Extracts a required attribute value from an element.
     *
     * @param element element node
     * @param attributeName attribute local name
     * @param elementName element name used in the error message
     * @return attribute value
     * @throws DiagramLoadException if the attribute is missing
     */
    protected String requireAttribute(JsonNode element, String attributeName, String elementName) {
        String value = extractAttribute(element, attributeName);
        if (value == null) {
            throw new DiagramLoadException("<" + elementName + "> is missing required attribute '" + attributeName + "'");
        }
        return value;
    }

    /**
     * Returns the text content of an element.
     *
     * <p>Handles plain text elements, elements with attributes (text under the empty field name)
     * and mixed content split into several text fragments.
     *
     * @param element element node
     * @return text content, or empty string if there is none
     */
    protected String textOf(JsonNode element) {
        if (element == null || element.isNull()) {
            return "";
        }
        if (element.isValueNode()) {
            return element.asText();
        }
        if (element.isArray()) {
            return element.isEmpty() ? "" : textOf(element.get(0));
        }
        JsonNode text = element.get(TEXT_FIELD);
        if (text == null) {
            return "";
        }
        if (text.isArray()) {
            StringBuilder joined = new StringBuilder();
            text.forEach(fragment -> joined.append(fragment.asText()));
            return joined.toString();
        }
        return text.asText();
    }

    /**
     * Finds the first descendant element with the given local name, in document order.
     *
     * <p>Equivalent to an XPath {@code .//name} lookup. If the matching field holds repeated
     * elements, the first one is returned.
     *
     * @param element element to search below
     * @param name element local name
     * @return first matching element, or null if none
     */
    protected JsonNode findDescendant(JsonNode element, String name) {
        if (element == null) {
            return null;
        }
        if (element.isArray()) {
            for (JsonNode item : element) {
                JsonNode found = findDescendant(item, name);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!element.isObject()) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equals(name)) {
                return firstOf(field.getValue());
            }
            JsonNode found = findDescendant(field.getValue(), name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Normalizes a field value to always be an array.
     *
     * <p>Useful for XML elements that can appear once or multiple times.
     *
     * @param node field value
     * @return array node (empty when the field is absent)
     */
    protected JsonNode normalizeToArray(JsonNode node) {
        if (node == null) {
            return xmlMapper.createArrayNode();
        }
        if (node.isArray()) {
            return node;
        }
        return xmlMapper.createArrayNode().add(node);
    }

    private JsonNode firstOf(JsonNode node) {
        if (node.isArray()) {
            return node.isEmpty() ? null : node.get(0);
        }
        return node;
    }
}
