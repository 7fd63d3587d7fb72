package com.flowscribe.core.interpreter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link LogicTemplates} from JSON.
 *
 * <p>The document maps role names to ordered keyword entries:
 * <pre>{@code
 * {
 *   "Decision": [
 *     { "keywords": ["is even", "even?"], "logic": "if value % 2 == 0:" }
 *   ],
 *   "Output": [
 *     { "keywords": ["print"], "logic": "print(result)" }
 *   ]
 * }
 * }</pre>
 *
 * <p>The table is optional. A missing, unreadable or invalid resource logs a warning and
 * yields {@link LogicTemplates#empty()}.
 */
public final class LogicTemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(LogicTemplateLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, List<LogicTemplate>>> TABLE_TYPE = new TypeReference<>() {};

    /** Classpath location of the bundled table. */
    public static final String DEFAULT_RESOURCE = "logic-templates.json";

    private LogicTemplateLoader() {
        // Utility class
    }

    /**
     * Loads a table from a JSON file.
     *
     * @param path path to the JSON file
     * @return loaded table, or an empty table if unavailable
     */
    public static LogicTemplates load(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            log.warn("Logic template file not found or not readable: {}. No logic templates will be matched.", path);
            return LogicTemplates.empty();
        }
        try (InputStream input = Files.newInputStream(path)) {
            LogicTemplates templates = read(input);
            log.info("Loaded logic templates for {} roles from: {}", templates.roleCount(), path);
            return templates;
        } catch (IOException e) {
            log.warn("Failed to parse logic template file: {}. Error: {}", path, e.getMessage());
            return LogicTemplates.empty();
        }
    }

    /**
     * Loads a table from the classpath.
     *
     * @param resource resource name, e.g. {@value #DEFAULT_RESOURCE}
     * @return loaded table, or an empty table if unavailable
     */
    public static LogicTemplates loadFromClasspath(String resource) {
        ClassLoader classLoader = LogicTemplateLoader.class.getClassLoader();
        try (InputStream input = classLoader.getResourceAsStream(resource)) {
            if (input == null) {
                log.warn("Logic template resource not found on classpath: {}", resource);
                return LogicTemplates.empty();
            }
            LogicTemplates templates = read(input);
            log.debug("Loaded logic templates for {} roles from classpath: {}", templates.roleCount(), resource);
            return templates;
        } catch (IOException e) {
            log.warn("Failed to parse logic template resource: {}. Error: {}", resource, e.getMessage());
            return LogicTemplates.empty();
        }
    }

    /**
     * Loads the bundled table.
     *
     * @return bundled table, or an empty table if it is missing
     */
    public static LogicTemplates loadDefaults() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    private static LogicTemplates read(InputStream input) throws IOException {
        Map<String, List<LogicTemplate>> table = JSON_MAPPER.readValue(input, TABLE_TYPE);
        return table == null ? LogicTemplates.empty() : new LogicTemplates(table);
    }
}
