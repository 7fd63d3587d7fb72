package com.flowscribe.cli;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.loader.DiagramLoader;
import com.flowscribe.core.model.DiagramType;
import com.flowscribe.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available loaders, renderers, diagram types, or role vocabularies.
 *
 * <p>Loaders and renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * flowscribe list loaders
 * flowscribe list renderers
 * flowscribe list types
 * flowscribe list roles
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available loaders, renderers, diagram types, or roles",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: loaders, renderers, types, or roles"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "loaders", "loader" -> listLoaders();
            case "renderers", "renderer" -> listRenderers();
            case "types", "type" -> listDiagramTypes();
            case "roles", "role" -> listRoles();
            default -> {
                log.error("Unknown type: {}. Use: loaders, renderers, types, or roles", type);
                yield 1;
            }
        };
    }

    private int listLoaders() {
        System.out.println("Available Loaders:");
        System.out.println();

        boolean found = false;
        for (DiagramLoader loader : ServiceLoader.load(DiagramLoader.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", loader.getDisplayName(), loader.getId());
            System.out.printf("    Patterns: %s%n", loader.getSupportedFilePatterns());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No loaders found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }

    private int listDiagramTypes() {
        System.out.println("Diagram Types:");
        System.out.println();
        for (DiagramType diagramType : DiagramType.values()) {
            System.out.printf("  • %-22s template: %s%n", diagramType.displayName(), diagramType.templateName());
        }
        return 0;
    }

    private int listRoles() {
        System.out.println("Roles by Diagram Type:");
        System.out.println();
        for (DiagramType diagramType : DiagramType.values()) {
            List<String> roles = new ArrayList<>(NodeRoles.vocabularyFor(diagramType));
            Collections.sort(roles);
            System.out.printf("  • %s: %s%n", diagramType.displayName(), String.join(", ", roles));
        }
        return 0;
    }
}
