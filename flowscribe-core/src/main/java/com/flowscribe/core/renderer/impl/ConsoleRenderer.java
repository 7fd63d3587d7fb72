package com.flowscribe.core.renderer.impl;

import com.flowscribe.core.renderer.DocumentOutput;
import com.flowscribe.core.renderer.OutputRenderer;
import com.flowscribe.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Prints serialized documents to a stream, by default standard output.
 *
 * <p>Settings:
 * <ul>
 *   <li>{@code console.colors} - ANSI colored headers (default true)</li>
 *   <li>{@code console.showHeaders} - print a header per document (default true)</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private final PrintStream out;

    /**
     * Creates a renderer printing to standard output.
     */
    public ConsoleRenderer() {
        this(System.out);
    }

    /**
     * Creates a renderer printing to the given stream.
     *
     * @param out target stream
     */
    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(List<DocumentOutput> outputs, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "true"));

        logger.debug("Rendering {} documents to console (colors: {}, headers: {})", outputs.size(), useColors, showHeaders);

        for (int i = 0; i < outputs.size(); i++) {
            DocumentOutput output = outputs.get(i);
            if (showHeaders) {
                printHeader(output, i + 1, outputs.size(), useColors);
            }
            out.println(output.content());
        }
    }

    private void printHeader(DocumentOutput output, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";
        String reset = useColors ? ANSI_RESET : "";

        out.println(pathColor + "Document " + index + "/" + total + ": " + output.relativePath() + reset);
        out.println(metaColor + "Diagram type: " + output.diagramType().displayName()
            + " (template " + output.diagramType().templateName() + ")" + reset);
    }
}
