package com.flowscribe.cli;

import com.flowscribe.core.config.ConfigLoader;
import com.flowscribe.core.config.FlowScribeConfig;
import com.flowscribe.core.model.FlowchartDocument;
import com.flowscribe.core.output.FlowchartDocumentWriter;
import com.flowscribe.core.pipeline.DiagramPipeline;
import com.flowscribe.core.renderer.DocumentOutput;
import com.flowscribe.core.renderer.OutputRenderer;
import com.flowscribe.core.renderer.RenderContext;
import com.flowscribe.core.renderer.impl.ConsoleRenderer;
import com.flowscribe.core.renderer.impl.FileSystemRenderer;
import com.flowscribe.core.util.DiagramFiles;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to interpret diagrams into flow documents.
 *
 * <p>Runs the full pipeline for every diagram:
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Collect diagram files (a single file, or every {@code *.graphml} below a directory)</li>
 *   <li>Load, classify, traverse and interpret each diagram</li>
 *   <li>Serialize each document as {@code <name>.flow.json}, mirroring the
 *       subdirectories of a scanned directory</li>
 *   <li>Render to the output directory or the console</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Interpret a single diagram
 * flowscribe interpret login.graphml
 *
 * # Interpret a directory into a custom output directory
 * flowscribe interpret diagrams/ -o build/flows
 *
 * # Print compact JSON instead of writing files
 * flowscribe interpret login.graphml --stdout --compact
 * }</pre>
 */
@Command(
    name = "interpret",
    description = "Interpret GraphML diagrams into flow documents",
    mixinStandardHelpOptions = true
)
public class InterpretCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InterpretCommand.class);
    private static final String GRAPHML_EXTENSION = "graphml";

    @Parameters(
        index = "0",
        description = "Diagram file or directory containing diagrams"
    )
    private Path inputPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: flowscribe.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--stdout"},
        description = "Print documents to the console instead of writing files"
    )
    private boolean toConsole;

    @Option(
        names = {"--compact"},
        description = "Write compact JSON (overrides config)"
    )
    private boolean compact;

    @Override
    public Integer call() {
        try {
            if (!Files.exists(inputPath)) {
                log.error("Input not found: {}", inputPath.toAbsolutePath());
                System.err.println("✗ Input not found: " + inputPath);
                return 1;
            }

            FlowScribeConfig config = ConfigLoader.load(configPath);
            DiagramPipeline pipeline = DiagramPipeline.fromConfig(config);
            boolean pretty = !compact && config.output().prettyPrint();
            FlowchartDocumentWriter writer = new FlowchartDocumentWriter(pretty);

            List<Path> diagramFiles = collectDiagramFiles(pipeline);
            if (diagramFiles.isEmpty()) {
                System.out.println("No diagrams found in: " + inputPath);
                return 0;
            }
            log.info("Interpreting {} diagram(s)", diagramFiles.size());

            List<DocumentOutput> outputs = new ArrayList<>();
            for (Path diagramFile : diagramFiles) {
                FlowchartDocument document = pipeline.run(diagramFile);
                log.info("{}: {} ({} nodes, {} steps)", diagramFile.getFileName(),
                    document.diagramType(), document.nodes().size(), document.executionFlow().size());
                outputs.add(new DocumentOutput(
                    outputPathFor(diagramFile),
                    document.diagramType(),
                    writer.toJson(document)
                ));
            }

            String directory = outputDir != null ? outputDir.toString() : config.output().directory();
            OutputRenderer renderer = toConsole ? new ConsoleRenderer() : new FileSystemRenderer();
            renderer.render(outputs, new RenderContext(directory, Map.of()));

            if (!toConsole) {
                System.out.println("✓ Wrote " + outputs.size() + " flow document(s) to: " + directory);
            }
            return 0;

        } catch (Exception e) {
            log.error("Interpretation failed", e);
            System.err.println("✗ Interpretation failed: " + e.getMessage());
            return 1;
        }
    }

    private String outputPathFor(Path diagramFile) {
        if (Files.isDirectory(inputPath)) {
            return DocumentOutput.relativePathFor(inputPath.relativize(diagramFile));
        }
        return DocumentOutput.fileNameFor(diagramFile.getFileName().toString());
    }

    private List<Path> collectDiagramFiles(DiagramPipeline pipeline) throws IOException {
        if (!Files.isDirectory(inputPath)) {
            if (!GRAPHML_EXTENSION.equals(DiagramFiles.getExtension(inputPath))) {
                log.warn("{} does not have a .{} extension, loading it anyway", inputPath, GRAPHML_EXTENSION);
            }
            return List.of(inputPath);
        }
        List<Path> files = new ArrayList<>();
        for (String pattern : pipeline.getLoader().getSupportedFilePatterns()) {
            files.addAll(DiagramFiles.findFiles(inputPath, pattern));
        }
        log.debug("Found {} diagram file(s) below {}", files.size(), inputPath);
        return files.stream().distinct().sorted().toList();
    }
}
