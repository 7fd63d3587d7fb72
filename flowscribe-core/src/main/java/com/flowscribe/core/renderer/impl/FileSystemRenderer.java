package com.flowscribe.core.renderer.impl;

import com.flowscribe.core.renderer.DocumentOutput;
import com.flowscribe.core.renderer.OutputRenderer;
import com.flowscribe.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;

/**
 * Writes serialized documents below the context's output directory.
 *
 * <p>Missing directories are created. Existing files are overwritten.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(List<DocumentOutput> outputs, RenderContext context) {
        Objects.requireNonNull(context.outputDirectory(), "outputDirectory must not be null");
        Path outputDir = Paths.get(context.outputDirectory());
        logger.info("Writing {} documents to: {}", outputs.size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (DocumentOutput output : outputs) {
            writeFile(outputDir, output);
        }
    }

    private void writeFile(Path outputDir, DocumentOutput output) {
        Path targetPath = outputDir.resolve(output.relativePath());
        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            byte[] bytes = output.content().getBytes(StandardCharsets.UTF_8);
            Files.write(targetPath, bytes);
            logger.info("Wrote {} ({} bytes)", output.relativePath(), bytes.length);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + output.relativePath(), e);
        }
    }
}
