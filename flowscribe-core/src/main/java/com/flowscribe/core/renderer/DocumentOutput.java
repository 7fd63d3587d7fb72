package com.flowscribe.core.renderer;

import com.flowscribe.core.model.DiagramType;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A serialized document ready to be rendered to a destination.
 *
 * @param relativePath output path relative to the render target, e.g. {@code login.flow.json}
 * @param diagramType type of the interpreted diagram
 * @param content serialized document
 */
public record DocumentOutput(
    String relativePath,
    DiagramType diagramType,
    String content
) {
    /**
     * Compact constructor with validation.
     */
    public DocumentOutput {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(diagramType, "diagramType must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Derives the output file name for a diagram file, e.g. {@code login.graphml} →
     * {@code login.flow.json}.
     *
     * @param diagramFileName diagram file name
     * @return output file name
     */
    public static String fileNameFor(String diagramFileName) {
        int lastDot = diagramFileName.lastIndexOf('.');
        String stem = lastDot > 0 ? diagramFileName.substring(0, lastDot) : diagramFileName;
        return stem + ".flow.json";
    }

    /**
     * Derives the output path for a diagram file given relative to a scanned directory,
     * keeping its parent directories, e.g. {@code billing/login.graphml} →
     * {@code billing/login.flow.json}. Segments are joined with {@code /}.
     *
     * @param relativeDiagramFile diagram file relative to the scanned directory
     * @return output path relative to the render target
     */
    public static String relativePathFor(Path relativeDiagramFile) {
        String fileName = fileNameFor(relativeDiagramFile.getFileName().toString());
        Path parent = relativeDiagramFile.getParent();
        if (parent == null) {
            return fileName;
        }
        StringBuilder path = new StringBuilder();
        for (Path segment : parent) {
            path.append(segment).append('/');
        }
        return path.append(fileName).toString();
    }
}
