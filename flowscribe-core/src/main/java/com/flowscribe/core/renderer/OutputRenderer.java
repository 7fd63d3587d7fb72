package com.flowscribe.core.renderer;

import java.util.List;

/**
 * Delivers serialized flowchart documents to a destination.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@code console} - prints each document to standard output</li>
 *   <li>{@code filesystem} - writes each document below the context's output directory</li>
 * </ul>
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders documents.
     *
     * @param outputs serialized documents
     * @param context destination settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(List<DocumentOutput> outputs, RenderContext context);
}
