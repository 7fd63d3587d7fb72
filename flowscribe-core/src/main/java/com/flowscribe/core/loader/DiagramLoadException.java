package com.flowscribe.core.loader;

/**
 * Signals a structural problem in a diagram document, such as a node without an ID.
 *
 * <p>Raised inside loaders and converted into an empty result at the loader boundary.
 */
public class DiagramLoadException extends RuntimeException {

    /**
     * Creates a new exception.
     *
     * @param message description of the problem
     */
    public DiagramLoadException(String message) {
        super(message);
    }
}
