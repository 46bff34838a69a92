package com.metamodel.generator.model.loader;

import java.io.IOException;

/**
 * Raised when a graph file is well-formed JSON but does not describe a consistent graph.
 */
public class GraphFormatException extends IOException {

    private static final long serialVersionUID = 1L;

    public GraphFormatException(String message) {
        super(message);
    }
}
