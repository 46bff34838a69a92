package com.metamodel.generator.codegen.exception;

/**
 * The input graph is structurally inconsistent: generalization cycles or contradictory
 * classifications and tags.
 */
public class ModelStructureException extends GenerationException {

    private static final long serialVersionUID = 1L;

    public ModelStructureException(String elementName, String message) {
        super(elementName, message);
    }
}
