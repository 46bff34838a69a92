package com.metamodel.generator.codegen.exception;

/**
 * Fatal generation error. Aborts the whole run; no output of the run is valid.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String elementName;

    public GenerationException(String elementName, String message) {
        super(message);
        this.elementName = elementName;
    }

    /**
     * Qualified name of the offending class or attribute.
     */
    public String getElementName() {
        return elementName;
    }
}
