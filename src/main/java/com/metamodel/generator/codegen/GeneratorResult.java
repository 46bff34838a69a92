package com.metamodel.generator.codegen;

import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of one generation run. A failed result carries no lines.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;
    /** Qualified name of the element that caused a fatal error, when known. */
    private String failingElement;

    @Singular
    private List<String> lines;
    @Singular
    private List<String> warnings;

    private int classesDeclared;
    private int classesImported;
    private int overridesApplied;
    private int associations;
    private int derivedUnions;
    private int redefinitions;
    private int subsetLinks;

    public static GeneratorResult failure(String errorMessage, String failingElement, List<String> warnings) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .failingElement(failingElement)
                .warnings(warnings)
                .build();
    }
}
