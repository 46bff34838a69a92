package com.metamodel.generator.codegen;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the model coder: naming conventions of the input metamodel and
 * the target properties runtime.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Name written into the header of generated files.
     */
    @Builder.Default
    private String generatorName = "metamodel-coder";

    /**
     * Module the generated code imports its property descriptors from.
     */
    @Builder.Default
    private String propertiesModule = "modeling.core.properties";

    /**
     * Class name suffixes that mark an enumeration.
     */
    @Builder.Default
    private List<String> enumerationSuffixes = List.of("Kind", "Sort");

    /**
     * Class name prefix that excludes a class from generation.
     */
    @Builder.Default
    private String exclusionPrefix = "~";

    /**
     * Stereotype that turns a class into an inlined string attribute.
     */
    @Builder.Default
    private String simpleTypeStereotype = "SimpleAttribute";

    /**
     * Attribute name of the embedded-base idiom used by profile-style extensions.
     */
    @Builder.Default
    private String embeddedBaseAttribute = "baseClass";

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
