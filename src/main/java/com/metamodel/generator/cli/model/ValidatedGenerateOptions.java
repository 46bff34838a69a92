package com.metamodel.generator.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.metamodel.generator.codegen.input.SupermodelSpec;
import com.metamodel.generator.codegen.supermodel.LanguageRegistry;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    Path modelFile;
    List<SupermodelSpec> supermodels;
    Path overridesFile;
    /** Null when the output goes to standard output. */
    Path outputFile;
    LanguageRegistry languages;
}
