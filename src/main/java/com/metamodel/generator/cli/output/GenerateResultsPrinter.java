package com.metamodel.generator.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.cli.model.ValidatedGenerateOptions;
import com.metamodel.generator.codegen.GeneratorResult;
import com.metamodel.generator.codegen.input.SupermodelSpec;

/**
 * Responsible only for reporting a run of the coder. Everything goes to the log, so
 * standard output stays reserved for generated code.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Metamodel Coder");
        log.info("=================================================");
        log.info("Model: {}", v.getModelFile().toAbsolutePath());
        if (v.getSupermodels().isEmpty()) {
            log.info("Supermodels: None");
        } else {
            log.info("Supermodels:");
            for (SupermodelSpec spec : v.getSupermodels()) {
                log.info("  {} ({}): {}", spec.getLanguage(),
                        v.getLanguages().moduleFor(spec.getLanguage()).orElse("?"),
                        spec.getFile().toAbsolutePath());
            }
        }
        log.info("Overrides: {}", v.getOverridesFile() != null ? v.getOverridesFile().toAbsolutePath() : "None");
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "standard output");
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "standard output");
        log.info("Classes Declared: {}", result.getClassesDeclared());
        log.info("Classes Imported: {}", result.getClassesImported());
        log.info("Overrides Applied: {}", result.getOverridesApplied());
        log.info("");
        log.info("Relations Summary:");
        log.info("  Associations: {}", result.getAssociations());
        log.info("  Derived Unions: {}", result.getDerivedUnions());
        log.info("  Redefinitions: {}", result.getRedefinitions());
        log.info("  Subset Links: {}", result.getSubsetLinks());

        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("{} warnings; complete the model or add overrides for:", result.getWarnings().size());
            result.getWarnings().forEach(w -> log.info("  - {}", w));
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
        if (result.getFailingElement() != null) {
            log.error("Failing element: {}", result.getFailingElement());
        }
    }
}
