package com.metamodel.generator.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.cli.exception.OptionsValidationException;
import com.metamodel.generator.cli.model.GenerateOptions;
import com.metamodel.generator.cli.model.ValidatedGenerateOptions;
import com.metamodel.generator.cli.output.GenerateResultsPrinter;
import com.metamodel.generator.cli.validation.GenerateOptionsValidator;
import com.metamodel.generator.codegen.GeneratorConfig;
import com.metamodel.generator.codegen.GeneratorResult;
import com.metamodel.generator.codegen.ModelCoder;
import com.metamodel.generator.codegen.exception.GenerationException;
import com.metamodel.generator.codegen.input.ModelInput;
import com.metamodel.generator.codegen.input.ModelInputService;
import com.metamodel.generator.codegen.util.FileWriteUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command generating the object model source of a modeling language.
 */
@Command(
        name = "metamodel-coder",
        mixinStandardHelpOptions = true,
        version = "metamodel-coder 1.0.0",
        description = "Generates the object model source for a modeling language from its element graph."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    @Spec
    private CommandSpec spec;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(err -> log.error("{}", err));
            return 1;
        }

        try {
            printer.printBanner(validated);

            GeneratorConfig config = buildConfig();
            ModelInput input = new ModelInputService(config, validated.getLanguages())
                    .load(validated.getModelFile(), validated.getSupermodels(), validated.getOverridesFile());

            if (input.getOverrides().hasErrors()) {
                log.error("Overrides file has errors:");
                input.getOverrides().getErrors().forEach(err -> log.error("  {}", err));
                return 1;
            }

            GeneratorResult result = new ModelCoder(config)
                    .generate(input.getModel(), input.getSupermodels(), input.getOverrides());
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            writeOutput(validated, result);
            printer.printSuccess(validated, result);
            return 0;

        } catch (IOException e) {
            log.error("Failed to read or write input: {}", e.getMessage());
            return 1;
        } catch (GenerationException e) {
            log.error("Generation failed at {}: {}", e.getElementName(), e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Generation failed with exception", e);
            return 1;
        }
    }

    private GeneratorConfig buildConfig() {
        GeneratorConfig.GeneratorConfigBuilder builder = GeneratorConfig.builder();
        if (options.getPropertiesModule() != null) {
            builder.propertiesModule(options.getPropertiesModule().trim());
        }
        return builder.build();
    }

    private void writeOutput(ValidatedGenerateOptions validated, GeneratorResult result) throws IOException {
        if (validated.getOutputFile() == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(FileWriteUtil.joinLines(result.getLines()));
            out.flush();
        } else {
            FileWriteUtil.safeWriteLines(validated.getOutputFile(), result.getLines());
            log.info("Wrote {}", validated.getOutputFile());
        }
    }
}
