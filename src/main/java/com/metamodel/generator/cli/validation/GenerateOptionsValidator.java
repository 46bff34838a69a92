package com.metamodel.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.metamodel.generator.cli.exception.OptionsValidationException;
import com.metamodel.generator.cli.model.GenerateOptions;
import com.metamodel.generator.cli.model.ValidatedGenerateOptions;
import com.metamodel.generator.codegen.input.SupermodelSpec;
import com.metamodel.generator.codegen.supermodel.LanguageRegistry;

public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getModelFile() == null) {
			errors.add("Model file is required.");
		} else if (!existsFile(o.getModelFile())) {
			errors.add("Model file does not exist or is not a file: " + o.getModelFile());
		}

		if (o.getOverridesFile() != null && !existsFile(o.getOverridesFile())) {
			errors.add("Overrides file does not exist or is not a file: " + o.getOverridesFile());
		}

		if (o.getOutputFile() != null && Files.isDirectory(o.getOutputFile())) {
			errors.add("Output must be a file, not a directory: " + o.getOutputFile());
		}

		if (o.getPropertiesModule() != null && o.getPropertiesModule().isBlank()) {
			errors.add("Properties module must not be blank.");
		}

		LanguageRegistry languages = LanguageRegistry.withDefaults();
		for (Map.Entry<String, String> entry : o.getLanguageModules().entrySet()) {
			if (isBlank(entry.getKey()) || isBlank(entry.getValue())) {
				errors.add("Language module must be given as LANG=MODULE, got: " + entry.getKey() + "=" + entry.getValue());
			} else {
				languages.register(entry.getKey().trim(), entry.getValue().trim());
			}
		}

		List<SupermodelSpec> supermodels = parseSupermodels(o.getSupermodels(), languages, errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path outputFile = o.getOutputFile() == null ? null : o.getOutputFile().toAbsolutePath().normalize();
		return new ValidatedGenerateOptions(o.getModelFile(), supermodels, o.getOverridesFile(), outputFile, languages);
	}

	private static List<SupermodelSpec> parseSupermodels(List<String> raw, LanguageRegistry languages,
			List<String> errors) {
		List<SupermodelSpec> result = new ArrayList<>();
		for (String value : raw) {
			SupermodelSpec spec;
			try {
				spec = SupermodelSpec.parse(value);
			} catch (IllegalArgumentException e) {
				errors.add(e.getMessage());
				continue;
			}
			if (!languages.isKnown(spec.getLanguage())) {
				errors.add("Unknown modeling language '" + spec.getLanguage()
						+ "'. Register its module with --language-module " + spec.getLanguage() + "=MODULE.");
			}
			if (!existsFile(spec.getFile())) {
				errors.add("Supermodel file does not exist or is not a file: " + spec.getFile());
			}
			result.add(spec);
		}
		return result;
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
