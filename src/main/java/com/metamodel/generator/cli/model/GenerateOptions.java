package com.metamodel.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options of the coder. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(index = "0", paramLabel = "MODEL", description = "Element graph of the model to generate (JSON)")
	private Path modelFile;

	@Option(names = { "--supermodel",
			"-s" }, paramLabel = "LANG:FILE", description = "Previously generated model this model builds on, e.g. UML:models/UML.json (repeatable)")
	private List<String> supermodels = new ArrayList<>();

	@Option(names = { "--overrides", "-r" }, description = "Override file with literal replacement text")
	private Path overridesFile;

	@Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
	private Path outputFile;

	@Option(names = { "--language-module",
			"-L" }, paramLabel = "LANG=MODULE", description = "Module a supermodel language is generated in (repeatable)")
	private Map<String, String> languageModules = new LinkedHashMap<>();

	@Option(names = { "--properties-module" }, description = "Module the generated code imports its property types from")
	private String propertiesModule;

}
