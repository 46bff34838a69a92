package com.metamodel.generator;

import com.metamodel.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the metamodel coder.
 * Reads a modeling language's element graph and writes the object model source implementing it.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
