package com.metamodel.generator.codegen.supermodel;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.model.ElementGraph;

/**
 * Maps language identifiers to the module their generated model lives in.
 *
 * Defaults come from {@code modeling-languages.properties} on the classpath; explicit
 * registrations take precedence.
 */
public class LanguageRegistry {
    private static final Logger log = LoggerFactory.getLogger(LanguageRegistry.class);

    static final String DEFAULTS_RESOURCE = "/modeling-languages.properties";

    private final Map<String, String> modulesByLanguage = new TreeMap<>();

    public static LanguageRegistry withDefaults() {
        LanguageRegistry registry = new LanguageRegistry();
        try (InputStream in = LanguageRegistry.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.warn("No {} on the classpath; only explicit language modules are known", DEFAULTS_RESOURCE);
                return registry;
            }
            Properties properties = new Properties();
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            for (String language : properties.stringPropertyNames()) {
                registry.register(language, properties.getProperty(language).trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        return registry;
    }

    public LanguageRegistry register(String language, String module) {
        modulesByLanguage.put(language, module);
        return this;
    }

    public Optional<String> moduleFor(String language) {
        return Optional.ofNullable(modulesByLanguage.get(language));
    }

    public boolean isKnown(String language) {
        return modulesByLanguage.containsKey(language);
    }

    /**
     * Builds the supermodel reference for a loaded graph of a registered language. Its module is
     * expected to hold the classes {@code classifier} selects from the graph.
     */
    public SupermodelRef supermodel(String language, ElementGraph graph, ElementClassifier classifier) {
        String module = moduleFor(language)
                .orElseThrow(() -> new IllegalArgumentException("Unknown modeling language: " + language));
        return new SupermodelRef(language, graph,
                ModuleImplementationLookup.forGeneratedModel(module, graph, classifier));
    }
}
