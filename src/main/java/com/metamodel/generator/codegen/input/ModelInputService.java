package com.metamodel.generator.codegen.input;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.GeneratorConfig;
import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.codegen.normalize.TypeNormalizer;
import com.metamodel.generator.codegen.override.OverrideParser;
import com.metamodel.generator.codegen.override.OverrideTable;
import com.metamodel.generator.codegen.supermodel.LanguageRegistry;
import com.metamodel.generator.codegen.supermodel.SupermodelRef;
import com.metamodel.generator.model.ElementGraph;
import com.metamodel.generator.model.loader.ElementGraphLoader;

/**
 * Loads the inputs of a run from disk. Supermodels are normalized here, once, and are
 * read-only afterwards.
 */
public class ModelInputService {
    private static final Logger log = LoggerFactory.getLogger(ModelInputService.class);

    private final GeneratorConfig config;
    private final LanguageRegistry registry;
    private final ElementGraphLoader loader = new ElementGraphLoader();
    private final OverrideParser overrideParser = new OverrideParser();

    public ModelInputService(GeneratorConfig config, LanguageRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public ModelInput load(Path modelFile, List<SupermodelSpec> supermodelSpecs, Path overridesFile)
            throws IOException {
        log.info("Loading model {}", modelFile);
        ElementGraph model = loader.load(modelFile);

        List<SupermodelRef> supermodels = new ArrayList<>();
        for (SupermodelSpec spec : supermodelSpecs) {
            supermodels.add(loadSupermodel(spec));
        }

        OverrideTable overrides = OverrideTable.empty();
        if (overridesFile != null) {
            log.info("Loading overrides {}", overridesFile);
            overrides = overrideParser.parse(overridesFile);
            overrides.getWarnings().forEach(log::warn);
        }
        return new ModelInput(model, supermodels, overrides);
    }

    SupermodelRef loadSupermodel(SupermodelSpec spec) throws IOException {
        log.info("Loading {} supermodel {}", spec.getLanguage(), spec.getFile());
        ElementGraph graph = loader.load(spec.getFile());
        ElementClassifier classifier = new ElementClassifier(config);
        new TypeNormalizer(classifier).normalize(graph);
        return registry.supermodel(spec.getLanguage(), graph, classifier);
    }
}
