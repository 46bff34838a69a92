package com.metamodel.generator.codegen.model.core.context;

import java.util.List;

import com.metamodel.generator.codegen.GeneratorConfig;
import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.codegen.emit.DerivedUnionTracker;
import com.metamodel.generator.codegen.emit.PropertySyntax;
import com.metamodel.generator.codegen.override.OverrideTable;
import com.metamodel.generator.codegen.supermodel.CrossModelResolver;
import com.metamodel.generator.codegen.supermodel.SupermodelRef;
import com.metamodel.generator.codegen.util.ImportTracker;
import com.metamodel.generator.model.ElementGraph;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Everything one generation run reads and accumulates. Created per run and discarded
 * afterwards; nothing in here is shared between runs.
 */
@Getter
@Builder
public final class GenerationContext {

    @NonNull
    private final GeneratorConfig config;

    @NonNull
    private final ElementGraph model;

    @NonNull
    private final OverrideTable overrides;

    @NonNull
    private final ElementClassifier classifier;

    @NonNull
    private final CrossModelResolver crossModelResolver;

    @NonNull
    private final PropertySyntax syntax;

    @NonNull
    private final ImportTracker imports;

    @NonNull
    private final DerivedUnionTracker unions;

    @NonNull
    private final ToolDiagnostics diagnostics;

    @NonNull
    private final GenerationStats stats;

    public static GenerationContext create(GeneratorConfig config, ElementGraph model,
                                           List<SupermodelRef> supermodels, OverrideTable overrides) {
        ElementClassifier classifier = new ElementClassifier(config);
        return GenerationContext.builder()
                .config(config)
                .model(model)
                .overrides(overrides)
                .classifier(classifier)
                .crossModelResolver(new CrossModelResolver(supermodels, classifier))
                .syntax(new PropertySyntax())
                .imports(new ImportTracker())
                .unions(new DerivedUnionTracker())
                .diagnostics(new ToolDiagnostics())
                .stats(new GenerationStats())
                .build();
    }
}
