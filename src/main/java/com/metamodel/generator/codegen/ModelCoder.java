package com.metamodel.generator.codegen;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.emit.AssociationEmitter;
import com.metamodel.generator.codegen.emit.DeclarationEmitter;
import com.metamodel.generator.codegen.emit.HeaderRenderer;
import com.metamodel.generator.codegen.emit.SubsetResolver;
import com.metamodel.generator.codegen.exception.GenerationException;
import com.metamodel.generator.codegen.model.core.context.GenerationContext;
import com.metamodel.generator.codegen.model.core.context.GenerationStats;
import com.metamodel.generator.codegen.normalize.TypeNormalizer;
import com.metamodel.generator.codegen.order.DependencyOrderer;
import com.metamodel.generator.codegen.override.OverrideTable;
import com.metamodel.generator.codegen.supermodel.SupermodelRef;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.ElementGraph;

/**
 * Generates the object model source for an element graph.
 *
 * <p>The output is, in order: the header, the override header, one declaration (or override,
 * or supermodel import) per selected class with bases first, the operation overrides, and
 * finally the association statements and subset linkages per class.
 *
 * <p>Stateless between runs: every call to {@link #generate} works on a fresh context.
 */
public class ModelCoder {
    private static final Logger log = LoggerFactory.getLogger(ModelCoder.class);

    private final GeneratorConfig config;
    private final HeaderRenderer headerRenderer;

    public ModelCoder(GeneratorConfig config) {
        this.config = config;
        this.headerRenderer = new HeaderRenderer();
    }

    public GeneratorResult generate(ElementGraph model, List<SupermodelRef> supermodels, OverrideTable overrides) {
        GenerationContext ctx = GenerationContext.create(config, model, supermodels, overrides);
        try {
            log.info("Step 1: Normalizing attribute types...");
            new TypeNormalizer(ctx.getClassifier()).normalize(model);

            log.info("Step 2: Ordering classes...");
            List<ClassNode> selected = model.select(c -> ctx.getClassifier().classify(c).isSelected());
            List<ClassNode> classes = new DependencyOrderer(ctx.getClassifier()).order(selected);
            log.info("  {} of {} classes selected", selected.size(), model.getClasses().size());

            List<String> lines = new ArrayList<>();
            lines.add(headerRenderer.render(config));
            overrides.getHeader().ifPresent(lines::add);

            log.info("Step 3: Emitting class declarations...");
            DeclarationEmitter declarations = new DeclarationEmitter(ctx);
            for (ClassNode cls : classes) {
                lines.addAll(declarations.emitClass(cls));
            }
            for (ClassNode cls : classes) {
                lines.addAll(declarations.emitOperationOverrides(cls));
            }
            lines.add("");

            log.info("Step 4: Emitting associations and subsets...");
            AssociationEmitter associations = new AssociationEmitter(ctx);
            SubsetResolver subsets = new SubsetResolver(ctx);
            for (ClassNode cls : classes) {
                lines.addAll(associations.emit(cls));
                lines.addAll(subsets.emit(cls));
            }

            for (AttributeNode union : ctx.getUnions().getUnlinked()) {
                String message = "No subsets for derived union " + union.getQualifiedName();
                log.warn(message);
                ctx.getDiagnostics().warn(message);
            }

            log.info("Generation completed with {} warnings", ctx.getDiagnostics().getWarnings().size());
            return success(lines, ctx);

        } catch (GenerationException e) {
            log.error("Generation failed at {}: {}", e.getElementName(), e.getMessage());
            return GeneratorResult.failure(e.getMessage(), e.getElementName(), ctx.getDiagnostics().getWarnings());
        } catch (RuntimeException e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure("Generation failed: " + e.getMessage(), null,
                    ctx.getDiagnostics().getWarnings());
        }
    }

    private static GeneratorResult success(List<String> lines, GenerationContext ctx) {
        GenerationStats stats = ctx.getStats();
        return GeneratorResult.builder()
                .success(true)
                .lines(lines)
                .warnings(ctx.getDiagnostics().getWarnings())
                .classesDeclared(stats.getClassesDeclared())
                .classesImported(stats.getClassesImported())
                .overridesApplied(stats.getOverridesApplied())
                .associations(stats.getAssociations())
                .derivedUnions(stats.getDerivedUnions())
                .redefinitions(stats.getRedefinitions())
                .subsetLinks(stats.getSubsetLinks())
                .build();
    }
}
