package com.metamodel.generator.codegen.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.classify.AttributeShape;
import com.metamodel.generator.codegen.classify.AttributeTags;
import com.metamodel.generator.codegen.model.core.context.GenerationContext;
import com.metamodel.generator.codegen.supermodel.CrossModelMatch;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;

/**
 * Links attributes tagged {@code subsets} to the derived unions they contribute to.
 *
 * <p>Targets are looked up on the class itself, then its bases, then the same-named class of a
 * supermodel. Unresolved targets are warnings, never fatal.
 */
public class SubsetResolver {
    private static final Logger log = LoggerFactory.getLogger(SubsetResolver.class);

    private final GenerationContext ctx;
    private final PropertySyntax syntax;

    public SubsetResolver(GenerationContext ctx) {
        this.ctx = ctx;
        this.syntax = ctx.getSyntax();
    }

    /**
     * Import and linkage lines for the subsetting attributes of a class. An import already
     * emitted earlier in the run is not repeated.
     */
    public List<String> emit(ClassNode cls) {
        List<String> lines = new ArrayList<>();
        List<AttributeNode> attributes = new ArrayList<>(cls.getOwnedAttributes());
        attributes.sort(DeclarationEmitter.BY_ATTRIBUTE_NAME);

        for (AttributeNode attribute : attributes) {
            if (ctx.getClassifier().shapeOf(attribute) != AttributeShape.RELATION) {
                continue;
            }
            String qualifiedName = attribute.getQualifiedName();
            for (String unionName : AttributeTags.of(attribute).getSubsets()) {
                Optional<ResolvedAttribute> resolved = findAttribute(cls, unionName);
                if (resolved.isEmpty()) {
                    warn(qualifiedName + " wants to subset " + unionName + ", but it is not defined");
                } else if (!resolved.get().attribute.isDerived()) {
                    warn(qualifiedName + " wants to subset " + unionName + ", but it is not a derived union");
                } else {
                    link(qualifiedName, resolved.get(), lines);
                }
            }
        }
        return lines;
    }

    private void link(String subsetName, ResolvedAttribute resolved, List<String> lines) {
        AttributeNode union = resolved.attribute;
        String unionOwner = union.getOwner().getName();
        if (resolved.origin != null) {
            String importLine = syntax.importStatement(resolved.origin.getImplementation().getModule(), unionOwner);
            if (ctx.getImports().markImported(importLine)) {
                lines.add(importLine);
            }
        }
        lines.add(syntax.subsetLink(unionOwner, union.getName(), subsetName));
        ctx.getUnions().linked(union);
        ctx.getStats().subsetLink();
        log.debug("{} subsets {}", subsetName, union.getQualifiedName());
    }

    Optional<ResolvedAttribute> findAttribute(ClassNode cls, String name) {
        return findAttribute(cls, name, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private Optional<ResolvedAttribute> findAttribute(ClassNode cls, String name, Set<ClassNode> visited) {
        if (!visited.add(cls)) {
            return Optional.empty();
        }
        for (AttributeNode attribute : cls.getOwnedAttributes()) {
            if (name.equals(attribute.getName())) {
                return Optional.of(new ResolvedAttribute(attribute, null));
            }
        }
        for (ClassNode base : ctx.getClassifier().bases(cls)) {
            Optional<ResolvedAttribute> found = findAttribute(base, name, visited);
            if (found.isPresent()) {
                return found;
            }
        }

        Optional<CrossModelMatch> match = ctx.getCrossModelResolver().resolve(cls.getName());
        if (match.isPresent() && match.get().getClassNode() != cls) {
            return findAttribute(match.get().getClassNode(), name, visited)
                    .map(found -> new ResolvedAttribute(found.attribute, match.get()));
        }
        return Optional.empty();
    }

    private void warn(String message) {
        log.warn(message);
        ctx.getDiagnostics().warn(message);
    }

    /**
     * An attribute found by name, with the supermodel it came from when it is not declared in
     * this run's model.
     */
    static final class ResolvedAttribute {
        final AttributeNode attribute;
        final CrossModelMatch origin;

        ResolvedAttribute(AttributeNode attribute, CrossModelMatch origin) {
            this.attribute = attribute;
            this.origin = origin;
        }
    }
}
