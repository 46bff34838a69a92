package com.metamodel.generator.codegen.emit;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.classify.AttributeShape;
import com.metamodel.generator.codegen.classify.AttributeTags;
import com.metamodel.generator.codegen.exception.GenerationException;
import com.metamodel.generator.codegen.model.core.context.GenerationContext;
import com.metamodel.generator.model.AggregationKind;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;

/**
 * Emits the association, derived union and redefinition statements of a class.
 * Redefinitions come last so they never refer to an association declared further down.
 */
public class AssociationEmitter {
    private static final Logger log = LoggerFactory.getLogger(AssociationEmitter.class);

    private final GenerationContext ctx;
    private final PropertySyntax syntax;

    public AssociationEmitter(GenerationContext ctx) {
        this.ctx = ctx;
        this.syntax = ctx.getSyntax();
    }

    public List<String> emit(ClassNode cls) {
        List<String> lines = new ArrayList<>();
        List<String> redefinitions = new ArrayList<>();

        List<AttributeNode> attributes = new ArrayList<>(cls.getOwnedAttributes());
        attributes.sort(DeclarationEmitter.BY_ATTRIBUTE_NAME);

        for (AttributeNode attribute : attributes) {
            String key = attribute.getQualifiedName();
            String override = ctx.getOverrides().getOverride(key);
            if (override != null) {
                ctx.getStats().overrideApplied();
                lines.add(override);
                continue;
            }
            if (!isRelation(attribute)) {
                continue;
            }

            if (!attribute.hasName()) {
                throw new GenerationException(key, "Unnamed attribute: " + key + " (association end of "
                        + cls.getName() + " can not be declared)");
            }

            AttributeTags tags = AttributeTags.of(attribute);
            String typeName = attribute.getType().getName();
            if (tags.getRedefines().isPresent()) {
                redefinitions.add(syntax.redefinition(key, cls.getName(), attribute.getName(), typeName,
                        tags.getRedefines().get()));
            } else if (attribute.isDerived()) {
                lines.add(syntax.derivedUnion(key, attribute.getName(), typeName,
                        attribute.getLowerValue(), attribute.getUpperValue()));
                ctx.getUnions().declared(attribute);
                ctx.getStats().derivedUnion();
            } else {
                lines.add(syntax.association(key, attribute.getName(), typeName,
                        attribute.getLowerValue(), attribute.getUpperValue(),
                        attribute.getAggregation() == AggregationKind.COMPOSITE, oppositeName(attribute)));
                ctx.getStats().association();
            }
        }

        for (String redefinition : redefinitions) {
            ctx.getStats().redefinition();
            lines.add(redefinition);
        }
        log.debug("{}: {} association statements", cls.getName(), lines.size());
        return lines;
    }

    boolean isRelation(AttributeNode attribute) {
        AttributeShape shape = ctx.getClassifier().shapeOf(attribute);
        return switch (shape) {
            case RELATION -> true;
            case EXTENSION_END, DERIVED_UNRESOLVED, LITERAL, ENUMERATION, UNRESOLVED -> false;
        };
    }

    // Only a named opposite anchored to a class is a symbol the generated code can refer to.
    private static String oppositeName(AttributeNode attribute) {
        return attribute.getOpposite()
                .filter(o -> o.hasName() && o.getOwner() != null)
                .map(AttributeNode::getName)
                .orElse(null);
    }
}
