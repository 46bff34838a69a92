package com.metamodel.generator.codegen.emit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.classify.AttributeShape;
import com.metamodel.generator.codegen.classify.LiteralKind;
import com.metamodel.generator.codegen.exception.GenerationException;
import com.metamodel.generator.codegen.model.core.context.GenerationContext;
import com.metamodel.generator.codegen.override.OverrideTable;
import com.metamodel.generator.codegen.supermodel.CrossModelMatch;
import com.metamodel.generator.codegen.util.LiteralUtil;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.OperationNode;

/**
 * Emits class declarations with their literal, enumeration and relation slots.
 */
public class DeclarationEmitter {
    private static final Logger log = LoggerFactory.getLogger(DeclarationEmitter.class);

    static final Comparator<AttributeNode> BY_ATTRIBUTE_NAME =
            Comparator.comparing(a -> a.getName() != null ? a.getName() : "");
    static final Comparator<OperationNode> BY_OPERATION_NAME =
            Comparator.comparing(o -> o.getName() != null ? o.getName() : "");

    private final GenerationContext ctx;
    private final PropertySyntax syntax;

    public DeclarationEmitter(GenerationContext ctx) {
        this.ctx = ctx;
        this.syntax = ctx.getSyntax();
    }

    /**
     * Lines for one class: its override text, an import of the supermodel implementation, or
     * the declaration followed by two blank lines.
     */
    public List<String> emitClass(ClassNode cls) {
        OverrideTable overrides = ctx.getOverrides();
        if (overrides.hasOverride(cls.getName())) {
            log.debug("Class {} replaced by override", cls.getName());
            ctx.getStats().overrideApplied();
            return List.of(overrides.getOverride(cls.getName()));
        }

        Optional<CrossModelMatch> match = ctx.getCrossModelResolver().resolve(cls.getName());
        if (match.isPresent()) {
            String importLine = syntax.importStatement(match.get().getImplementation().getModule(),
                    match.get().getImplementation().getTypeName());
            log.debug("Class {} imported from {}", cls.getName(), match.get().getSupermodel().getLanguage());
            ctx.getImports().markImported(importLine);
            ctx.getStats().classImported();
            return List.of(importLine);
        }

        List<String> lines = new ArrayList<>();
        lines.add(syntax.classDeclaration(cls.getName(), baseNames(cls)));
        List<String> members = members(cls);
        if (members.isEmpty()) {
            lines.add(syntax.emptyBody());
        } else {
            members.forEach(m -> lines.add(syntax.member(m)));
        }
        lines.add("");
        lines.add("");
        ctx.getStats().classDeclared();
        return lines;
    }

    /**
     * Override texts of the class' operations, in name order.
     */
    public List<String> emitOperationOverrides(ClassNode cls) {
        List<String> lines = new ArrayList<>();
        for (OperationNode operation : sortedOperations(cls)) {
            String text = ctx.getOverrides().getOverride(operation.getQualifiedName());
            if (text != null) {
                ctx.getStats().overrideApplied();
                lines.add(text);
            }
        }
        return lines;
    }

    private List<String> baseNames(ClassNode cls) {
        return ctx.getClassifier().bases(cls).stream()
                .map(ClassNode::getName)
                .sorted()
                .toList();
    }

    private List<String> members(ClassNode cls) {
        List<String> members = new ArrayList<>();
        List<AttributeNode> attributes = new ArrayList<>(cls.getOwnedAttributes());
        attributes.sort(BY_ATTRIBUTE_NAME);
        for (AttributeNode attribute : attributes) {
            attributeMember(attribute).ifPresent(members::add);
        }

        for (OperationNode operation : sortedOperations(cls)) {
            String key = operation.getQualifiedName();
            if (ctx.getOverrides().hasOverride(key)) {
                ctx.getOverrides().getType(key)
                        .ifPresent(type -> members.add(syntax.annotatedMember(operation.getName(), type)));
            } else {
                warn("Operation " + key + " has no implementation");
            }
        }
        return members;
    }

    private Optional<String> attributeMember(AttributeNode attribute) {
        String key = attribute.getQualifiedName();
        if (ctx.getOverrides().hasOverride(key)) {
            return ctx.getOverrides().getType(key).map(type -> syntax.annotatedMember(attribute.getName(), type));
        }

        AttributeShape shape = ctx.getClassifier().shapeOf(attribute);
        if (!attribute.hasName() && needsName(shape)) {
            throw new GenerationException(key, "Unnamed attribute: " + key + " can not be declared");
        }
        return switch (shape) {
            case EXTENSION_END -> {
                log.debug("Skipping extension end {}", key);
                yield Optional.empty();
            }
            case DERIVED_UNRESOLVED -> {
                warn("Derived attribute " + key + " has no implementation.");
                yield Optional.empty();
            }
            case LITERAL -> Optional.of(syntax.literalAttribute(attribute.getName(), attribute.getTypeValue(),
                    defaultLiteral(attribute)));
            case ENUMERATION -> Optional.of(enumeration(attribute));
            case RELATION -> Optional.of(syntax.relationAttribute(attribute.getName(), attribute.getType().getName(),
                    "1".equals(attribute.getUpperValue()), ctx.getClassifier().isShadowed(attribute)));
            case UNRESOLVED -> throw new GenerationException(key,
                    key + " can not be written: it has neither a literal type nor a class type");
        };
    }

    private static boolean needsName(AttributeShape shape) {
        return switch (shape) {
            case LITERAL, ENUMERATION, RELATION -> true;
            case EXTENSION_END, DERIVED_UNRESOLVED, UNRESOLVED -> false;
        };
    }

    private String defaultLiteral(AttributeNode attribute) {
        String value = attribute.getDefaultValue();
        if (value == null || value.isEmpty()) {
            return null;
        }
        LiteralKind kind = LiteralKind.fromSpelling(attribute.getTypeValue())
                .filter(k -> k.getSpelling().equals(attribute.getTypeValue()))
                .orElseThrow(() -> new GenerationException(attribute.getQualifiedName(),
                        "Unknown default value type: " + attribute.getQualifiedName() + ": "
                                + attribute.getTypeValue() + " = " + value));
        return switch (kind) {
            case INTEGER -> LiteralUtil.titleCase(value);
            case STRING -> LiteralUtil.quote(value);
        };
    }

    private String enumeration(AttributeNode attribute) {
        ClassNode enumeration = attribute.getType();
        List<String> literals = enumeration.getOwnedAttributes().stream()
                .filter(AttributeNode::hasName)
                .map(AttributeNode::getName)
                .toList();
        if (literals.isEmpty()) {
            throw new GenerationException(attribute.getQualifiedName(),
                    "Enumeration " + enumeration.getName() + " of " + attribute.getQualifiedName() + " has no literals");
        }
        String declaredDefault = attribute.getDefaultValue();
        String defaultLiteral = declaredDefault != null && literals.contains(declaredDefault)
                ? declaredDefault
                : literals.get(0);
        return syntax.enumerationAttribute(attribute.getName(), literals, defaultLiteral);
    }

    private List<OperationNode> sortedOperations(ClassNode cls) {
        List<OperationNode> operations = new ArrayList<>(cls.getOwnedOperations());
        operations.sort(BY_OPERATION_NAME);
        return operations;
    }

    private void warn(String message) {
        log.warn(message);
        ctx.getDiagnostics().warn(message);
    }
}
