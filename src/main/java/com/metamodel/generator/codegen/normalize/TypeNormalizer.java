package com.metamodel.generator.codegen.normalize;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.codegen.classify.LiteralKind;
import com.metamodel.generator.codegen.exception.GenerationException;
import com.metamodel.generator.model.AggregationKind;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.ElementGraph;

/**
 * Canonicalizes literal type spellings and folds type names that denote classes into relations.
 *
 * Runs once per graph before any emission. Normalizing an already normalized graph changes nothing.
 */
public class TypeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TypeNormalizer.class);

    private final ElementClassifier classifier;

    public TypeNormalizer(ElementClassifier classifier) {
        this.classifier = classifier;
    }

    public void normalize(ElementGraph graph) {
        int folded = 0;
        for (AttributeNode attribute : graph.getAllAttributes()) {
            if (normalize(graph, attribute)) {
                folded++;
            }
        }
        log.debug("Normalized attribute types; {} type names folded into relations", folded);
    }

    /**
     * @return true if a type name was folded into a relation
     */
    private boolean normalize(ElementGraph graph, AttributeNode attribute) {
        boolean folded = false;
        String spelling = attribute.getTypeValue();

        if (spelling != null) {
            Optional<LiteralKind> kind = LiteralKind.fromSpelling(spelling);
            if (kind.isPresent()) {
                attribute.setTypeValue(kind.get().getSpelling());
            } else {
                Optional<ClassNode> target = graph.findClass(spelling);
                if (target.isPresent()) {
                    attribute.setType(target.get());
                    attribute.setTypeValue(null);
                    attribute.setAggregation(AggregationKind.COMPOSITE);
                    folded = true;
                }
            }
        }

        if (attribute.getType() != null) {
            if (classifier.isSimpleType(attribute.getType())) {
                attribute.setTypeValue(LiteralKind.STRING.getSpelling());
                attribute.setType(null);
            } else {
                attribute.setTypeValue(null);
            }
        }

        if (attribute.getType() == null && attribute.getTypeValue() != null
                && LiteralKind.fromSpelling(attribute.getTypeValue()).isEmpty()) {
            throw new GenerationException(attribute.getQualifiedName(),
                    "Property value type " + attribute.getTypeValue() + " of " + attribute.getQualifiedName()
                            + " can not be found");
        }
        return folded;
    }
}
