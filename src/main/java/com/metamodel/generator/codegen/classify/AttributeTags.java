package com.metamodel.generator.codegen.classify;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.metamodel.generator.codegen.exception.ModelStructureException;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.TagNode;

import lombok.Value;

/**
 * The {@code subsets} and {@code redefines} tags of an attribute.
 */
@Value
public class AttributeTags {

    List<String> subsets;
    String redefines;

    public Optional<String> getRedefines() {
        return Optional.ofNullable(redefines);
    }

    /**
     * Reads the tags of an attribute. An attribute may subset or redefine, never both.
     *
     * @throws ModelStructureException if both tags are present
     */
    public static AttributeTags of(AttributeNode attribute) {
        List<String> subsets = attribute.getTagValue(TagNode.SUBSETS)
                .map(AttributeTags::splitNames)
                .orElse(List.of());
        String redefines = attribute.getTagValue(TagNode.REDEFINES)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .orElse(null);

        if (redefines != null && !subsets.isEmpty()) {
            throw new ModelStructureException(attribute.getQualifiedName(),
                    attribute.getQualifiedName() + " both redefines " + redefines + " and subsets "
                            + String.join(", ", subsets) + "; only one of them is allowed");
        }
        return new AttributeTags(subsets, redefines);
    }

    private static List<String> splitNames(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
