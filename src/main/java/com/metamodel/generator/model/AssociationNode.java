package com.metamodel.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * A binary association. Extensions connect a stereotype to the metaclass it extends;
 * their ends are never generated.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class AssociationNode {

    @ToString.Include
    private final AttributeNode first;
    @ToString.Include
    private final AttributeNode second;
    private final boolean extension;

    AssociationNode(AttributeNode first, AttributeNode second, boolean extension) {
        this.first = first;
        this.second = second;
        this.extension = extension;
    }

    public List<AttributeNode> getMemberEnds() {
        return List.of(first, second);
    }

    public Optional<AttributeNode> oppositeOf(AttributeNode end) {
        if (end == first) {
            return Optional.of(second);
        }
        if (end == second) {
            return Optional.of(first);
        }
        return Optional.empty();
    }
}
