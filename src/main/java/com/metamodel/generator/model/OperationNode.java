package com.metamodel.generator.model;

import lombok.Getter;
import lombok.ToString;

/**
 * An operation owned by a class. Operations are only ever generated from overrides.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class OperationNode {

    @ToString.Include
    private final String name;
    private ClassNode owner;

    public OperationNode(String name) {
        this.name = name;
    }

    void setOwner(ClassNode owner) {
        this.owner = owner;
    }

    public String getQualifiedName() {
        return (owner != null ? owner.getName() : "<unowned>") + "." + name;
    }
}
