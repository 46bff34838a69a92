package com.metamodel.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A class of the modeling language. Names are unique within one {@link ElementGraph}.
 *
 * Identity based: two nodes are equal only if they are the same instance.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class ClassNode {

    @ToString.Include
    private final String name;

    @Setter
    private PackageNode owningPackage;

    private final List<String> appliedStereotypes = new ArrayList<>();
    private final List<ClassNode> generalizations = new ArrayList<>();
    private final List<AttributeNode> ownedAttributes = new ArrayList<>();
    private final List<OperationNode> ownedOperations = new ArrayList<>();

    public ClassNode(String name, PackageNode owningPackage) {
        this.name = name;
        this.owningPackage = owningPackage;
    }

    public ClassNode generalize(ClassNode general) {
        generalizations.add(general);
        return this;
    }

    public ClassNode applyStereotype(String stereotypeName) {
        appliedStereotypes.add(stereotypeName);
        return this;
    }

    public AttributeNode addAttribute(AttributeNode attribute) {
        ownedAttributes.add(attribute);
        attribute.setOwner(this);
        return attribute;
    }

    public OperationNode addOperation(String operationName) {
        OperationNode operation = new OperationNode(operationName);
        operation.setOwner(this);
        ownedOperations.add(operation);
        return operation;
    }

    public List<AttributeNode> getOwnedAttributes() {
        return Collections.unmodifiableList(ownedAttributes);
    }

    public List<OperationNode> getOwnedOperations() {
        return Collections.unmodifiableList(ownedOperations);
    }

    public List<ClassNode> getGeneralizations() {
        return Collections.unmodifiableList(generalizations);
    }

    public List<String> getAppliedStereotypes() {
        return Collections.unmodifiableList(appliedStereotypes);
    }
}
