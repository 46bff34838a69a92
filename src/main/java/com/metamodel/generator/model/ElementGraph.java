package com.metamodel.generator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered, queryable store of the elements of one model.
 *
 * Iteration order is insertion order, which keeps every query deterministic.
 */
public class ElementGraph {

    private final List<PackageNode> packages = new ArrayList<>();
    private final List<ClassNode> classes = new ArrayList<>();
    private final List<AssociationNode> associations = new ArrayList<>();
    private final List<AttributeNode> associationOwnedEnds = new ArrayList<>();

    public PackageNode addPackage(String name, boolean profile, PackageNode owningPackage) {
        PackageNode pkg = new PackageNode(name, profile, owningPackage);
        packages.add(pkg);
        return pkg;
    }

    public ClassNode addClass(String name) {
        return addClass(name, null);
    }

    public ClassNode addClass(String name, PackageNode owningPackage) {
        Objects.requireNonNull(name, "name");
        ClassNode cls = new ClassNode(name, owningPackage);
        classes.add(cls);
        return cls;
    }

    /**
     * Connects two ends into an association. An end without owning class is recorded as
     * association-owned.
     */
    public AssociationNode associate(AttributeNode first, AttributeNode second) {
        return connect(first, second, false);
    }

    /**
     * Connects a stereotype's metaclass end and its extension end.
     */
    public AssociationNode extend(AttributeNode first, AttributeNode second) {
        return connect(first, second, true);
    }

    private AssociationNode connect(AttributeNode first, AttributeNode second, boolean extension) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (first == second) {
            throw new IllegalArgumentException("An association needs two distinct ends: " + first);
        }
        AssociationNode association = new AssociationNode(first, second, extension);
        for (AttributeNode end : association.getMemberEnds()) {
            if (end.getAssociation() != null) {
                throw new IllegalArgumentException("End already belongs to an association: " + end.getQualifiedName());
            }
            end.setAssociation(association);
            if (end.getOwner() == null) {
                associationOwnedEnds.add(end);
            }
        }
        associations.add(association);
        return association;
    }

    public List<ClassNode> select(Predicate<ClassNode> predicate) {
        return classes.stream().filter(predicate).toList();
    }

    public Optional<ClassNode> findClass(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return classes.stream().filter(c -> name.equals(c.getName())).findFirst();
    }

    /**
     * All attributes: class-owned first (class order, then attribute order), then association-owned ends.
     */
    public List<AttributeNode> getAllAttributes() {
        List<AttributeNode> result = new ArrayList<>();
        for (ClassNode cls : classes) {
            result.addAll(cls.getOwnedAttributes());
        }
        result.addAll(associationOwnedEnds);
        return result;
    }

    public List<ClassNode> getClasses() {
        return Collections.unmodifiableList(classes);
    }

    public List<PackageNode> getPackages() {
        return Collections.unmodifiableList(packages);
    }

    public List<AssociationNode> getAssociations() {
        return Collections.unmodifiableList(associations);
    }
}
