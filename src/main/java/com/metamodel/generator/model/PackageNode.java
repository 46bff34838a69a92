package com.metamodel.generator.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A package in the element graph. Profile packages hold stereotype definitions only.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class PackageNode {

    @ToString.Include
    private final String name;
    private final boolean profile;
    private PackageNode owningPackage;

    public PackageNode(String name, boolean profile, PackageNode owningPackage) {
        this.name = name;
        this.profile = profile;
        this.owningPackage = owningPackage;
    }
}
