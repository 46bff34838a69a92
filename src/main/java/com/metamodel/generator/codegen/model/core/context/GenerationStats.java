package com.metamodel.generator.codegen.model.core.context;

import lombok.Getter;

/**
 * Counters for a generation run.
 */
@Getter
public class GenerationStats {

    private int classesDeclared;
    private int classesImported;
    private int overridesApplied;
    private int associations;
    private int derivedUnions;
    private int redefinitions;
    private int subsetLinks;

    public void classDeclared() {
        classesDeclared++;
    }

    public void classImported() {
        classesImported++;
    }

    public void overrideApplied() {
        overridesApplied++;
    }

    public void association() {
        associations++;
    }

    public void derivedUnion() {
        derivedUnions++;
    }

    public void redefinition() {
        redefinitions++;
    }

    public void subsetLink() {
        subsetLinks++;
    }
}
