package com.metamodel.generator.codegen.supermodel;

import com.metamodel.generator.model.ElementGraph;

import lombok.NonNull;
import lombok.Value;

/**
 * A previously generated model this run may reference instead of redeclaring its classes.
 * Consulted read-only.
 */
@Value
public class SupermodelRef {

    @NonNull
    String language;

    @NonNull
    ElementGraph graph;

    @NonNull
    ImplementationLookup lookup;
}
