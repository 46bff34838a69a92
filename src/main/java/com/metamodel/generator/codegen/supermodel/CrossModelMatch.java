package com.metamodel.generator.codegen.supermodel;

import com.metamodel.generator.model.ClassNode;

import lombok.NonNull;
import lombok.Value;

/**
 * A class found in a supermodel together with its generated implementation.
 */
@Value
public class CrossModelMatch {

    @NonNull
    SupermodelRef supermodel;

    /** The supermodel's copy of the class; usable for further traversal. */
    @NonNull
    ClassNode classNode;

    @NonNull
    ImplementationRef implementation;
}
