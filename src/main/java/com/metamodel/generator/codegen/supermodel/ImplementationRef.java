package com.metamodel.generator.codegen.supermodel;

import lombok.NonNull;
import lombok.Value;

/**
 * Where an already generated class lives: its module and its type name.
 */
@Value
public class ImplementationRef {

    @NonNull
    String module;

    @NonNull
    String typeName;
}
