package com.metamodel.generator.codegen.supermodel;

import java.util.Optional;

/**
 * Name to implementation lookup of one generated modeling language.
 */
@FunctionalInterface
public interface ImplementationLookup {

    Optional<ImplementationRef> lookup(String className);
}
