package com.metamodel.generator.codegen.classify;

import lombok.Builder;
import lombok.Value;

/**
 * The structural predicates of one class, computed once per run.
 */
@Value
@Builder
public class ClassClassification {

    boolean enumeration;
    boolean simpleType;
    boolean inProfile;
    boolean excluded;

    /**
     * A class is declared in the output only if none of the predicates hold.
     */
    public boolean isSelected() {
        return !enumeration && !simpleType && !inProfile && !excluded;
    }
}
