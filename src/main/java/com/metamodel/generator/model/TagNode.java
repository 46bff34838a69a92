package com.metamodel.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A stereotype slot applied to an attribute: the defining feature name and its literal value.
 */
@Value
public class TagNode {

    public static final String SUBSETS = "subsets";
    public static final String REDEFINES = "redefines";

    @NonNull
    String definingFeature;

    @NonNull
    String value;
}
