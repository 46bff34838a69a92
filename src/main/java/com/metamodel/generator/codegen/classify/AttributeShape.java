package com.metamodel.generator.codegen.classify;

/**
 * Closed set of attribute shapes the emitters dispatch on.
 */
public enum AttributeShape {
    /** End of a metaclass extension; never generated. */
    EXTENSION_END,
    /** Derived attribute without a target class; needs an override. */
    DERIVED_UNRESOLVED,
    /** Canonical literal kind (string or integer). */
    LITERAL,
    /** Target class is an enumeration. */
    ENUMERATION,
    /** Target class is a regular class. */
    RELATION,
    /** Neither literal nor class typed. */
    UNRESOLVED
}
