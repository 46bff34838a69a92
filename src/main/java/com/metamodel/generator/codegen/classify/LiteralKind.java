package com.metamodel.generator.codegen.classify;

import java.util.Optional;
import java.util.Set;

/**
 * Canonical literal attribute kinds and the spellings folded into them.
 */
public enum LiteralKind {
    STRING("str", Set.of("String", "str", "object")),
    INTEGER("int", Set.of("Integer", "Boolean", "UnlimitedNatural", "int", "bool"));

    private final String spelling;
    private final Set<String> aliases;

    LiteralKind(String spelling, Set<String> aliases) {
        this.spelling = spelling;
        this.aliases = aliases;
    }

    /**
     * Canonical spelling used in generated code.
     */
    public String getSpelling() {
        return spelling;
    }

    public static Optional<LiteralKind> fromSpelling(String spelling) {
        if (spelling == null) {
            return Optional.empty();
        }
        for (LiteralKind kind : values()) {
            if (kind.aliases.contains(spelling)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
