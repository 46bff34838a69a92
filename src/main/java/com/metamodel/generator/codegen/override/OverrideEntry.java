package com.metamodel.generator.codegen.override;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Literal replacement text for one class, member or the file header.
 */
@Value
@Builder
public class OverrideEntry {

    @NonNull
    String key;

    /**
     * Type annotation written into the owning class body, e.g. {@code relation_one[Element]}.
     */
    String declaredType;

    @NonNull
    String text;

    int sourceLine;

    public Optional<String> getDeclaredType() {
        return Optional.ofNullable(declaredType);
    }
}
