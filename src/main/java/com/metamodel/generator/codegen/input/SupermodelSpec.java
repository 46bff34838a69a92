package com.metamodel.generator.codegen.input;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * A supermodel given on the command line as {@code LANG:FILE}.
 */
@Value
public class SupermodelSpec {

    @NonNull
    String language;

    @NonNull
    Path file;

    /**
     * Splits at the first colon, so the file part may itself contain colons.
     *
     * @throws IllegalArgumentException if either part is missing
     */
    public static SupermodelSpec parse(String value) {
        int colon = value == null ? -1 : value.indexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Supermodel must be given as LANG:FILE, got: " + value);
        }
        return new SupermodelSpec(value.substring(0, colon).trim(), Path.of(value.substring(colon + 1).trim()));
    }
}
