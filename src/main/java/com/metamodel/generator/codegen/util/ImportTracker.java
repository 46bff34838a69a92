package com.metamodel.generator.codegen.util;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tracks import statements already emitted in one run so none is written twice.
 */
public class ImportTracker {

    private final Set<String> imported = new LinkedHashSet<>();

    /**
     * Records an import statement.
     *
     * @return true if the statement was not emitted before
     */
    public boolean markImported(String importStatement) {
        if (importStatement == null || importStatement.isEmpty()) {
            return false;
        }
        return imported.add(importStatement);
    }

    public boolean isImported(String importStatement) {
        return imported.contains(importStatement);
    }

    public Set<String> getImported() {
        return Collections.unmodifiableSet(imported);
    }
}
