package com.metamodel.generator.codegen.override;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed override resource: literal text keyed by qualified name, plus an optional header.
 * Read-only once parsing is done.
 */
public class OverrideTable {

    private final Map<String, OverrideEntry> entries = new LinkedHashMap<>();
    private String header;

    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public static OverrideTable empty() {
        return new OverrideTable();
    }

    void addEntry(OverrideEntry entry) {
        Objects.requireNonNull(entry, "entry");
        OverrideEntry previous = entries.put(entry.getKey(), entry);
        if (previous != null) {
            addWarning("Duplicate override for '" + entry.getKey() + "' (lines " + previous.getSourceLine()
                    + " and " + entry.getSourceLine() + "). Later entry overwrote earlier one.");
        }
    }

    void setHeader(String header) {
        if (this.header != null) {
            addWarning("Duplicate header block. Later block overwrote earlier one.");
        }
        this.header = header;
    }

    public boolean hasOverride(String key) {
        return key != null && entries.containsKey(key);
    }

    /**
     * Replacement text for the key, or null when there is none.
     */
    public String getOverride(String key) {
        OverrideEntry entry = entries.get(key);
        return entry != null ? entry.getText() : null;
    }

    public Optional<String> getType(String key) {
        return Optional.ofNullable(entries.get(key)).flatMap(OverrideEntry::getDeclaredType);
    }

    public Optional<String> getHeader() {
        return Optional.ofNullable(header);
    }

    public List<OverrideEntry> getEntries() {
        return List.copyOf(entries.values());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    void addError(String error) {
        if (error != null && !error.isBlank()) errors.add(error);
    }

    void addWarning(String warning) {
        if (warning != null && !warning.isBlank()) warnings.add(warning);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
