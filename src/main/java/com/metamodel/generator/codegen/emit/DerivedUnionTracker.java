package com.metamodel.generator.codegen.emit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.metamodel.generator.model.AttributeNode;

/**
 * Derived unions declared in a run and the ones that received at least one subset.
 */
public class DerivedUnionTracker {

    private final List<AttributeNode> declared = new ArrayList<>();
    private final Set<AttributeNode> linked = Collections.newSetFromMap(new IdentityHashMap<>());

    public void declared(AttributeNode union) {
        declared.add(union);
    }

    public void linked(AttributeNode union) {
        linked.add(union);
    }

    /**
     * Unions declared in this run that nothing subsets, sorted by qualified name.
     */
    public List<AttributeNode> getUnlinked() {
        return declared.stream()
                .filter(u -> !linked.contains(u))
                .sorted(Comparator.comparing(AttributeNode::getQualifiedName))
                .toList();
    }
}
