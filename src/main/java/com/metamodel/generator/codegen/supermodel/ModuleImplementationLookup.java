package com.metamodel.generator.codegen.supermodel;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.ElementGraph;

/**
 * Lookup for a language generated into a single module. Only the classes the coder declares
 * for that language are present in the module.
 */
public class ModuleImplementationLookup implements ImplementationLookup {

    private final String module;
    private final Set<String> classNames;

    public ModuleImplementationLookup(String module, Collection<String> classNames) {
        this.module = module;
        this.classNames = Set.copyOf(classNames);
    }

    /**
     * Lookup over the classes a generation run of {@code graph} declares.
     */
    public static ModuleImplementationLookup forGeneratedModel(String module, ElementGraph graph,
                                                               ElementClassifier classifier) {
        return new ModuleImplementationLookup(module, graph.select(c -> classifier.classify(c).isSelected())
                .stream()
                .map(ClassNode::getName)
                .collect(Collectors.toSet()));
    }

    @Override
    public Optional<ImplementationRef> lookup(String className) {
        return classNames.contains(className)
                ? Optional.of(new ImplementationRef(module, className))
                : Optional.empty();
    }
}
