package com.metamodel.generator.codegen.supermodel;

import java.util.List;
import java.util.Optional;

import com.metamodel.generator.codegen.classify.ClassClassification;
import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.codegen.exception.GenerationException;
import com.metamodel.generator.model.ClassNode;

/**
 * Finds classes that an earlier generated supermodel already implements.
 */
public class CrossModelResolver {

    private final List<SupermodelRef> supermodels;
    private final ElementClassifier classifier;

    public CrossModelResolver(List<SupermodelRef> supermodels, ElementClassifier classifier) {
        this.supermodels = List.copyOf(supermodels);
        this.classifier = classifier;
    }

    /**
     * First supermodel, in the given order, with a same-named class that is neither an
     * enumeration nor part of a profile.
     *
     * @throws GenerationException if the class is in a supermodel graph but its language has no implementation
     */
    public Optional<CrossModelMatch> resolve(String className) {
        for (SupermodelRef supermodel : supermodels) {
            for (ClassNode candidate : supermodel.getGraph().select(c -> c.getName().equals(className))) {
                ClassClassification classification = classifier.classify(candidate);
                if (classification.isInProfile() || classification.isEnumeration()) {
                    continue;
                }
                ImplementationRef implementation = supermodel.getLookup().lookup(candidate.getName())
                        .orElseThrow(() -> new GenerationException(className,
                                "Type " + className + " found in model " + supermodel.getLanguage()
                                        + ", but not in its generated model"));
                return Optional.of(new CrossModelMatch(supermodel, candidate, implementation));
            }
        }
        return Optional.empty();
    }
}
