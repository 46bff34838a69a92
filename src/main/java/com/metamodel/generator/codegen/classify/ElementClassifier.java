package com.metamodel.generator.codegen.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.metamodel.generator.codegen.GeneratorConfig;
import com.metamodel.generator.codegen.exception.ModelStructureException;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.PackageNode;

/**
 * Computes class classifications and attribute shapes.
 *
 * One instance per run: classifications are cached, so the orderer, the emitters and the
 * resolvers all see the same answer for a class.
 */
public class ElementClassifier {

    private final GeneratorConfig config;
    private final Map<ClassNode, ClassClassification> cache = new IdentityHashMap<>();

    public ElementClassifier(GeneratorConfig config) {
        this.config = config;
    }

    public ClassClassification classify(ClassNode cls) {
        ClassClassification cached = cache.get(cls);
        if (cached != null) {
            return cached;
        }

        ClassClassification classification = ClassClassification.builder()
                .enumeration(isEnumerationName(cls.getName()))
                .simpleType(isSimpleType(cls, newIdentitySet()))
                .inProfile(isInProfile(cls))
                .excluded(cls.getName().startsWith(config.getExclusionPrefix()))
                .build();

        if (classification.isEnumeration() && classification.isSimpleType()) {
            throw new ModelStructureException(cls.getName(),
                    "Class " + cls.getName() + " is both an enumeration and a simple type");
        }

        cache.put(cls, classification);
        return classification;
    }

    public boolean isEnumeration(ClassNode cls) {
        return cls != null && classify(cls).isEnumeration();
    }

    public boolean isSimpleType(ClassNode cls) {
        return cls != null && classify(cls).isSimpleType();
    }

    public AttributeShape shapeOf(AttributeNode attribute) {
        if (isExtensionEnd(attribute)) {
            return AttributeShape.EXTENSION_END;
        }
        if (attribute.isDerived() && attribute.getType() == null) {
            return AttributeShape.DERIVED_UNRESOLVED;
        }
        if (attribute.getTypeValue() != null) {
            return AttributeShape.LITERAL;
        }
        if (attribute.getType() == null) {
            return AttributeShape.UNRESOLVED;
        }
        return isEnumeration(attribute.getType()) ? AttributeShape.ENUMERATION : AttributeShape.RELATION;
    }

    public boolean isExtensionEnd(AttributeNode attribute) {
        return attribute.getAssociation() != null && attribute.getAssociation().isExtension();
    }

    /**
     * Direct bases of a class: its generalizations, then the targets of embedded-base
     * attributes whose opposite end is unnamed.
     */
    public List<ClassNode> bases(ClassNode cls) {
        List<ClassNode> bases = new ArrayList<>(cls.getGeneralizations());
        for (AttributeNode attribute : cls.getOwnedAttributes()) {
            if (isEmbeddedBase(attribute) && !bases.contains(attribute.getType())) {
                bases.add(attribute.getType());
            }
        }
        return bases;
    }

    /**
     * True if an ancestor already declares an attribute with the same name.
     */
    public boolean isShadowed(AttributeNode attribute) {
        ClassNode owner = attribute.getOwner();
        if (owner == null || !attribute.hasName()) {
            return false;
        }
        Set<ClassNode> visited = newIdentitySet();
        visited.add(owner);
        for (ClassNode base : bases(owner)) {
            if (declaresInHierarchy(base, attribute.getName(), visited)) {
                return true;
            }
        }
        return false;
    }

    private boolean declaresInHierarchy(ClassNode cls, String attributeName, Set<ClassNode> visited) {
        if (!visited.add(cls)) {
            return false;
        }
        for (AttributeNode a : cls.getOwnedAttributes()) {
            if (attributeName.equals(a.getName())) {
                return true;
            }
        }
        for (ClassNode base : bases(cls)) {
            if (declaresInHierarchy(base, attributeName, visited)) {
                return true;
            }
        }
        return false;
    }

    private boolean isEmbeddedBase(AttributeNode attribute) {
        if (!config.getEmbeddedBaseAttribute().equals(attribute.getName())
                || attribute.getAssociation() == null
                || attribute.getType() == null) {
            return false;
        }
        return attribute.getOpposite().map(o -> !o.hasName()).orElse(true);
    }

    private boolean isEnumerationName(String name) {
        return config.getEnumerationSuffixes().stream().anyMatch(name::endsWith);
    }

    private boolean isSimpleType(ClassNode cls, Set<ClassNode> visited) {
        if (!visited.add(cls)) {
            return false;
        }
        if (cls.getAppliedStereotypes().contains(config.getSimpleTypeStereotype())) {
            return true;
        }
        for (ClassNode general : cls.getGeneralizations()) {
            if (isSimpleType(general, visited)) {
                return true;
            }
        }
        return false;
    }

    private boolean isInProfile(ClassNode cls) {
        Set<PackageNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        PackageNode pkg = cls.getOwningPackage();
        while (pkg != null && visited.add(pkg)) {
            if (pkg.isProfile()) {
                return true;
            }
            pkg = pkg.getOwningPackage();
        }
        return false;
    }

    private static Set<ClassNode> newIdentitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
