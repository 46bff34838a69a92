package com.metamodel.generator.model.loader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metamodel.generator.model.AggregationKind;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.ElementGraph;
import com.metamodel.generator.model.PackageNode;
import com.metamodel.generator.model.loader.document.AssociationDocument;
import com.metamodel.generator.model.loader.document.AttributeDocument;
import com.metamodel.generator.model.loader.document.ClassDocument;
import com.metamodel.generator.model.loader.document.GraphDocument;
import com.metamodel.generator.model.loader.document.PackageDocument;

/**
 * Reads an element graph from its JSON file form and resolves all id references.
 *
 * Resolution happens in passes (packages, classes, class members, associations) so that
 * references may point forward in the file.
 */
public class ElementGraphLoader {
    private static final Logger log = LoggerFactory.getLogger(ElementGraphLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public ElementGraph load(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (InputStream in = Files.newInputStream(path)) {
            ElementGraph graph = build(MAPPER.readValue(in, GraphDocument.class));
            log.info("Loaded model {}: {} classes, {} associations",
                    path.getFileName(), graph.getClasses().size(), graph.getAssociations().size());
            return graph;
        }
    }

    /** Parse a graph from a JSON string. */
    public ElementGraph loadFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return build(MAPPER.readValue(json, GraphDocument.class));
    }

    ElementGraph build(GraphDocument doc) throws GraphFormatException {
        ElementGraph graph = new ElementGraph();

        Map<String, PackageNode> packagesById = new HashMap<>();
        for (PackageDocument p : doc.getPackages()) {
            putUnique(packagesById, p.getId(), graph.addPackage(p.getName(), p.isProfile(), null), "package");
        }
        for (PackageDocument p : doc.getPackages()) {
            if (p.getOwningPackage() != null) {
                packagesById.get(p.getId()).setOwningPackage(
                        require(packagesById, p.getOwningPackage(), "owning package of package " + p.getName()));
            }
        }

        Map<String, ClassNode> classesById = new HashMap<>();
        Set<String> classNames = new HashSet<>();
        for (ClassDocument c : doc.getClasses()) {
            if (c.getName() == null || c.getName().isBlank()) {
                throw new GraphFormatException("Class " + c.getId() + " has no name");
            }
            if (!classNames.add(c.getName())) {
                throw new GraphFormatException("Duplicate class name: " + c.getName());
            }
            PackageNode pkg = c.getOwningPackage() != null
                    ? require(packagesById, c.getOwningPackage(), "owning package of class " + c.getName())
                    : null;
            putUnique(classesById, c.getId(), graph.addClass(c.getName(), pkg), "class");
        }

        Map<String, AttributeNode> attributesById = new HashMap<>();
        for (ClassDocument c : doc.getClasses()) {
            ClassNode cls = classesById.get(c.getId());
            c.getStereotypes().forEach(cls::applyStereotype);
            for (String generalId : c.getGeneralizations()) {
                cls.generalize(require(classesById, generalId, "generalization of class " + c.getName()));
            }
            for (AttributeDocument a : c.getAttributes()) {
                AttributeNode attribute = cls.addAttribute(toAttribute(a, classesById));
                if (a.getId() != null) {
                    putUnique(attributesById, a.getId(), attribute, "attribute");
                }
            }
            c.getOperations().forEach(cls::addOperation);
        }

        for (AssociationDocument assoc : doc.getAssociations()) {
            for (AttributeDocument owned : assoc.getOwnedEnds()) {
                putUnique(attributesById, owned.getId(), toAttribute(owned, classesById), "association end");
            }
            List<String> ends = assoc.getMemberEnds();
            if (ends.size() != 2) {
                throw new GraphFormatException("Association " + assoc.getId() + " must have exactly two member ends, found "
                        + ends.size());
            }
            AttributeNode first = require(attributesById, ends.get(0), "member end of association " + assoc.getId());
            AttributeNode second = require(attributesById, ends.get(1), "member end of association " + assoc.getId());
            try {
                if (assoc.isExtension()) {
                    graph.extend(first, second);
                } else {
                    graph.associate(first, second);
                }
            } catch (IllegalArgumentException e) {
                throw new GraphFormatException("Association " + assoc.getId() + ": " + e.getMessage());
            }
        }

        return graph;
    }

    private AttributeNode toAttribute(AttributeDocument a, Map<String, ClassNode> classesById)
            throws GraphFormatException {
        ClassNode type = a.getType() != null
                ? require(classesById, a.getType(), "type of attribute " + a.getName())
                : null;
        AggregationKind aggregation;
        try {
            aggregation = AggregationKind.fromString(a.getAggregation());
        } catch (IllegalArgumentException e) {
            throw new GraphFormatException("Attribute " + a.getName() + ": " + e.getMessage());
        }
        AttributeNode attribute = AttributeNode.builder()
                .name(a.getName())
                .typeValue(a.getTypeValue())
                .type(type)
                .lowerValue(a.getLower())
                .upperValue(a.getUpper())
                .defaultValue(a.getDefaultValue())
                .derived(a.isDerived())
                .aggregation(aggregation)
                .build();
        a.getTags().forEach(attribute::tag);
        return attribute;
    }

    private static <T> void putUnique(Map<String, T> byId, String id, T value, String kind)
            throws GraphFormatException {
        if (id == null || id.isBlank()) {
            throw new GraphFormatException("A " + kind + " has no id: " + value);
        }
        if (byId.putIfAbsent(id, value) != null) {
            throw new GraphFormatException("Duplicate " + kind + " id: " + id);
        }
    }

    private static <T> T require(Map<String, T> byId, String id, String what) throws GraphFormatException {
        T value = byId.get(id);
        if (value == null) {
            throw new GraphFormatException("Unknown id '" + id + "' referenced as " + what);
        }
        return value;
    }
}
