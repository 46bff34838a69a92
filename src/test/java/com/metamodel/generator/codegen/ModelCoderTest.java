package com.metamodel.generator.codegen;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.metamodel.generator.codegen.classify.ElementClassifier;
import com.metamodel.generator.codegen.override.OverrideParser;
import com.metamodel.generator.codegen.override.OverrideTable;
import com.metamodel.generator.codegen.supermodel.LanguageRegistry;
import com.metamodel.generator.codegen.supermodel.SupermodelRef;
import com.metamodel.generator.model.AggregationKind;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.ElementGraph;
import com.metamodel.generator.model.TagNode;
import com.metamodel.generator.model.loader.ElementGraphLoader;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the complete ModelCoder pipeline.
 */
class ModelCoderTest {

    private final ModelCoder coder = new ModelCoder(GeneratorConfig.defaults());

    private static final String KERNEL = """
            {
              "packages": [ { "id": "p", "name": "Kernel" }, { "id": "pr", "name": "Profile", "profile": true } ],
              "classes": [
                { "id": "derived", "name": "Derived", "owningPackage": "p", "generalizations": ["base"],
                  "attributes": [ { "id": "d1", "name": "name", "typeValue": "String" },
                                  { "id": "d2", "name": "isAbstract", "typeValue": "Boolean", "defaultValue": "true" } ] },
                { "id": "base", "name": "Base", "owningPackage": "p" },
                { "id": "kind", "name": "ColorKind", "attributes": [ { "id": "k1", "name": "red" } ] },
                { "id": "st", "name": "Marker", "owningPackage": "pr" },
                { "id": "ex", "name": "~Scratch" }
              ]
            }
            """;

    private static ElementGraph load(String json) throws IOException {
        return new ElementGraphLoader().loadFromString(json);
    }

    private static OverrideTable overrides(String... lines) {
        return new OverrideParser().parse(List.of(lines));
    }

    @Test
    void testBaseIsDeclaredBeforeDerived() throws IOException {
        GeneratorResult result = coder.generate(load(KERNEL), List.of(), OverrideTable.empty());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLines().get(0)).startsWith("# This file is generated by metamodel-coder. DO NOT EDIT!");
        assertThat(result.getLines().get(0)).contains("from modeling.core.properties import (");
        assertThat(result.getLines()).containsSubsequence(
                "class Base():",
                "    pass",
                "",
                "",
                "class Derived(Base):",
                "    isAbstract: _attribute[int] = _attribute(\"isAbstract\", int, default=True)",
                "    name: _attribute[str] = _attribute(\"name\", str)",
                "",
                "");
        assertThat(result.getClassesDeclared()).isEqualTo(2);
    }

    @Test
    void testUnselectedClassesAreNotDeclared() throws IOException {
        GeneratorResult result = coder.generate(load(KERNEL), List.of(), OverrideTable.empty());

        assertThat(result.getLines()).noneMatch(l -> l.startsWith("class ColorKind"));
        assertThat(result.getLines()).noneMatch(l -> l.startsWith("class Marker"));
        assertThat(result.getLines()).noneMatch(l -> l.startsWith("class ~Scratch"));
    }

    @Test
    void testIdenticalInputsGiveIdenticalOutput() throws IOException {
        ElementGraph graph = load(KERNEL);

        GeneratorResult first = coder.generate(graph, List.of(), OverrideTable.empty());
        GeneratorResult second = coder.generate(graph, List.of(), OverrideTable.empty());
        GeneratorResult fresh = coder.generate(load(KERNEL), List.of(), OverrideTable.empty());

        assertThat(second.getLines()).isEqualTo(first.getLines());
        assertThat(fresh.getLines()).isEqualTo(first.getLines());
    }

    @Test
    void testOverrideTextReplacesDefaultGeneration() throws IOException {
        OverrideTable table = overrides(
                "header",
                "from modeling.core.base import Base",
                "%%",
                "override Base",
                "# Base is defined in modeling.core.base",
                "%%",
                "override Derived.name: str",
                "Derived.name = _attribute(\"name\", str, default=\"anonymous\")",
                "%%");

        GeneratorResult result = coder.generate(load(KERNEL), List.of(), table);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLines()).containsSubsequence(
                "from modeling.core.base import Base",
                "# Base is defined in modeling.core.base",
                "class Derived(Base):",
                "    name: str",
                "Derived.name = _attribute(\"name\", str, default=\"anonymous\")");
        assertThat(result.getLines()).noneMatch(l -> l.contains("_attribute[str] = _attribute(\"name\""));
        assertThat(result.getLines()).doesNotContain("class Base():");
        assertThat(result.getOverridesApplied()).isEqualTo(2);
    }

    @Test
    void testAssociationsFollowDeclarationsAndOperations() throws IOException {
        ElementGraph graph = new ElementGraph();
        ClassNode container = graph.addClass("Container");
        ClassNode node = graph.addClass("Node");
        node.addOperation("accept");
        AttributeNode nodes = container.addAttribute(AttributeNode.builder()
                .name("nodes").type(node).upperValue("*").aggregation(AggregationKind.COMPOSITE).build());
        AttributeNode owner = node.addAttribute(AttributeNode.builder().name("owner").type(container).upperValue("1").build());
        graph.associate(nodes, owner);
        OverrideTable table = overrides("override Node.accept: Callable[[Visitor], None]", "Node.accept = _accept", "%%");

        GeneratorResult result = coder.generate(graph, List.of(), table);

        assertThat(result.getLines()).containsSubsequence(
                "class Container():",
                "    nodes: relation_many[Node]",
                "class Node():",
                "    owner: relation_one[Container]",
                "    accept: Callable[[Visitor], None]",
                "Node.accept = _accept",
                "",
                "Container.nodes = association(\"nodes\", Node, composite=True, opposite=\"owner\")",
                "Node.owner = association(\"owner\", Container, upper=1, opposite=\"nodes\")");
        assertThat(result.getLines().stream().filter(l -> l.startsWith("Container.nodes = ")).count()).isEqualTo(1);
        assertThat(result.getAssociations()).isEqualTo(2);
    }

    @Test
    void testSubsetsOfDerivedUnion() {
        ElementGraph graph = new ElementGraph();
        ClassNode named = graph.addClass("NamedElement");
        ClassNode namespace = graph.addClass("Namespace").generalize(named);
        namespace.addAttribute(AttributeNode.builder().name("member").type(named).derived(true).build());
        graph.addClass("Class").generalize(namespace)
                .addAttribute(AttributeNode.builder().name("ownedAttribute").type(named).build())
                .tag(TagNode.SUBSETS, "member");
        graph.addClass("Package").generalize(namespace)
                .addAttribute(AttributeNode.builder().name("ownedElement").type(named).build())
                .tag(TagNode.SUBSETS, "member");

        GeneratorResult result = coder.generate(graph, List.of(), OverrideTable.empty());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLines()).filteredOn(l -> l.contains(".add("))
                .containsExactly(
                        "Namespace.member.add(Class.ownedAttribute)  # type: ignore[attr-defined]",
                        "Namespace.member.add(Package.ownedElement)  # type: ignore[attr-defined]");
        assertThat(result.getSubsetLinks()).isEqualTo(2);
        assertThat(result.getWarnings()).noneMatch(w -> w.startsWith("No subsets for derived union"));
    }

    @Test
    void testUnionWithoutSubsetsIsReported() {
        ElementGraph graph = new ElementGraph();
        ClassNode named = graph.addClass("NamedElement");
        named.addAttribute(AttributeNode.builder().name("namespace").type(named).derived(true).build());

        GeneratorResult result = coder.generate(graph, List.of(), OverrideTable.empty());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getWarnings()).contains("No subsets for derived union NamedElement.namespace");
    }

    @Test
    void testSupermodelClassIsImportedNotRedeclared() throws IOException {
        ElementGraph core = load("""
                { "classes": [ { "id": "e", "name": "Element" } ] }
                """);
        SupermodelRef coreRef = new LanguageRegistry().register("Core", "modeling.core.model").supermodel("Core", core,
                new ElementClassifier(GeneratorConfig.defaults()));
        ElementGraph graph = load("""
                { "classes": [
                    { "id": "e", "name": "Element" },
                    { "id": "d", "name": "Diagram", "generalizations": ["e"] } ] }
                """);

        GeneratorResult result = coder.generate(graph, List.of(coreRef), OverrideTable.empty());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLines()).containsSubsequence(
                "from modeling.core.model import Element",
                "class Diagram(Element):");
        assertThat(result.getLines()).noneMatch(l -> l.startsWith("class Element"));
        assertThat(result.getClassesImported()).isEqualTo(1);
        assertThat(result.getClassesDeclared()).isEqualTo(1);
    }

    @Test
    void testFatalErrorYieldsNoLines() throws IOException {
        ElementGraph graph = load("""
                { "classes": [ { "id": "a", "name": "Element",
                                 "attributes": [ { "id": "x", "name": "size", "typeValue": "Float" } ] } ] }
                """);

        GeneratorResult result = coder.generate(graph, List.of(), OverrideTable.empty());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getLines()).isEmpty();
        assertThat(result.getFailingElement()).isEqualTo("Element.size");
        assertThat(result.getErrorMessage()).contains("Float");
    }

    @Test
    void testUnnamedDerivedAttributeNamesFailingElement() throws IOException {
        ElementGraph graph = load("""
                { "classes": [ { "id": "a", "name": "A",
                                 "attributes": [ { "id": "x", "type": "a", "derived": true } ] } ] }
                """);

        GeneratorResult result = coder.generate(graph, List.of(), OverrideTable.empty());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getLines()).isEmpty();
        assertThat(result.getFailingElement()).isEqualTo("A.<unnamed>");
        assertThat(result.getErrorMessage()).startsWith("Unnamed attribute");
    }

    @Test
    void testGeneralizationCycleFails() {
        ElementGraph graph = new ElementGraph();
        ClassNode a = graph.addClass("A");
        ClassNode b = graph.addClass("B").generalize(a);
        a.generalize(b);

        GeneratorResult result = coder.generate(graph, List.of(), OverrideTable.empty());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).startsWith("Generalization cycle");
    }

    @Test
    void testPropertiesModuleIsConfigurable() {
        ModelCoder custom = new ModelCoder(GeneratorConfig.builder().propertiesModule("my.properties").build());

        GeneratorResult result = custom.generate(new ElementGraph(), List.of(), OverrideTable.empty());

        assertThat(result.getLines().get(0)).contains("from my.properties import (");
    }
}
