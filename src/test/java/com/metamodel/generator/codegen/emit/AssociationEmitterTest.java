package com.metamodel.generator.codegen.emit;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.metamodel.generator.codegen.GeneratorConfig;
import com.metamodel.generator.codegen.exception.GenerationException;
import com.metamodel.generator.codegen.exception.ModelStructureException;
import com.metamodel.generator.codegen.model.core.context.GenerationContext;
import com.metamodel.generator.codegen.override.OverrideParser;
import com.metamodel.generator.codegen.override.OverrideTable;
import com.metamodel.generator.model.AggregationKind;
import com.metamodel.generator.model.AttributeNode;
import com.metamodel.generator.model.ClassNode;
import com.metamodel.generator.model.ElementGraph;
import com.metamodel.generator.model.TagNode;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for AssociationEmitter.
 */
class AssociationEmitterTest {

    private ElementGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ElementGraph();
    }

    private GenerationContext context(String... overrideLines) {
        OverrideTable overrides = new OverrideParser().parse(List.of(overrideLines));
        return GenerationContext.create(GeneratorConfig.defaults(), graph, List.of(), overrides);
    }

    @Test
    void testCompositeAssociationWithOpposite() {
        ClassNode container = graph.addClass("Container");
        ClassNode node = graph.addClass("Node");
        AttributeNode nodes = container.addAttribute(AttributeNode.builder()
                .name("nodes").type(node).upperValue("*").aggregation(AggregationKind.COMPOSITE).build());
        AttributeNode owner = node.addAttribute(AttributeNode.builder()
                .name("owner").type(container).upperValue("1").build());
        graph.associate(nodes, owner);
        AssociationEmitter emitter = new AssociationEmitter(context());

        List<String> containerLines = emitter.emit(container);
        List<String> nodeLines = emitter.emit(node);

        assertThat(containerLines).containsExactly(
                "Container.nodes = association(\"nodes\", Node, composite=True, opposite=\"owner\")");
        assertThat(nodeLines).containsExactly(
                "Node.owner = association(\"owner\", Container, upper=1, opposite=\"nodes\")");
    }

    @Test
    void testBoundsAreOmittedWhenDefault() {
        ClassNode cls = graph.addClass("Element");
        cls.addAttribute(AttributeNode.builder().name("a").type(cls).lowerValue("0").upperValue("*").build());
        cls.addAttribute(AttributeNode.builder().name("b").type(cls).lowerValue("1").upperValue("1").build());
        cls.addAttribute(AttributeNode.builder().name("c").type(cls).lowerValue("2").upperValue("5")
                .aggregation(AggregationKind.SHARED).build());

        List<String> lines = new AssociationEmitter(context()).emit(cls);

        assertThat(lines).containsExactly(
                "Element.a = association(\"a\", Element)",
                "Element.b = association(\"b\", Element, lower=1, upper=1)",
                "Element.c = association(\"c\", Element, lower=2, upper=5)");
    }

    @Test
    void testUnnamedOrUnownedOppositeIsOmitted() {
        ClassNode cls = graph.addClass("Comment");
        ClassNode target = graph.addClass("Element");
        AttributeNode annotated = cls.addAttribute(AttributeNode.builder().name("annotatedElement").type(target).build());
        graph.associate(annotated, AttributeNode.builder().name("comment").type(cls).build());

        assertThat(new AssociationEmitter(context()).emit(cls))
                .containsExactly("Comment.annotatedElement = association(\"annotatedElement\", Element)");
    }

    @Test
    void testDerivedUnion() {
        ClassNode namespace = graph.addClass("Namespace");
        ClassNode named = graph.addClass("NamedElement");
        namespace.addAttribute(AttributeNode.builder().name("member").type(named).derived(true).build());
        GenerationContext ctx = context();

        List<String> lines = new AssociationEmitter(ctx).emit(namespace);

        assertThat(lines).containsExactly("Namespace.member = derivedunion(\"member\", NamedElement)");
        assertThat(ctx.getStats().getDerivedUnions()).isEqualTo(1);
        assertThat(ctx.getUnions().getUnlinked()).extracting(AttributeNode::getQualifiedName)
                .containsExactly("Namespace.member");
    }

    @Test
    void testRedefinitionsComeLast() {
        ClassNode cls = graph.addClass("Property");
        ClassNode type = graph.addClass("Type");
        cls.addAttribute(AttributeNode.builder().name("a").type(type).build()
                .tag(TagNode.REDEFINES, "TypedElement.type"));
        cls.addAttribute(AttributeNode.builder().name("z").type(type).build());

        List<String> lines = new AssociationEmitter(context()).emit(cls);

        assertThat(lines).containsExactly(
                "Property.z = association(\"z\", Type)",
                "Property.a = redefine(Property, \"a\", Type, TypedElement.type)");
    }

    @Test
    void testLiteralsAndEnumerationsAreSkipped() {
        ClassNode kind = graph.addClass("AggregationKind");
        ClassNode cls = graph.addClass("Property");
        cls.addAttribute(AttributeNode.builder().name("name").typeValue("str").build());
        cls.addAttribute(AttributeNode.builder().name("aggregation").type(kind).build());
        cls.addAttribute(AttributeNode.builder().name("derivedThing").derived(true).build());

        assertThat(new AssociationEmitter(context()).emit(cls)).isEmpty();
    }

    @Test
    void testOverrideTextReplacesStatement() {
        ClassNode cls = graph.addClass("Element");
        cls.addAttribute(AttributeNode.builder().name("owner").type(cls).upperValue("1").derived(true).build());
        GenerationContext ctx = context(
                "override Element.owner: relation_one[Element]",
                "Element.owner = derivedunion(\"owner\", Element, upper=1)",
                "%%");

        List<String> lines = new AssociationEmitter(ctx).emit(cls);

        assertThat(lines).containsExactly("Element.owner = derivedunion(\"owner\", Element, upper=1)");
        assertThat(ctx.getStats().getDerivedUnions()).isZero();
    }

    @Test
    void testUnnamedEndIsFatal() {
        ClassNode cls = graph.addClass("Element");
        cls.addAttribute(AttributeNode.builder().type(cls).build());

        assertThatThrownBy(() -> new AssociationEmitter(context()).emit(cls))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("Unnamed attribute: Element.<unnamed>");
    }

    @Test
    void testUnnamedDerivedEndIsFatal() {
        ClassNode cls = graph.addClass("Namespace");
        cls.addAttribute(AttributeNode.builder().type(cls).derived(true).build());

        GenerationException e = catchThrowableOfType(
                () -> new AssociationEmitter(context()).emit(cls), GenerationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getElementName()).isEqualTo("Namespace.<unnamed>");
    }

    @Test
    void testRedefinesAndSubsetsTogetherIsFatal() {
        ClassNode cls = graph.addClass("Element");
        cls.addAttribute(AttributeNode.builder().name("x").type(cls).build()
                .tag(TagNode.REDEFINES, "Base.x")
                .tag(TagNode.SUBSETS, "y"));

        assertThatThrownBy(() -> new AssociationEmitter(context()).emit(cls))
                .isInstanceOf(ModelStructureException.class)
                .hasMessageContaining("Element.x both redefines Base.x and subsets y");
    }
}
