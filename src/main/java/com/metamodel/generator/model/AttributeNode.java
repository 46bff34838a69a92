package com.metamodel.generator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A class member or association end.
 *
 * After type normalization exactly one of {@code typeValue} (a canonical literal kind),
 * {@code type} (a target class) or neither (unresolved) holds.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class AttributeNode {

    @ToString.Include
    private String name;

    /** Literal type spelling, e.g. "String" before normalization, "str" after. */
    @ToString.Include
    private String typeValue;

    private ClassNode type;
    private String lowerValue;
    private String upperValue;
    private String defaultValue;
    private boolean derived;
    private AggregationKind aggregation;

    /** Owning class; null for an association-owned (non-navigable) end. */
    private ClassNode owner;
    private AssociationNode association;

    private final List<TagNode> tags;

    @Builder
    public AttributeNode(String name, String typeValue, ClassNode type, String lowerValue, String upperValue,
                         String defaultValue, boolean derived, AggregationKind aggregation, List<TagNode> tags) {
        this.name = name;
        this.typeValue = typeValue;
        this.type = type;
        this.lowerValue = lowerValue;
        this.upperValue = upperValue;
        this.defaultValue = defaultValue;
        this.derived = derived;
        this.aggregation = aggregation != null ? aggregation : AggregationKind.NONE;
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public AttributeNode tag(String definingFeature, String value) {
        tags.add(new TagNode(definingFeature, value));
        return this;
    }

    /**
     * First tag value for the given defining feature.
     */
    public Optional<String> getTagValue(String definingFeature) {
        return tags.stream()
                .filter(t -> t.getDefiningFeature().equals(definingFeature))
                .map(TagNode::getValue)
                .findFirst();
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    /**
     * The other end of this attribute's association, if it has one.
     */
    public Optional<AttributeNode> getOpposite() {
        if (association == null) {
            return Optional.empty();
        }
        return association.oppositeOf(this);
    }

    /**
     * "Owner.name", used as override key and in diagnostics.
     */
    public String getQualifiedName() {
        String ownerName = owner != null ? owner.getName() : "<association>";
        return ownerName + "." + (hasName() ? name : "<unnamed>");
    }
}
