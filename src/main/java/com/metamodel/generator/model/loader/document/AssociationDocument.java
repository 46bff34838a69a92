package com.metamodel.generator.model.loader.document;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssociationDocument {
    private String id;
    private boolean extension;
    private List<String> memberEnds = new ArrayList<>();
    /** Ends owned by the association itself rather than by a class. */
    private List<AttributeDocument> ownedEnds = new ArrayList<>();
}
