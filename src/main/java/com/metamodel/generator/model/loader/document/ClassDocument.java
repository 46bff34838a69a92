package com.metamodel.generator.model.loader.document;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassDocument {
    private String id;
    private String name;
    private String owningPackage;
    private List<String> stereotypes = new ArrayList<>();
    private List<String> generalizations = new ArrayList<>();   // ids of general classes
    private List<AttributeDocument> attributes = new ArrayList<>();
    private List<String> operations = new ArrayList<>();
}
