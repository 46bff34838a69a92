package com.metamodel.generator.model.loader.document;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AttributeDocument {
    private String id;
    private String name;
    private String typeValue;
    private String type;            // id of the target class
    private String lower;
    private String upper;
    private String defaultValue;
    private boolean derived;
    private String aggregation;
    private Map<String, String> tags = new LinkedHashMap<>();
}
