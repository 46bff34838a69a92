package com.metamodel.generator.model.loader.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PackageDocument {
    private String id;
    private String name;
    private boolean profile;
    private String owningPackage;
}
