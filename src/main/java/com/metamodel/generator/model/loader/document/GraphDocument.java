package com.metamodel.generator.model.loader.document;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * On-disk shape of an element graph file.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphDocument {
    private List<PackageDocument> packages = new ArrayList<>();
    private List<ClassDocument> classes = new ArrayList<>();
    private List<AssociationDocument> associations = new ArrayList<>();
}
