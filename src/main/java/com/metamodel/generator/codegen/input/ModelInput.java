package com.metamodel.generator.codegen.input;

import java.util.List;

import com.metamodel.generator.codegen.override.OverrideTable;
import com.metamodel.generator.codegen.supermodel.SupermodelRef;
import com.metamodel.generator.model.ElementGraph;

import lombok.NonNull;
import lombok.Value;

/**
 * Everything a generation run reads: the model, its supermodels and the overrides.
 */
@Value
public class ModelInput {

    @NonNull
    ElementGraph model;

    @NonNull
    List<SupermodelRef> supermodels;

    @NonNull
    OverrideTable overrides;
}
