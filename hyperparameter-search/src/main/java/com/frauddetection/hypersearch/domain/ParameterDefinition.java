package com.frauddetection.hypersearch.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable catalog entry describing one tunable parameter of a model family.
 * Bounds and step apply to INT and FLOAT; allowedValues applies to CATEGORICAL.
 */
@Value
@Builder
public class ParameterDefinition {

    String name;
    String displayName;
    ParameterType type;
    Double min;
    Double max;
    Double step;

    @Builder.Default
    List<Object> allowedValues = List.of();

    Sensitivity sensitivity;
    String description;

    public boolean isNumeric() {
        return type == ParameterType.INT || type == ParameterType.FLOAT;
    }
}
