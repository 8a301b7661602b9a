package com.frauddetection.hypersearch.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * User-editable override of a parameter's search range.
 * Only enabled parameters are sampled; disabled ones are left to the training service's default.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParameterRange {

    @Builder.Default
    private boolean enabled = true;

    private Double min;
    private Double max;
    private Double step;

    @Builder.Default
    private List<Object> allowedValues = new ArrayList<>();

    /**
     * Default range for a definition: enabled, carrying the definition's own bounds.
     */
    public static ParameterRange from(ParameterDefinition definition) {
        return ParameterRange.builder()
                .enabled(true)
                .min(definition.getMin())
                .max(definition.getMax())
                .step(definition.getStep())
                .allowedValues(new ArrayList<>(definition.getAllowedValues()))
                .build();
    }
}
