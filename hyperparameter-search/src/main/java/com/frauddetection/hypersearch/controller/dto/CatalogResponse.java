package com.frauddetection.hypersearch.controller.dto;

import com.frauddetection.hypersearch.domain.ModelFamily;
import com.frauddetection.hypersearch.domain.ParameterDefinition;
import com.frauddetection.hypersearch.domain.ParameterRange;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogResponse {

    private ModelFamily modelFamily;
    private int catalogVersion;
    private List<ParameterDefinition> definitions;
    private Map<String, ParameterRange> defaultRanges;
}
