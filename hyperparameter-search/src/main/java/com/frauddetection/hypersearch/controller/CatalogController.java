package com.frauddetection.hypersearch.controller;

import com.frauddetection.hypersearch.catalog.ParameterCatalog;
import com.frauddetection.hypersearch.controller.dto.CatalogResponse;
import com.frauddetection.hypersearch.domain.ModelFamily;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the parameter catalog.
 */
@RestController
@RequestMapping("/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final ParameterCatalog parameterCatalog;

    @GetMapping("/{modelFamily}")
    public ResponseEntity<CatalogResponse> getCatalog(@PathVariable String modelFamily) {
        ModelFamily family = ModelFamily.fromValue(modelFamily);

        return ResponseEntity.ok(CatalogResponse.builder()
                .modelFamily(family)
                .catalogVersion(ParameterCatalog.VERSION)
                .definitions(parameterCatalog.definitionsFor(family))
                .defaultRanges(parameterCatalog.defaultRanges(family))
                .build());
    }
}
