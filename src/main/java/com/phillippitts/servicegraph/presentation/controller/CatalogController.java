package com.phillippitts.servicegraph.presentation.controller;

import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.service.ResolutionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the effective service catalog.
 */
@RestController
@RequestMapping("/api/catalog")
class CatalogController {

    private final ResolutionService resolutionService;

    CatalogController(ResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    @GetMapping
    ResponseEntity<List<ServiceDescriptor>> catalog() {
        return ResponseEntity.ok(resolutionService.catalog());
    }

    /**
     * Suggests the services to enable alongside {@code service} so every hard requirement is met.
     */
    @GetMapping("/closure")
    ResponseEntity<Map<String, List<String>>> closure(@RequestParam("service") List<String> services) {
        return ResponseEntity.ok(Map.of(
                "requested", services,
                "closure", resolutionService.closure(services)
        ));
    }
}
