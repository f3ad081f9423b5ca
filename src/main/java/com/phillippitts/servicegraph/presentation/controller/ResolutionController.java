package com.phillippitts.servicegraph.presentation.controller;

import com.phillippitts.servicegraph.domain.ResolutionReport;
import com.phillippitts.servicegraph.domain.ServiceInstance;
import com.phillippitts.servicegraph.domain.UnitDirectives;
import com.phillippitts.servicegraph.service.ResolutionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Resolution reports for the configured service set or a posted one, plus per-service unit
 * directives. A report with fatal issues is still a successful response; callers inspect
 * {@code fatal}.
 */
@RestController
@RequestMapping("/api")
class ResolutionController {

    private static final Logger LOG = LogManager.getLogger(ResolutionController.class);

    private final ResolutionService resolutionService;

    ResolutionController(ResolutionService resolutionService) {
        this.resolutionService = resolutionService;
    }

    @GetMapping("/resolution")
    ResponseEntity<ResolutionReport> configured() {
        return ResponseEntity.ok(resolutionService.resolveConfigured());
    }

    @PostMapping("/resolution")
    ResponseEntity<ResolutionReport> resolve(@RequestBody ResolutionRequest request) {
        LOG.info("Resolving {} posted services", request.services().size());
        return ResponseEntity.ok(resolutionService.resolve(request.services()));
    }

    @GetMapping("/units/{service}")
    ResponseEntity<UnitDirectives> units(@PathVariable String service) {
        return ResponseEntity.ok(resolutionService.directivesFor(service));
    }

    /**
     * Request body for {@code POST /api/resolution}.
     */
    record ResolutionRequest(List<ServiceInstance> services) {

        ResolutionRequest {
            services = services == null ? List.of() : List.copyOf(services);
        }
    }
}
