package com.example.backendtemplate.controller;

import com.example.backendtemplate.dto.HealthResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Load balancer liveness probe. Detailed health is served by actuator.
 */
@RestController
@Tag(name = "Health")
public class HealthController {

    static final String SERVICE_NAME = "backend-template";

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Returns healthy while the process serves requests")
    public HealthResponse health() {
        return HealthResponse.builder().status("healthy").service(SERVICE_NAME).build();
    }
}
