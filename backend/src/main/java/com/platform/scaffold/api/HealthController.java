package com.platform.scaffold.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint for load balancers and orchestrators.
 * Always answers while the process serves HTTP; it does not probe storage.
 */
@RestController
public class HealthController {
    
    private static final HealthResponse OK = new HealthResponse("ok");
    
    @GetMapping("/healthcheck")
    public HealthResponse healthcheck() {
        return OK;
    }
    
    public record HealthResponse(String status) {}
}
