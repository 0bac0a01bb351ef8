package com.platform.scaffold.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.scaffold.config.ConditionalOnFeature;
import com.platform.scaffold.config.Feature;
import com.platform.scaffold.security.BearerCredential;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Routes that require a bearer token. Only registered when API_KEYS is set.
 */
@RestController
@RequestMapping("/v1/protected")
@ConditionalOnFeature(Feature.AUTH)
@SecurityRequirement(name = "bearerAuth")
public class ProtectedController {
    
    private static final List<String> SAMPLE_DATA = List.of("item1", "item2", "item3");
    
    @GetMapping({"", "/"})
    public AccessResponse protectedRoute(@Parameter(hidden = true) BearerCredential credential) {
        return new AccessResponse("Access granted", "true");
    }
    
    @GetMapping("/data")
    public ProtectedDataResponse protectedData(@Parameter(hidden = true) BearerCredential credential) {
        return new ProtectedDataResponse("This is protected data", SAMPLE_DATA, credential.preview());
    }
    
    public record AccessResponse(String message, String authenticated) {}
    
    public record ProtectedDataResponse(
        String message,
        List<String> data,
        @JsonProperty("token_preview") String tokenPreview
    ) {}
}
