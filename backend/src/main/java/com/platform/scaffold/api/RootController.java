package com.platform.scaffold.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Service root.
 */
@RestController
public class RootController {
    
    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("Hello", "World");
    }
}
