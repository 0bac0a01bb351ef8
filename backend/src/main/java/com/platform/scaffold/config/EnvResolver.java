package com.platform.scaffold.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.PropertyResolver;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Typed access to environment configuration.
 * 
 * Reads through a Spring {@link PropertyResolver}, so OS environment variables,
 * system properties and test property sources are all visible. Holds no state
 * of its own.
 */
@Slf4j
public class EnvResolver {
    
    private final PropertyResolver properties;
    
    public EnvResolver(PropertyResolver properties) {
        this.properties = properties;
    }
    
    /**
     * Only the literal {@code true} (any case) is truthy; "1", "yes" and "on" are false.
     * Unset or empty returns {@code defaultValue}.
     */
    public boolean resolveBool(String name, boolean defaultValue) {
        String value = properties.getProperty(name, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        return value.equalsIgnoreCase("true");
    }
    
    public boolean resolveBool(String name) {
        return resolveBool(name, false);
    }
    
    public String resolveString(String name, String defaultValue) {
        return properties.getProperty(name, defaultValue);
    }
    
    public String resolveString(String name) {
        return resolveString(name, "");
    }
    
    /**
     * Split on {@code separator}, trim each element and drop the empty ones.
     * Order and duplicates are preserved.
     */
    public List<String> resolveList(String name, String separator, List<String> defaultValue) {
        String value = properties.getProperty(name, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        return Arrays.stream(value.split(Pattern.quote(separator), -1))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }
    
    public List<String> resolveList(String name) {
        return resolveList(name, ",", List.of());
    }
    
    public int resolveInt(String name, int defaultValue) {
        String value = properties.getProperty(name, "").trim();
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for {}: '{}', using {}", name, value, defaultValue);
            return defaultValue;
        }
    }
    
    public boolean isSet(String name) {
        return !properties.getProperty(name, "").isEmpty();
    }
}
