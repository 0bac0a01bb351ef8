package com.platform.scaffold.error;

/**
 * Server-side misconfiguration. The operator has to fix the environment;
 * always surfaced as HTTP 500.
 */
public class ConfigurationException extends ScaffoldException {
    
    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
    
    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
    
    protected ConfigurationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public static ConfigurationException databaseNotConfigured() {
        return new ConfigurationException(
            "Database not configured. Set DATABASE_URL environment variable.");
    }
}
