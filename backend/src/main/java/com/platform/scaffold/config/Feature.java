package com.platform.scaffold.config;

/**
 * Optional capabilities that are composed in at startup.
 */
public enum Feature {
    
    /**
     * Bearer-token protected routes. Enabled when at least one token is configured.
     */
    AUTH,
    
    /**
     * Database-backed routes. Enabled when DATABASE_URL is set.
     */
    PERSISTENCE
}
