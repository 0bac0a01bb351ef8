package com.platform.scaffold.config;

import com.platform.scaffold.security.TokenStore;

/**
 * Feature decisions for the process lifetime. Resolved once from the environment
 * and never re-evaluated.
 */
public record FeatureFlags(boolean authEnabled, boolean persistenceEnabled) {
    
    public static final String DATABASE_URL = "DATABASE_URL";
    
    public static FeatureFlags resolve(EnvResolver env) {
        return new FeatureFlags(
            TokenStore.fromEnvironment(env).isConfigured(),
            !env.resolveString(DATABASE_URL).isEmpty()
        );
    }
    
    public boolean isEnabled(Feature feature) {
        return switch (feature) {
            case AUTH -> authEnabled;
            case PERSISTENCE -> persistenceEnabled;
        };
    }
}
