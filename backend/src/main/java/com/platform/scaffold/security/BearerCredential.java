package com.platform.scaffold.security;

/**
 * A validated bearer token, alive for a single request.
 */
public record BearerCredential(String token) {
    
    private static final int PREVIEW_LENGTH = 8;
    
    /**
     * First eight characters followed by "...", safe for logs and responses.
     */
    public String preview() {
        return token.substring(0, Math.min(PREVIEW_LENGTH, token.length())) + "...";
    }
    
    @Override
    public String toString() {
        return "BearerCredential[" + preview() + "]";
    }
}
