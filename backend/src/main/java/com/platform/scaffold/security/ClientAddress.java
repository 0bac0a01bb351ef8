package com.platform.scaffold.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client IP resolution, honouring the first X-Forwarded-For hop.
 */
public final class ClientAddress {
    
    private ClientAddress() {
    }
    
    public static String of(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
