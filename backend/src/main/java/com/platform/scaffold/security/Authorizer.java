package com.platform.scaffold.security;

import com.platform.scaffold.error.AuthenticationNotConfiguredException;
import com.platform.scaffold.error.InvalidCredentialException;
import com.platform.scaffold.error.MissingCredentialException;
import com.platform.scaffold.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Validates an inbound bearer credential against the {@link TokenStore}.
 * 
 * Decision order:
 * 1. No tokens configured  → {@link AuthenticationNotConfiguredException} (500)
 * 2. No credential         → {@link MissingCredentialException} (401)
 * 3. Unknown credential    → {@link InvalidCredentialException} (403)
 * 4. Otherwise the credential is returned
 */
@Slf4j
@Component
public class Authorizer {
    
    static final String METHOD = "bearer";
    
    private final TokenStore tokenStore;
    private final SecurityAuditLogger auditLogger;
    private final MetricsRegistry metricsRegistry;
    
    public Authorizer(TokenStore tokenStore, SecurityAuditLogger auditLogger, MetricsRegistry metricsRegistry) {
        this.tokenStore = tokenStore;
        this.auditLogger = auditLogger;
        this.metricsRegistry = metricsRegistry;
    }
    
    public BearerCredential authorize(Optional<String> token) {
        return authorize(token, null);
    }
    
    public BearerCredential authorize(Optional<String> token, String clientIp) {
        if (!tokenStore.isConfigured()) {
            record("not_configured");
            auditLogger.logAuthentication(null, clientIp, false, METHOD, "authentication not configured");
            throw new AuthenticationNotConfiguredException();
        }
        
        if (token.isEmpty()) {
            record("missing");
            auditLogger.logAuthentication(null, clientIp, false, METHOD, "missing bearer token");
            throw new MissingCredentialException();
        }
        
        BearerCredential credential = new BearerCredential(token.get());
        if (!tokenStore.contains(credential.token())) {
            record("invalid");
            auditLogger.logAuthentication(credential.preview(), clientIp, false, METHOD, "invalid bearer token");
            throw new InvalidCredentialException();
        }
        
        record("granted");
        auditLogger.logAuthentication(credential.preview(), clientIp, true, METHOD, "access granted");
        return credential;
    }
    
    private void record(String outcome) {
        metricsRegistry.incrementCounter("scaffold.auth.attempts", "outcome", outcome);
        log.debug("Bearer authorization outcome: {}", outcome);
    }
}
