package com.platform.scaffold.security;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Security audit logger for authentication outcomes and user mutations.
 * 
 * Credentials are only ever logged as a preview.
 */
@Slf4j
@Component
public class SecurityAuditLogger {
    
    private static final String AUDIT_PREFIX = "[AUDIT]";
    
    /**
     * Log authentication event.
     */
    public void logAuthentication(String credentialPreview, String clientIp, 
            boolean success, String method, String detail) {
        
        AuditEvent event = AuditEvent.builder()
            .eventType(success ? AuditEventType.AUTH_SUCCESS : AuditEventType.AUTH_FAILURE)
            .action("AUTHENTICATE")
            .resourceType("BearerToken")
            .principal(credentialPreview)
            .clientIp(clientIp)
            .success(success)
            .detail(detail)
            .metadata(Map.of("method", method))
            .build();
        
        logAuditEvent(event);
    }
    
    /**
     * Log user creation.
     */
    public void logUserCreate(String userId, String username, boolean success, String detail) {
        AuditEvent event = AuditEvent.builder()
            .eventType(AuditEventType.USER_CREATE)
            .action("CREATE")
            .resourceType("User")
            .resourceId(userId)
            .success(success)
            .detail(detail != null ? detail : "Created user: " + username)
            .build();
        
        logAuditEvent(event);
    }
    
    private void logAuditEvent(AuditEvent event) {
        Map<String, Object> metadata = event.metadata() != null ? event.metadata() : Map.of();
        
        // Set MDC for structured logging
        List<String> mdcKeys = new ArrayList<>();
        putMdc(mdcKeys, "auditEventType", event.eventType().name());
        putMdc(mdcKeys, "auditAction", event.action());
        putMdc(mdcKeys, "auditResourceType", event.resourceType());
        putMdc(mdcKeys, "auditResourceId", event.resourceId());
        putMdc(mdcKeys, "auditPrincipal", event.principal());
        putMdc(mdcKeys, "auditClientIp", event.clientIp());
        putMdc(mdcKeys, "auditSuccess", String.valueOf(event.success()));
        metadata.forEach((key, value) -> putMdc(mdcKeys, "audit" + capitalize(key), String.valueOf(value)));
        
        try {
            StringBuilder extra = new StringBuilder();
            new TreeMap<>(metadata).forEach((key, value) -> extra.append(' ').append(key).append('=').append(value));
            
            String logMessage = String.format(
                "%s %s %s %s resource=%s/%s principal=%s ip=%s success=%s%s detail=\"%s\"",
                AUDIT_PREFIX,
                event.eventType(),
                event.action(),
                event.timestamp(),
                event.resourceType(),
                event.resourceId() != null ? event.resourceId() : "-",
                event.principal() != null ? event.principal() : "anonymous",
                event.clientIp() != null ? event.clientIp() : "-",
                event.success(),
                extra,
                event.detail() != null ? event.detail() : ""
            );
            
            if (event.success()) {
                log.info(logMessage);
            } else {
                log.warn(logMessage);
            }
        } finally {
            mdcKeys.forEach(MDC::remove);
        }
    }
    
    private static void putMdc(List<String> keys, String key, String value) {
        if (value != null) {
            MDC.put(key, value);
            keys.add(key);
        }
    }
    
    private static String capitalize(String key) {
        return key.isEmpty() ? key : Character.toUpperCase(key.charAt(0)) + key.substring(1);
    }
    
    public enum AuditEventType {
        AUTH_SUCCESS,
        AUTH_FAILURE,
        USER_CREATE
    }
    
    @lombok.Builder
    public record AuditEvent(
        AuditEventType eventType,
        String action,
        String resourceType,
        String resourceId,
        String principal,
        String clientIp,
        boolean success,
        String detail,
        Map<String, Object> metadata,
        Instant timestamp
    ) {
        public AuditEvent {
            if (timestamp == null) {
                timestamp = Instant.now();
            }
        }
    }
}
