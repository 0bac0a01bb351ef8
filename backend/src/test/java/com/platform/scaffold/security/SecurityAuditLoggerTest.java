package com.platform.scaffold.security;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecurityAuditLoggerTest {

    private final SecurityAuditLogger auditLogger = new SecurityAuditLogger();
    private final Logger logger = (Logger) LoggerFactory.getLogger(SecurityAuditLogger.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    @BeforeEach
    void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        appender.stop();
    }

    @Test
    void authenticationLineCarriesTheMethod() {
        auditLogger.logAuthentication("abcd***", "10.0.0.1", false, "bearer", "Invalid API key");

        List<ILoggingEvent> events = appender.list;
        assertEquals(1, events.size());
        ILoggingEvent event = events.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("AUTH_FAILURE"));
        assertTrue(event.getFormattedMessage().contains("method=bearer"));
        assertEquals("bearer", event.getMDCPropertyMap().get("auditMethod"));
        assertEquals("10.0.0.1", event.getMDCPropertyMap().get("auditClientIp"));
    }

    @Test
    void auditKeysAreClearedAfterLogging() {
        auditLogger.logAuthentication("abcd***", "10.0.0.1", true, "bearer", "Authenticated");
        auditLogger.logUserCreate("7", "alice", true, null);

        assertNull(MDC.get("auditMethod"));
        assertNull(MDC.get("auditEventType"));
        assertNull(MDC.get("auditPrincipal"));

        ILoggingEvent created = appender.list.get(1);
        assertEquals(Level.INFO, created.getLevel());
        assertTrue(created.getFormattedMessage().contains("resource=User/7"));
        assertFalse(created.getFormattedMessage().contains("method="));
        assertFalse(created.getMDCPropertyMap().containsKey("auditMethod"));
    }
}
