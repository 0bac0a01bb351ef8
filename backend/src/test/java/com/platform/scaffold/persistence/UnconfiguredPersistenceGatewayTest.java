package com.platform.scaffold.persistence;

import com.platform.scaffold.error.ConfigurationException;
import com.platform.scaffold.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class UnconfiguredPersistenceGatewayTest {

    private final UnconfiguredPersistenceGateway gateway = new UnconfiguredPersistenceGateway();

    @Test
    void sessionRequestFailsWithoutRunningWork() {
        AtomicBoolean ran = new AtomicBoolean();

        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> gateway.inSession("test", () -> ran.getAndSet(true)));

        assertFalse(ran.get());
        assertEquals(ErrorCode.CONFIGURATION_ERROR, ex.getErrorCode());
        assertEquals("Database not configured. Set DATABASE_URL environment variable.", ex.getMessage());
    }

    @Test
    void schemaInitializationFails() {
        assertThrows(ConfigurationException.class, gateway::initializeSchema);
    }
}
