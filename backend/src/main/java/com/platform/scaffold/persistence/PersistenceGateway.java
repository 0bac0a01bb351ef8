package com.platform.scaffold.persistence;

import java.util.function.Supplier;

/**
 * Scoped access to storage.
 */
public interface PersistenceGateway {
    
    /**
     * Runs {@code work} inside one transaction. Commits when it returns, rolls back
     * when it throws; the session is released either way.
     *
     * @param operation short name used in logs and metrics
     * @throws com.platform.scaffold.error.ConfigurationException if no storage is configured
     */
    <T> T inSession(String operation, Supplier<T> work);
    
    /**
     * Verifies that the schema Hibernate maintains is reachable. Creates nothing;
     * safe to call any number of times.
     *
     * @throws com.platform.scaffold.error.ConfigurationException if the users table cannot be queried
     */
    void initializeSchema();
}
