package com.platform.scaffold.persistence;

import com.platform.scaffold.error.ConfigurationException;

import java.util.function.Supplier;

/**
 * Stands in when DATABASE_URL is not set. Every storage request fails loudly.
 */
public class UnconfiguredPersistenceGateway implements PersistenceGateway {
    
    @Override
    public <T> T inSession(String operation, Supplier<T> work) {
        throw ConfigurationException.databaseNotConfigured();
    }
    
    @Override
    public void initializeSchema() {
        throw ConfigurationException.databaseNotConfigured();
    }
}
