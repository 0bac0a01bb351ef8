package com.platform.scaffold.persistence;

import com.platform.scaffold.error.ConfigurationException;
import com.platform.scaffold.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.function.Supplier;

/**
 * Transactional gateway over the JPA transaction manager.
 */
@Slf4j
public class JpaPersistenceGateway implements PersistenceGateway {
    
    private final TransactionTemplate transactionTemplate;
    private final JdbcTemplate jdbcTemplate;
    private final DatabaseUrl databaseUrl;
    private final MetricsRegistry metricsRegistry;
    
    public JpaPersistenceGateway(PlatformTransactionManager transactionManager,
                                 DataSource dataSource,
                                 DatabaseUrl databaseUrl,
                                 MetricsRegistry metricsRegistry) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.databaseUrl = databaseUrl;
        this.metricsRegistry = metricsRegistry;
    }
    
    @Override
    public <T> T inSession(String operation, Supplier<T> work) {
        long start = System.currentTimeMillis();
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (RuntimeException e) {
            log.debug("Session for {} rolled back: {}", operation, e.getMessage());
            metricsRegistry.incrementCounter("scaffold.persistence.rollbacks", "operation", operation);
            throw e;
        } finally {
            metricsRegistry.recordLatency(databaseUrl.system(), operation, System.currentTimeMillis() - start);
        }
    }
    
    @Override
    public void initializeSchema() {
        // Tables come from hibernate ddl-auto=update; this verifies they are reachable
        try {
            Long users = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM users", Long.class);
            log.info("Schema ready on {} ({} users)", databaseUrl.system(), users);
        } catch (DataAccessException e) {
            throw new ConfigurationException("Database schema is not available: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
