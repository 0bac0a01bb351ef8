package com.platform.scaffold.config;

import com.platform.scaffold.observability.MetricsRegistry;
import com.platform.scaffold.persistence.DatabaseUrl;
import com.platform.scaffold.persistence.JpaPersistenceGateway;
import com.platform.scaffold.persistence.PersistenceGateway;
import com.platform.scaffold.persistence.UnconfiguredPersistenceGateway;
import com.platform.scaffold.persistence.UserService;
import com.platform.scaffold.persistence.repository.UserJpaRepository;
import com.platform.scaffold.security.SecurityAuditLogger;
import com.platform.scaffold.security.TokenStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes the optional features once at startup.
 * 
 * Core routes are always present. The protected routes exist only when API_KEYS holds at
 * least one token, the user routes only when DATABASE_URL is set; both controllers carry
 * {@link ConditionalOnFeature}. The decision is never re-evaluated.
 */
@Slf4j
@Configuration
public class FeatureComposer {
    
    private final MetricsRegistry metricsRegistry;
    private final ObjectProvider<PersistenceGateway> persistenceGateway;
    
    public FeatureComposer(MetricsRegistry metricsRegistry, ObjectProvider<PersistenceGateway> persistenceGateway) {
        this.metricsRegistry = metricsRegistry;
        this.persistenceGateway = persistenceGateway;
    }
    
    @Bean
    public EnvResolver envResolver(Environment environment) {
        return new EnvResolver(environment);
    }
    
    @Bean
    public TokenStore tokenStore(EnvResolver env) {
        TokenStore store = TokenStore.fromEnvironment(env);
        log.info("Loaded {} bearer token(s)", store.size());
        return store;
    }
    
    @Bean
    public FeatureFlags featureFlags(EnvResolver env) {
        return FeatureFlags.resolve(env);
    }
    
    @Bean
    @ConditionalOnFeature(Feature.PERSISTENCE)
    public PersistenceGateway jpaPersistenceGateway(PlatformTransactionManager transactionManager,
                                                    DataSource dataSource,
                                                    DatabaseUrl databaseUrl) {
        return new JpaPersistenceGateway(transactionManager, dataSource, databaseUrl, metricsRegistry);
    }
    
    @Bean
    @ConditionalOnFeature(value = Feature.PERSISTENCE, enabled = false)
    public PersistenceGateway unconfiguredPersistenceGateway() {
        return new UnconfiguredPersistenceGateway();
    }
    
    @Bean
    @ConditionalOnFeature(Feature.PERSISTENCE)
    public UserService userService(PersistenceGateway gateway,
                                   UserJpaRepository repository,
                                   SecurityAuditLogger auditLogger) {
        return new UserService(gateway, repository, auditLogger);
    }
    
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        FeatureFlags flags = event.getApplicationContext().getBean(FeatureFlags.class);
        
        for (Feature feature : Feature.values()) {
            metricsRegistry.setFeatureEnabled(feature.name().toLowerCase(), flags.isEnabled(feature));
        }
        
        if (flags.persistenceEnabled()) {
            persistenceGateway.getObject().initializeSchema();
        }
        
        log.info("Route groups: {}", routeGroups(flags));
    }
    
    static List<String> routeGroups(FeatureFlags flags) {
        List<String> groups = new ArrayList<>(List.of("root", "health", "items"));
        if (flags.authEnabled()) {
            groups.add("protected");
        }
        if (flags.persistenceEnabled()) {
            groups.add("users");
        }
        return groups;
    }
}
