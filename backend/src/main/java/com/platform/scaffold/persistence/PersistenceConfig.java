package com.platform.scaffold.persistence;

import com.platform.scaffold.config.ConditionalOnFeature;
import com.platform.scaffold.config.EnvResolver;
import com.platform.scaffold.config.Feature;
import com.platform.scaffold.config.FeatureFlags;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Relational storage, built only when DATABASE_URL is set.
 * 
 * JPA and the Spring Data repositories are wired by Spring Boot once this
 * DataSource exists.
 */
@Slf4j
@Configuration
@ConditionalOnFeature(Feature.PERSISTENCE)
public class PersistenceConfig {
    
    public static final String DATABASE_ECHO = "DATABASE_ECHO";
    public static final String DATABASE_POOL_SIZE = "DATABASE_POOL_SIZE";
    
    static final String SQLITE_DIALECT = "org.hibernate.community.dialect.SQLiteDialect";
    
    @Bean
    public DatabaseUrl databaseUrl(EnvResolver env) {
        DatabaseUrl url = DatabaseUrl.parse(env.resolveString(FeatureFlags.DATABASE_URL));
        log.info("Persistence enabled: system={}, url={}", url.system(), url.jdbcUrl());
        return url;
    }
    
    @Bean(destroyMethod = "close")
    public DataSource dataSource(DatabaseUrl url, EnvResolver env) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("scaffold-pool");
        config.setJdbcUrl(url.jdbcUrl());
        if (url.username() != null) {
            config.setUsername(url.username());
        }
        if (url.password() != null) {
            config.setPassword(url.password());
        }
        config.setConnectionTimeout(5000);
        if (url.isSqlite()) {
            // SQLite allows one writer, and an in-memory database lives only as long as its connection
            config.setMaximumPoolSize(1);
            config.setMaxLifetime(0);
        } else {
            config.setMaximumPoolSize(env.resolveInt(DATABASE_POOL_SIZE, 10));
        }
        return new HikariDataSource(config);
    }
    
    @Bean
    public HibernatePropertiesCustomizer hibernatePropertiesCustomizer(DatabaseUrl url, EnvResolver env) {
        boolean echo = env.resolveBool(DATABASE_ECHO);
        return properties -> {
            properties.put("hibernate.show_sql", echo);
            properties.put("hibernate.format_sql", echo);
            if (url.isSqlite()) {
                properties.put("hibernate.dialect", SQLITE_DIALECT);
            }
        };
    }
}
