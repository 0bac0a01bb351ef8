package com.platform.scaffold;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Service Scaffold Application
 * 
 * A minimal web-service scaffold exposing:
 * - Health check and example item endpoints (always on)
 * - Bearer-token protected endpoints (when API_KEYS is set)
 * - User CRUD endpoints backed by a relational database (when DATABASE_URL is set)
 * 
 * The DataSource is never auto-configured; it only exists when the persistence
 * feature is composed in (see {@link com.platform.scaffold.config.FeatureComposer}).
 */
@SpringBootApplication(exclude = {
    DataSourceAutoConfiguration.class
})
public class ScaffoldApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScaffoldApplication.class, args);
    }
}
