package com.nextactiontracker.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC PostgreSQL connection.
 * The ConnectionFactory itself comes from Spring Boot auto-configuration.
 */
@Configuration
public class DatabaseConfig {

    static final String SCHEMA_SCRIPT = "db/schema.sql";

    /**
     * Initialize database schema on startup.
     * Executes db/schema.sql only when nat.database.initialize-schema is true.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory,
                                                    NextActionTrackerProperties properties) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource(SCHEMA_SCRIPT));
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(properties.getDatabase().isInitializeSchema());

        return initializer;
    }
}
