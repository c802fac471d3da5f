package com.customerhub.config;

import com.customerhub.repository.CustomerRepository;
import com.customerhub.store.CustomerStore;
import com.customerhub.store.R2dbcCustomerStore;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;

/**
 * Database configuration for the reactive PostgreSQL store.
 * Active unless {@code customerhub.store.type} selects another store.
 */
@Slf4j
@Configuration
@EnableR2dbcRepositories(basePackageClasses = CustomerRepository.class)
@ConditionalOnProperty(prefix = "customerhub.store", name = "type", havingValue = "r2dbc", matchIfMissing = true)
public class DatabaseConfig {

    /**
     * Create the schema on startup, and optionally load the sample customers.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory,
                                                    @Value("${customerhub.db.initialize:true}") boolean initialize,
                                                    @Value("${customerhub.db.seed:true}") boolean seed) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("db/schema.sql"));
        if (seed) {
            populator.addScript(new ClassPathResource("db/data.sql"));
        }
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(initialize);

        return initializer;
    }

    @Bean
    public CustomerStore customerStore(R2dbcEntityTemplate template,
                                       CustomerRepository customerRepository,
                                       DatabaseClient databaseClient) {
        log.info("Using PostgreSQL customer store");
        return new R2dbcCustomerStore(template, customerRepository, databaseClient);
    }
}
