package com.customerhub.config;

import com.customerhub.store.CustomerStore;
import com.customerhub.store.InMemoryCustomerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the map-backed store when {@code customerhub.store.type=memory}.
 * Data does not survive a restart.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "customerhub.store", name = "type", havingValue = "memory")
public class InMemoryStoreConfig {

    @Bean
    public CustomerStore customerStore() {
        log.warn("Using in-memory customer store; data is lost on shutdown");
        return new InMemoryCustomerStore();
    }
}
