package com.customerhub.controller;

import com.customerhub.store.CustomerStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.mockito.Mockito.when;

/**
 * Integration tests for HealthController.
 */
@WebFluxTest(controllers = HealthController.class)
class HealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private CustomerStore customerStore;

    @Test
    void root_ReturnsServiceInfo() {
        webTestClient.get()
                .uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("Customer Hub")
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void health_StoreReachable_ReportsHealthy() {
        when(customerStore.ping()).thenReturn(Mono.just(true));

        webTestClient.get()
                .uri("/api/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.store").isEqualTo("connected")
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void health_StoreDown_ReportsDegraded() {
        when(customerStore.ping()).thenReturn(Mono.error(new DataAccessResourceFailureException("refused")));

        webTestClient.get()
                .uri("/api/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded")
                .jsonPath("$.store").isEqualTo("unreachable");
    }
}
