package com.customerhub.controller;

import com.customerhub.store.CustomerStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Health check endpoints.
 */
@Slf4j
@RestController
@RequestMapping
@RequiredArgsConstructor
public class HealthController {

    private static final String VERSION = "1.0.0";

    private final CustomerStore customerStore;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", "Customer Hub",
            "version", VERSION
        ));
    }

    @GetMapping("/api/health")
    public Mono<Map<String, String>> health() {
        return customerStore.ping()
                .doOnError(error -> log.warn("Store health probe failed: {}", error.getMessage()))
                .onErrorReturn(false)
                .map(up -> Map.of(
                    "status", up ? "healthy" : "degraded",
                    "store", up ? "connected" : "unreachable",
                    "version", VERSION
                ));
    }
}
