package com.customerhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Customer Hub Application
 *
 * Customer record management API built with Spring Boot WebFlux:
 * search, create, update, soft delete and bulk generation of customers.
 */
@SpringBootApplication
public class CustomerHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(CustomerHubApplication.class, args);
    }

}
