package com.cleancity.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * CleanCity report lifecycle API.
 *
 * Java 17 + Spring Boot 3.4.x
 */
@SpringBootApplication(scanBasePackages = "com.cleancity")
@EntityScan(basePackages = "com.cleancity.core.domain")
@EnableJpaRepositories(basePackages = "com.cleancity.core.repository")
public class CleanCityApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CleanCityApiApplication.class, args);
    }
}
