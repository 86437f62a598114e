package com.hinata.backend.support;

import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests.
 * The container starts once per JVM; Flyway builds and seeds the schema when the first context starts.
 */
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final Object CONTAINER_LOCK = new Object();
    private static PostgreSQLContainer<?> postgres;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        PostgreSQLContainer<?> container = startedContainer();
        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
    }

    private static PostgreSQLContainer<?> startedContainer() {
        synchronized (CONTAINER_LOCK) {
            if (postgres == null) {
                postgres = new PostgreSQLContainer<>("postgres:16.4")
                        .withDatabaseName("hinata_test")
                        .withUsername("hinata")
                        .withPassword("hinata");
                postgres.start();
            }
            return postgres;
        }
    }
}
