/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/config/StorageConfig.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Schema initialization and startup probe for the ticket store.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;

import com.ticketdesk.tracker.repository.TicketRepository;
import com.ticketdesk.tracker.storage.TicketSchema;

import io.r2dbc.spi.ConnectionFactory;

/**
 * Wires the store. The schema is applied while the context starts, before the
 * web server accepts requests. The {@link ConnectionFactory} is Spring Boot's
 * pooled factory, shared by every repository through {@code DatabaseClient}.
 */
@Configuration
public class StorageConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public ConnectionFactoryInitializer ticketSchemaInitializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(TicketSchema.populator());
        return initializer;
    }

    /**
     * Logs the existing ticket count so operators can see the store is reachable
     * before any traffic hits the service.
     */
    @Bean
    public ApplicationRunner storageProbe(TicketRepository repository, TrackerProperties properties) {
        return args -> {
            if (!properties.isStartupProbe()) {
                return;
            }
            repository.count()
                .subscribe(
                    count -> log.info("Ticket tracker started. Existing ticket count: {}", count),
                    error -> log.error("Ticket store probe failed: {}", error.getMessage(), error));
        };
    }
}
