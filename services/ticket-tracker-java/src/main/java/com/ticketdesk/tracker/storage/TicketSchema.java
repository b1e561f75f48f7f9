/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/storage/TicketSchema.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Idempotent creation of the tickets and comments tables.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.storage;

import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

import io.r2dbc.spi.ConnectionFactory;
import reactor.core.publisher.Mono;

/**
 * Storage schema for the tracker. The DDL lives in {@value #LOCATION} and uses
 * {@code IF NOT EXISTS} throughout, so it runs on every start against an existing
 * store without touching its data.
 */
public final class TicketSchema {

    public static final String LOCATION = "db/schema.sql";

    private TicketSchema() {
    }

    public static ResourceDatabasePopulator populator() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(LOCATION));
        populator.setContinueOnError(false);
        return populator;
    }

    public static Mono<Void> initialize(ConnectionFactory connectionFactory) {
        return populator().populate(connectionFactory)
            .onErrorMap(StorageErrors::translate);
    }
}
