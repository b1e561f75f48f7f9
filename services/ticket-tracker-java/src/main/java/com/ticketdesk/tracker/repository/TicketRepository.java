/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/repository/TicketRepository.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Create, fetch and partially update tickets over DatabaseClient.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.repository;

import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.stereotype.Repository;

import com.ticketdesk.tracker.domain.NewTicket;
import com.ticketdesk.tracker.domain.Ticket;
import com.ticketdesk.tracker.domain.TicketField;
import com.ticketdesk.tracker.domain.TicketPatch;
import com.ticketdesk.tracker.domain.TicketPriority;
import com.ticketdesk.tracker.domain.TicketStatus;
import com.ticketdesk.tracker.storage.Binding;
import com.ticketdesk.tracker.storage.StorageErrors;
import com.ticketdesk.tracker.storage.TicketTimestamps;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Mono;

/**
 * Reactive persistence gateway for the {@code tickets} table.
 *
 * <p>The repository trusts its caller for field validation (non-blank title); the
 * application service enforces that before delegating here. It owns the audit
 * timestamps: both are set on insert and {@code updated_at} is refreshed on every
 * update that writes at least one field.</p>
 */
@Repository
public class TicketRepository {

    private static final Logger log = LoggerFactory.getLogger(TicketRepository.class);

    static final String COLUMNS =
        "id, title, description, status, priority, requester, assignee, tags, created_at, updated_at";

    private static final String INSERT = """
        INSERT INTO tickets (title, description, status, priority, requester, assignee, tags, created_at, updated_at)
        VALUES (:title, :description, :status, :priority, :requester, :assignee, :tags, :createdAt, :updatedAt)
        """;

    private final DatabaseClient databaseClient;
    private final Clock clock;

    public TicketRepository(DatabaseClient databaseClient, Clock clock) {
        this.databaseClient = databaseClient;
        this.clock = clock;
    }

    /**
     * Inserts the candidate and emits the id assigned by the store.
     */
    public Mono<Long> create(NewTicket candidate) {
        String now = TicketTimestamps.now(clock);
        GenericExecuteSpec spec = databaseClient.sql(INSERT)
            .bind("title", candidate.title())
            .bind("status", candidate.status().value())
            .bind("priority", candidate.priority().value())
            .bind("createdAt", now)
            .bind("updatedAt", now);
        spec = Binding.bindText(spec, "description", candidate.description());
        spec = Binding.bindText(spec, "requester", candidate.requester());
        spec = Binding.bindText(spec, "assignee", candidate.assignee());
        spec = Binding.bindText(spec, "tags", candidate.tags());

        return spec.filter(statement -> statement.returnGeneratedValues("id"))
            .map((row, metadata) -> row.get(0, Long.class))
            .one()
            .doOnNext(id -> log.debug("Inserted ticket {} at {}", id, now))
            .onErrorMap(StorageErrors::translate);
    }

    /**
     * Emits the ticket, or completes empty when no row has that id.
     */
    public Mono<Ticket> findById(Long id) {
        return databaseClient.sql("SELECT " + COLUMNS + " FROM tickets WHERE id = :id")
            .bind("id", id)
            .map((row, metadata) -> toTicket(row))
            .one()
            .onErrorMap(StorageErrors::translate);
    }

    /**
     * Writes only the fields present in {@code patch} and stamps {@code updated_at}.
     * An empty patch issues no statement. Emits whether a row was affected.
     */
    public Mono<Boolean> update(Long id, TicketPatch patch) {
        if (patch.isEmpty()) {
            return Mono.just(false);
        }
        String now = TicketTimestamps.now(clock);
        StringBuilder sql = new StringBuilder("UPDATE tickets SET ");
        for (TicketField field : patch.assignments().keySet()) {
            sql.append(field.column()).append(" = :").append(field.column()).append(", ");
        }
        sql.append("updated_at = :updatedAt WHERE id = :id");

        GenericExecuteSpec spec = databaseClient.sql(sql.toString());
        for (Map.Entry<TicketField, String> assignment : patch.assignments().entrySet()) {
            spec = Binding.bindText(spec, assignment.getKey().column(), assignment.getValue());
        }
        return spec.bind("updatedAt", now)
            .bind("id", id)
            .fetch()
            .rowsUpdated()
            .map(rows -> rows > 0)
            .onErrorMap(StorageErrors::translate);
    }

    public Mono<Long> count() {
        return databaseClient.sql("SELECT COUNT(*) FROM tickets")
            .map((row, metadata) -> row.get(0, Long.class))
            .one()
            .onErrorMap(StorageErrors::translate);
    }

    static Ticket toTicket(Row row) {
        return new Ticket(
            row.get("id", Long.class),
            row.get("title", String.class),
            row.get("description", String.class),
            TicketStatus.fromValue(row.get("status", String.class)),
            TicketPriority.fromValue(row.get("priority", String.class)),
            row.get("requester", String.class),
            row.get("assignee", String.class),
            row.get("tags", String.class),
            row.get("created_at", String.class),
            row.get("updated_at", String.class)
        );
    }
}
