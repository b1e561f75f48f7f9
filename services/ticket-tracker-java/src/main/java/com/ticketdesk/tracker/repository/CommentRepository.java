/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/repository/CommentRepository.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Append-only comment log scoped to a ticket.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.repository;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.ticketdesk.tracker.domain.Comment;
import com.ticketdesk.tracker.storage.Binding;
import com.ticketdesk.tracker.storage.StorageErrors;
import com.ticketdesk.tracker.storage.TicketTimestamps;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for ticket comments. Appending does not check that the ticket
 * exists; the foreign key rejects the insert and the failure surfaces as a
 * {@link com.ticketdesk.tracker.exception.TicketConstraintViolationException}.
 * Appending never touches the ticket's {@code updated_at}.
 */
@Repository
public class CommentRepository {

    private static final Logger log = LoggerFactory.getLogger(CommentRepository.class);

    private final DatabaseClient databaseClient;
    private final Clock clock;

    public CommentRepository(DatabaseClient databaseClient, Clock clock) {
        this.databaseClient = databaseClient;
        this.clock = clock;
    }

    public Mono<Long> append(Long ticketId, String author, String body) {
        String now = TicketTimestamps.now(clock);
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("""
                INSERT INTO comments (ticket_id, author, body, created_at)
                VALUES (:ticketId, :author, :body, :createdAt)
                """)
            .bind("ticketId", ticketId)
            .bind("body", body)
            .bind("createdAt", now);

        return Binding.bindText(spec, "author", author)
            .filter(statement -> statement.returnGeneratedValues("id"))
            .map((row, metadata) -> row.get(0, Long.class))
            .one()
            .doOnNext(id -> log.debug("Appended comment {} to ticket {}", id, ticketId))
            .onErrorMap(StorageErrors::translate);
    }

    /**
     * Comments of one ticket in insertion order. Ids grow with insertion time, so
     * ordering by id is ordering by creation.
     */
    public Flux<Comment> listFor(Long ticketId) {
        return databaseClient.sql("""
                SELECT id, ticket_id, author, body, created_at
                FROM comments
                WHERE ticket_id = :ticketId
                ORDER BY id ASC
                """)
            .bind("ticketId", ticketId)
            .map((row, metadata) -> new Comment(
                row.get("id", Long.class),
                row.get("ticket_id", Long.class),
                row.get("author", String.class),
                row.get("body", String.class),
                row.get("created_at", String.class)))
            .all()
            .onErrorMap(StorageErrors::translate);
    }
}
