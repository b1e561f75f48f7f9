/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/service/TicketService.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Facade exposing the tracker operations to the presentation shell.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.ticketdesk.tracker.domain.Comment;
import com.ticketdesk.tracker.domain.NewTicket;
import com.ticketdesk.tracker.domain.Ticket;
import com.ticketdesk.tracker.domain.TicketField;
import com.ticketdesk.tracker.domain.TicketFilter;
import com.ticketdesk.tracker.domain.TicketPatch;
import com.ticketdesk.tracker.domain.TicketSummary;
import com.ticketdesk.tracker.exception.TicketValidationException;
import com.ticketdesk.tracker.export.TicketCsvExporter;
import com.ticketdesk.tracker.query.TicketQueryEngine;
import com.ticketdesk.tracker.repository.CommentRepository;
import com.ticketdesk.tracker.repository.TicketRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Application service in front of the ticket store.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Validate required text (ticket title, comment body) before any write</li>
 *   <li>Run each write as its own transaction</li>
 *   <li>Route free-text search and filtered listings to {@link TicketQueryEngine}</li>
 * </ul>
 * A missing ticket is reported as an empty {@link Mono}, never as an error.</p>
 */
@Service
public class TicketService {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    private final TicketRepository ticketRepository;
    private final CommentRepository commentRepository;
    private final TicketQueryEngine queryEngine;
    private final TicketCsvExporter exporter;

    public TicketService(
        TicketRepository ticketRepository,
        CommentRepository commentRepository,
        TicketQueryEngine queryEngine,
        TicketCsvExporter exporter
    ) {
        this.ticketRepository = ticketRepository;
        this.commentRepository = commentRepository;
        this.queryEngine = queryEngine;
        this.exporter = exporter;
    }

    @Transactional
    public Mono<Long> createTicket(NewTicket candidate) {
        if (isBlank(candidate.title())) {
            return Mono.error(new TicketValidationException("Ticket title must not be blank"));
        }
        return ticketRepository.create(candidate)
            .doOnNext(id -> log.info("Created ticket {} ({}, {})", id, candidate.status().value(), candidate.priority().value()));
    }

    public Mono<Ticket> getTicket(Long id) {
        return ticketRepository.findById(id);
    }

    public Flux<TicketSummary> listTickets(TicketFilter filter) {
        return queryEngine.list(filter == null ? TicketFilter.none() : filter);
    }

    /**
     * Free-text search. A blank query falls back to the unfiltered listing, which
     * keeps the triage order.
     */
    public Flux<TicketSummary> searchTickets(String query) {
        if (isBlank(query)) {
            return listTickets(TicketFilter.none());
        }
        return queryEngine.search(query.strip());
    }

    /**
     * Applies the fields present in {@code patch}. Emits {@code false} for an empty
     * patch or an unknown id; neither is an error.
     */
    @Transactional
    public Mono<Boolean> updateTicket(Long id, TicketPatch patch) {
        if (patch.contains(TicketField.TITLE) && isBlank(patch.valueOf(TicketField.TITLE).orElse(null))) {
            return Mono.error(new TicketValidationException("Ticket title must not be blank"));
        }
        if (patch.isEmpty()) {
            log.debug("Ignoring empty patch for ticket {}", id);
            return Mono.just(false);
        }
        return ticketRepository.update(id, patch)
            .doOnNext(updated -> {
                if (updated) {
                    log.info("Updated ticket {} fields {}", id, patch.assignments().keySet());
                } else {
                    log.warn("Update skipped: ticket {} does not exist", id);
                }
            });
    }

    @Transactional
    public Mono<Long> addComment(Long ticketId, String author, String body) {
        if (isBlank(body)) {
            return Mono.error(new TicketValidationException("Comment body must not be blank"));
        }
        return commentRepository.append(ticketId, author, body)
            .doOnNext(commentId -> log.info("Added comment {} to ticket {}", commentId, ticketId));
    }

    public Flux<Comment> listComments(Long ticketId) {
        return commentRepository.listFor(ticketId);
    }

    public Mono<byte[]> exportAll() {
        return exporter.exportAll();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
