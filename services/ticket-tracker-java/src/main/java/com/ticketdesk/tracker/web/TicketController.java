/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/TicketController.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: REST adapter exposing the tracker operations.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web;

import java.net.URI;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.ticketdesk.tracker.config.TrackerProperties;
import com.ticketdesk.tracker.exception.TicketNotFoundException;
import com.ticketdesk.tracker.service.TicketService;
import com.ticketdesk.tracker.web.dto.CommentRequest;
import com.ticketdesk.tracker.web.dto.CommentResponse;
import com.ticketdesk.tracker.web.dto.TicketRequest;
import com.ticketdesk.tracker.web.dto.TicketResponse;
import com.ticketdesk.tracker.web.dto.TicketSummaryResponse;
import com.ticketdesk.tracker.web.dto.TicketUpdateResponse;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP API used by the ticket front end. It renders nothing: every endpoint maps
 * to one {@link TicketService} operation.
 */
@RestController
@RequestMapping(path = "/api/tickets", produces = MediaType.APPLICATION_JSON_VALUE)
public class TicketController {

    static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final TicketService ticketService;
    private final TicketMapper ticketMapper;
    private final TrackerProperties properties;

    public TicketController(TicketService ticketService, TicketMapper ticketMapper, TrackerProperties properties) {
        this.ticketService = ticketService;
        this.ticketMapper = ticketMapper;
        this.properties = properties;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<TicketResponse>> createTicket(@Valid @RequestBody TicketRequest request) {
        return Mono.fromCallable(() -> ticketMapper.toNewTicket(request))
            .flatMap(ticketService::createTicket)
            .flatMap(ticketService::getTicket)
            .map(ticketMapper::toResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/tickets/" + response.getId()))
                .body(response));
    }

    @GetMapping("/{id}")
    public Mono<TicketResponse> getTicket(@PathVariable Long id) {
        return ticketService.getTicket(id)
            .switchIfEmpty(Mono.error(() -> new TicketNotFoundException(id)))
            .map(ticketMapper::toResponse);
    }

    /**
     * Triage listing, or search results when {@code q} is non-blank. Filters are
     * ignored while searching.
     */
    @GetMapping
    public Flux<TicketSummaryResponse> listTickets(
        @RequestParam(required = false) String status,
        @RequestParam(required = false) String priority,
        @RequestParam(required = false) String assignee,
        @RequestParam(name = "q", required = false) String query
    ) {
        if (query != null && !query.isBlank()) {
            return ticketService.searchTickets(query)
                .map(ticketMapper::toResponse);
        }
        return Mono.fromCallable(() -> ticketMapper.toFilter(status, priority, assignee))
            .flatMapMany(ticketService::listTickets)
            .map(ticketMapper::toResponse);
    }

    @PatchMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketUpdateResponse> updateTicket(@PathVariable Long id, @RequestBody JsonNode body) {
        return Mono.fromCallable(() -> ticketMapper.toPatch(body))
            .flatMap(patch -> ticketService.updateTicket(id, patch))
            .map(updated -> new TicketUpdateResponse(id, updated));
    }

    @PostMapping(path = "/{id}/comments", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CommentResponse>> addComment(
        @PathVariable Long id,
        @Valid @RequestBody CommentRequest request
    ) {
        String author = request.author() == null || request.author().isBlank() ? null : request.author().strip();
        return ticketService.addComment(id, author, request.body().strip())
            .flatMap(commentId -> ticketService.listComments(id)
                .filter(comment -> comment.id().equals(commentId))
                .next())
            .map(ticketMapper::toResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/tickets/%d/comments".formatted(id)))
                .body(response));
    }

    @GetMapping("/{id}/comments")
    public Flux<CommentResponse> listComments(@PathVariable Long id) {
        return ticketService.listComments(id)
            .map(ticketMapper::toResponse);
    }

    @GetMapping(path = "/export", produces = "text/csv")
    public Mono<ResponseEntity<byte[]>> exportTickets() {
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(properties.getExport().getFileName())
            .build();
        return ticketService.exportAll()
            .map(csv -> ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(csv));
    }
}
