/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/test/java/com/ticketdesk/tracker/service/TicketServiceTest.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Tests for validation and routing in the application service.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ticketdesk.tracker.domain.NewTicket;
import com.ticketdesk.tracker.domain.TicketFilter;
import com.ticketdesk.tracker.domain.TicketPatch;
import com.ticketdesk.tracker.domain.TicketPriority;
import com.ticketdesk.tracker.domain.TicketStatus;
import com.ticketdesk.tracker.domain.TicketSummary;
import com.ticketdesk.tracker.exception.TicketValidationException;
import com.ticketdesk.tracker.export.TicketCsvExporter;
import com.ticketdesk.tracker.query.TicketQueryEngine;
import com.ticketdesk.tracker.repository.CommentRepository;
import com.ticketdesk.tracker.repository.TicketRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("Ticket Service Tests")
class TicketServiceTest {

    @Mock
    private TicketRepository ticketRepository;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private TicketQueryEngine queryEngine;

    @Mock
    private TicketCsvExporter exporter;

    private TicketService service;

    @BeforeEach
    void setUp() {
        service = new TicketService(ticketRepository, commentRepository, queryEngine, exporter);
    }

    private static TicketSummary summary(long id) {
        return new TicketSummary(id, "t" + id, TicketStatus.OPEN, TicketPriority.MEDIUM,
            null, null, null, "2026-01-01T00:00:00Z", "2026-01-01T00:00:00Z");
    }

    @Nested
    @DisplayName("createTicket")
    class CreateTicketTests {

        @Test
        @DisplayName("Should delegate a valid candidate to the repository")
        void shouldCreate() {
            var candidate = NewTicket.of("Broken chair", "Leg snapped");
            when(ticketRepository.create(candidate)).thenReturn(Mono.just(7L));

            StepVerifier.create(service.createTicket(candidate))
                .expectNext(7L)
                .verifyComplete();
        }

        @Test
        @DisplayName("Should reject a blank title without touching the store")
        void shouldRejectBlankTitle() {
            StepVerifier.create(service.createTicket(NewTicket.of("   ", "body")))
                .expectError(TicketValidationException.class)
                .verify();

            verifyNoInteractions(ticketRepository);
        }
    }

    @Nested
    @DisplayName("updateTicket")
    class UpdateTicketTests {

        @Test
        @DisplayName("An empty patch returns false without a store write")
        void shouldSkipEmptyPatch() {
            StepVerifier.create(service.updateTicket(1L, TicketPatch.empty()))
                .expectNext(false)
                .verifyComplete();

            verify(ticketRepository, never()).update(any(), any());
        }

        @Test
        @DisplayName("A patch that blanks the title is rejected")
        void shouldRejectBlankTitlePatch() {
            StepVerifier.create(service.updateTicket(1L, TicketPatch.builder().title("").build()))
                .expectError(TicketValidationException.class)
                .verify();

            verifyNoInteractions(ticketRepository);
        }

        @Test
        @DisplayName("An unknown id is reported as false, not as an error")
        void shouldPassThroughMissingRow() {
            var patch = TicketPatch.builder().status(TicketStatus.CLOSED).build();
            when(ticketRepository.update(42L, patch)).thenReturn(Mono.just(false));

            StepVerifier.create(service.updateTicket(42L, patch))
                .expectNext(false)
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("comments")
    class CommentTests {

        @Test
        @DisplayName("Should reject a blank comment body")
        void shouldRejectBlankBody() {
            StepVerifier.create(service.addComment(1L, "bob", " \n "))
                .expectError(TicketValidationException.class)
                .verify();

            verifyNoInteractions(commentRepository);
        }

        @Test
        @DisplayName("Should append a comment with an anonymous author")
        void shouldAppendAnonymousComment() {
            when(commentRepository.append(1L, null, "Looks fixed")).thenReturn(Mono.just(3L));

            StepVerifier.create(service.addComment(1L, null, "Looks fixed"))
                .expectNext(3L)
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("searchTickets / listTickets")
    class QueryTests {

        @Test
        @DisplayName("A blank query falls back to the unfiltered listing")
        void shouldFallBackToListing() {
            when(queryEngine.list(TicketFilter.none())).thenReturn(Flux.just(summary(1), summary(2)));

            StepVerifier.create(service.searchTickets("  "))
                .expectNextCount(2)
                .verifyComplete();

            verify(queryEngine, never()).search(any());
        }

        @Test
        @DisplayName("A query is trimmed before searching")
        void shouldSearchTrimmedQuery() {
            when(queryEngine.search("vpn")).thenReturn(Flux.just(summary(5)));

            StepVerifier.create(service.searchTickets("  vpn "))
                .expectNext(summary(5))
                .verifyComplete();
        }

        @Test
        @DisplayName("A null filter lists everything")
        void shouldTreatNullFilterAsNone() {
            when(queryEngine.list(TicketFilter.none())).thenReturn(Flux.empty());

            StepVerifier.create(service.listTickets(null))
                .verifyComplete();
        }
    }
}
