/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/test/java/com/ticketdesk/tracker/export/TicketCsvExporterTest.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Tests for the CSV snapshot export.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.export;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.ticketdesk.tracker.domain.NewTicket;
import com.ticketdesk.tracker.domain.Ticket;
import com.ticketdesk.tracker.domain.TicketFilter;
import com.ticketdesk.tracker.domain.TicketPriority;
import com.ticketdesk.tracker.domain.TicketStatus;
import com.ticketdesk.tracker.query.TicketQueryEngine;
import com.ticketdesk.tracker.repository.TicketRepository;
import com.ticketdesk.tracker.support.InMemoryTicketStore;
import com.ticketdesk.tracker.support.MutableClock;

@DisplayName("Ticket CSV Exporter Tests")
class TicketCsvExporterTest {

    private MutableClock clock;
    private TicketRepository repository;
    private TicketQueryEngine queryEngine;
    private TicketCsvExporter exporter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-07-01T12:00:00Z");
        InMemoryTicketStore store = InMemoryTicketStore.create();
        repository = new TicketRepository(store.databaseClient(), clock);
        queryEngine = new TicketQueryEngine(store.databaseClient());
        exporter = new TicketCsvExporter(store.databaseClient());
    }

    private static List<CSVRecord> parse(byte[] csv) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();
        try (CSVParser parser = CSVParser.parse(new StringReader(new String(csv, StandardCharsets.UTF_8)), format)) {
            return parser.getRecords();
        }
    }

    @Test
    @DisplayName("An empty store exports only the header row")
    void shouldExportHeaderOnly() {
        byte[] csv = exporter.exportAll().block();

        assertThat(new String(csv, StandardCharsets.UTF_8))
            .isEqualTo("id,title,description,status,priority,requester,assignee,tags,created_at,updated_at\r\n");
    }

    @Test
    @DisplayName("Parsing the export reproduces every ticket's stored values")
    void shouldRoundTripStoredValues() throws IOException {
        // Given
        repository.create(new NewTicket(
            "Quote \"this\", please",
            "Line one\nLine two, with comma",
            TicketStatus.IN_PROGRESS,
            TicketPriority.URGENT,
            "ana@example.com",
            null,
            "billing,invoices"
        )).block();
        clock.advanceSeconds(3);
        repository.create(NewTicket.of("Plain", "")).block();
        clock.advanceSeconds(3);
        repository.create(new NewTicket("Closed one", null, TicketStatus.CLOSED, TicketPriority.LOW, null, "bob", null)).block();

        // When
        List<CSVRecord> records = parse(exporter.exportAll().block());

        // Then
        assertThat(records).hasSize(queryEngine.list(TicketFilter.none()).count().block().intValue());
        for (CSVRecord record : records) {
            Ticket ticket = repository.findById(Long.valueOf(record.get("id"))).block();
            assertThat(record.get("title")).isEqualTo(ticket.title());
            assertThat(record.get("description")).isEqualTo(nullToEmpty(ticket.description()));
            assertThat(record.get("status")).isEqualTo(ticket.status().value());
            assertThat(record.get("priority")).isEqualTo(ticket.priority().value());
            assertThat(record.get("requester")).isEqualTo(nullToEmpty(ticket.requester()));
            assertThat(record.get("assignee")).isEqualTo(nullToEmpty(ticket.assignee()));
            assertThat(record.get("tags")).isEqualTo(nullToEmpty(ticket.tags()));
            assertThat(record.get("created_at")).isEqualTo(ticket.createdAt());
            assertThat(record.get("updated_at")).isEqualTo(ticket.updatedAt());
        }
    }

    @Test
    @DisplayName("Rows come out in ascending id order with raw enum values")
    void shouldExportInIdOrder() throws IOException {
        Long first = repository.create(new NewTicket("Low", "", TicketStatus.OPEN, TicketPriority.LOW, null, null, null)).block();
        Long second = repository.create(new NewTicket("Urgent", "", TicketStatus.IN_PROGRESS, TicketPriority.URGENT, null, null, null)).block();

        List<CSVRecord> records = parse(exporter.exportAll().block());

        assertThat(records).extracting(record -> record.get("id"))
            .containsExactly(String.valueOf(first), String.valueOf(second));
        assertThat(records.get(1).get("status")).isEqualTo("in_progress");
        assertThat(records.get(1).get("priority")).isEqualTo("urgent");
        assertThat(records.get(0).get("created_at")).isEqualTo("2026-07-01T12:00:00Z");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
