/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/export/TicketCsvExporter.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Serializes every stored ticket to CSV bytes.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.export;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;

import com.ticketdesk.tracker.storage.StorageErrors;

import reactor.core.publisher.Mono;

/**
 * Snapshot export of the {@code tickets} table.
 *
 * <p>Rows are read in id order and written with their stored text untouched: enum
 * columns as their raw values, timestamps as stored. A {@code NULL} column becomes
 * an empty field.</p>
 */
@Component
public class TicketCsvExporter {

    private static final Logger log = LoggerFactory.getLogger(TicketCsvExporter.class);

    public static final String[] HEADER = {
        "id", "title", "description", "status", "priority",
        "requester", "assignee", "tags", "created_at", "updated_at"
    };

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(HEADER)
        .build();

    private final DatabaseClient databaseClient;

    public TicketCsvExporter(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    public Mono<byte[]> exportAll() {
        return databaseClient.sql("SELECT " + String.join(", ", HEADER) + " FROM tickets ORDER BY id ASC")
            .map((row, metadata) -> {
                List<String> record = new ArrayList<>(HEADER.length);
                record.add(String.valueOf(row.get("id", Long.class)));
                for (int i = 1; i < HEADER.length; i++) {
                    record.add(row.get(HEADER[i], String.class));
                }
                return record;
            })
            .all()
            .onErrorMap(StorageErrors::translate)
            .collectList()
            .map(TicketCsvExporter::encode);
    }

    static byte[] encode(List<List<String>> records) {
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, FORMAT)) {
            printer.printRecords(records);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode ticket export", e);
        }
        log.info("Exported {} tickets", records.size());
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
