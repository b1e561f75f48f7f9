/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/query/TicketQueryEngine.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Filtered listings and free-text search over tickets.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.stereotype.Component;

import com.ticketdesk.tracker.domain.TicketFilter;
import com.ticketdesk.tracker.domain.TicketPriority;
import com.ticketdesk.tracker.domain.TicketStatus;
import com.ticketdesk.tracker.domain.TicketSummary;
import com.ticketdesk.tracker.storage.StorageErrors;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;

/**
 * Read side of the tracker.
 *
 * <p>{@link #list(TicketFilter)} is the triage view (fixed status/priority order),
 * {@link #search(String)} the exploratory view (most recently updated first). The
 * two orders differ on purpose.</p>
 */
@Component
public class TicketQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(TicketQueryEngine.class);

    private static final String SUMMARY_COLUMNS =
        "id, title, status, priority, assignee, requester, tags, created_at, updated_at";

    private static final String SEARCH = """
        SELECT %s
        FROM tickets
        WHERE LOWER(title) LIKE :pattern ESCAPE '\\'
           OR LOWER(description) LIKE :pattern ESCAPE '\\'
           OR LOWER(tags) LIKE :pattern ESCAPE '\\'
        ORDER BY updated_at DESC, id DESC
        """.formatted(SUMMARY_COLUMNS);

    private final DatabaseClient databaseClient;

    public TicketQueryEngine(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    public Flux<TicketSummary> list(TicketFilter filter) {
        Map<String, String> predicates = new LinkedHashMap<>();
        if (filter.status() != null) {
            predicates.put("status", filter.status().value());
        }
        if (filter.priority() != null) {
            predicates.put("priority", filter.priority().value());
        }
        if (filter.assignee() != null) {
            predicates.put("assignee", filter.assignee());
        }

        List<String> clauses = new ArrayList<>();
        predicates.keySet().forEach(column -> clauses.add(column + " = :" + column));
        String where = clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        String sql = "SELECT " + SUMMARY_COLUMNS + " FROM tickets" + where
            + " ORDER BY " + TicketRanking.listingOrderSql();
        log.debug("Listing tickets with {}", filter);

        GenericExecuteSpec spec = databaseClient.sql(sql);
        for (Map.Entry<String, String> predicate : predicates.entrySet()) {
            spec = spec.bind(predicate.getKey(), predicate.getValue());
        }
        return spec.map((row, metadata) -> toSummary(row))
            .all()
            .onErrorMap(StorageErrors::translate);
    }

    /**
     * Case-insensitive substring match on title, description or tags. The query is
     * taken literally; {@code %} and {@code _} do not act as wildcards.
     */
    public Flux<TicketSummary> search(String query) {
        String pattern = "%" + escapeLike(query.toLowerCase(Locale.ROOT)) + "%";
        log.debug("Searching tickets for '{}'", query);
        return databaseClient.sql(SEARCH)
            .bind("pattern", pattern)
            .map((row, metadata) -> toSummary(row))
            .all()
            .onErrorMap(StorageErrors::translate);
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static TicketSummary toSummary(Row row) {
        return new TicketSummary(
            row.get("id", Long.class),
            row.get("title", String.class),
            TicketStatus.fromValue(row.get("status", String.class)),
            TicketPriority.fromValue(row.get("priority", String.class)),
            row.get("assignee", String.class),
            row.get("requester", String.class),
            row.get("tags", String.class),
            row.get("created_at", String.class),
            row.get("updated_at", String.class)
        );
    }
}
