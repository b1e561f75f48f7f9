/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/query/TicketRanking.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Rank tables that fix the triage order of ticket listings.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.query;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.ticketdesk.tracker.domain.TicketPriority;
import com.ticketdesk.tracker.domain.TicketStatus;

/**
 * Listing order: status rank ascending, then priority rank ascending, then newest
 * first. The rank tables come from the enums; values outside them fall into the
 * last bucket (unknown status next to closed, unknown priority next to low).
 */
public final class TicketRanking {

    private TicketRanking() {
    }

    static String statusRankSql() {
        return Arrays.stream(TicketStatus.values())
            .map(status -> "WHEN '%s' THEN %d".formatted(status.value(), status.rank()))
            .collect(Collectors.joining(" ", "CASE status ", " ELSE " + TicketStatus.UNKNOWN_RANK + " END"));
    }

    static String priorityRankSql() {
        return Arrays.stream(TicketPriority.values())
            .map(priority -> "WHEN '%s' THEN %d".formatted(priority.value(), priority.rank()))
            .collect(Collectors.joining(" ", "CASE priority ", " ELSE " + TicketPriority.UNKNOWN_RANK + " END"));
    }

    /** ORDER BY clause for triage listings; {@code id DESC} breaks same-second ties. */
    static String listingOrderSql() {
        return statusRankSql() + ", " + priorityRankSql() + ", created_at DESC, id DESC";
    }
}
