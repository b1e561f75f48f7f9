/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/storage/TicketTimestamps.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Produces the stored timestamp representation from a clock.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.storage;

import java.time.Clock;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps are stored as ISO-8601 UTC text with second precision
 * ({@code 2026-10-19T08:15:00Z}). The width is fixed, so text order equals time
 * order and the store can sort and compare them directly.
 */
public final class TicketTimestamps {

    private TicketTimestamps() {
    }

    public static String now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
