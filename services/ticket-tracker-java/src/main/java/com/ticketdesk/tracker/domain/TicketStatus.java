/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/TicketStatus.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Lifecycle state of a ticket with its stored value and listing rank.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Represents the lifecycle state of a support ticket.
 *
 * <p>Any status may move to any other status; there is no enforced workflow. The
 * stored value is the lowercase text guarded by the {@code ck_tickets_status}
 * check constraint.</p>
 */
public enum TicketStatus {
    OPEN("open", 0),
    IN_PROGRESS("in_progress", 1),
    CLOSED("closed", 2);

    /** Rank given to any stored value outside this enum. Sorts together with closed. */
    public static final int UNKNOWN_RANK = 2;

    private final String value;
    private final int rank;

    TicketStatus(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public static Optional<TicketStatus> find(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equals(value))
            .findFirst();
    }

    public static TicketStatus fromValue(String value) {
        return find(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown ticket status '%s'".formatted(value)));
    }
}
