/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/TicketPriority.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Ticket priority with its stored value and listing rank.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Urgency of a ticket. Listings surface urgent work first, so the rank runs
 * opposite to the declaration order.
 */
public enum TicketPriority {
    LOW("low", 3),
    MEDIUM("medium", 2),
    HIGH("high", 1),
    URGENT("urgent", 0);

    /** Rank given to any stored value outside this enum. Sorts together with low. */
    public static final int UNKNOWN_RANK = 3;

    private final String value;
    private final int rank;

    TicketPriority(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    public static Optional<TicketPriority> find(String value) {
        return Arrays.stream(values())
            .filter(priority -> priority.value.equals(value))
            .findFirst();
    }

    public static TicketPriority fromValue(String value) {
        return find(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown ticket priority '%s'".formatted(value)));
    }
}
