/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/TicketFilter.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Optional equality predicates narrowing a ticket listing.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

/**
 * Conjunctive listing filter. A {@code null} component (or a blank assignee)
 * matches every value of that column.
 */
public record TicketFilter(TicketStatus status, TicketPriority priority, String assignee) {

    private static final TicketFilter NONE = new TicketFilter(null, null, null);

    public TicketFilter {
        if (assignee != null && assignee.isBlank()) {
            assignee = null;
        }
    }

    public static TicketFilter none() {
        return NONE;
    }

    public TicketFilter withStatus(TicketStatus status) {
        return new TicketFilter(status, priority, assignee);
    }

    public TicketFilter withPriority(TicketPriority priority) {
        return new TicketFilter(status, priority, assignee);
    }

    public TicketFilter withAssignee(String assignee) {
        return new TicketFilter(status, priority, assignee);
    }
}
