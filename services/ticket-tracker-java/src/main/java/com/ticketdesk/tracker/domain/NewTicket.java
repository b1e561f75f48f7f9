/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/NewTicket.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Candidate values for a ticket that has not been stored yet.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

import java.util.Objects;

/**
 * Creation candidate. Status and priority fall back to {@code open} and
 * {@code medium} when not supplied.
 */
public record NewTicket(
    String title,
    String description,
    TicketStatus status,
    TicketPriority priority,
    String requester,
    String assignee,
    String tags
) {

    public NewTicket {
        status = Objects.requireNonNullElse(status, TicketStatus.OPEN);
        priority = Objects.requireNonNullElse(priority, TicketPriority.MEDIUM);
    }

    public static NewTicket of(String title, String description) {
        return new NewTicket(title, description, null, null, null, null, null);
    }
}
