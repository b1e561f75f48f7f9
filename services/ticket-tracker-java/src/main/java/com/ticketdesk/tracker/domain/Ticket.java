/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/Ticket.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Full persisted representation of a ticket row.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

/**
 * Persistent representation of a support ticket.
 *
 * <p>Timestamps are kept exactly as stored: ISO-8601 UTC text truncated to
 * seconds. {@code createdAt} never changes after insert; {@code updatedAt} moves
 * forward on every field edit but not when a comment is added.</p>
 */
public record Ticket(
    Long id,
    String title,
    String description,
    TicketStatus status,
    TicketPriority priority,
    String requester,
    String assignee,
    String tags,
    String createdAt,
    String updatedAt
) {
}
