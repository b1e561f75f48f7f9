/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/TicketSummary.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Listing projection of a ticket (everything except the description).
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

/**
 * Row returned by listings and searches.
 */
public record TicketSummary(
    Long id,
    String title,
    TicketStatus status,
    TicketPriority priority,
    String assignee,
    String requester,
    String tags,
    String createdAt,
    String updatedAt
) {
}
