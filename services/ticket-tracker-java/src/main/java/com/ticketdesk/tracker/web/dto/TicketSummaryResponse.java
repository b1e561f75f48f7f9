/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/dto/TicketSummaryResponse.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Listing row returned by list and search endpoints.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web.dto;

public record TicketSummaryResponse(
    Long id,
    String title,
    String status,
    String priority,
    String assignee,
    String requester,
    String tags,
    String createdAt,
    String updatedAt
) {
}
