/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/dto/CommentResponse.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Comment as returned to the front end.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web.dto;

public record CommentResponse(Long id, Long ticketId, String author, String body, String createdAt) {
}
