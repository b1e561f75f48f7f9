/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/dto/CommentRequest.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Payload for appending a comment to a ticket.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Comment to append. The author is optional.
 */
public record CommentRequest(String author, @NotBlank String body) {
}
