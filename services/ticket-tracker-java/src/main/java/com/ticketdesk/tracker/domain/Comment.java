/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/Comment.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Immutable note attached to a ticket.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

/**
 * Append-only comment. There is no update or delete path; rows disappear only
 * through the cascade when their ticket is removed at the storage level.
 */
public record Comment(Long id, Long ticketId, String author, String body, String createdAt) {
}
