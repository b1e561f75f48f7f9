/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/dto/TicketUpdateResponse.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Outcome of a partial ticket update.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web.dto;

/**
 * {@code updated} is false when the patch was empty or the ticket does not exist.
 */
public record TicketUpdateResponse(Long id, boolean updated) {
}
