/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/exception/TicketNotFoundException.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Raised at the HTTP edge when a ticket id does not exist.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a ticket id does not exist. Repositories report absence
 * as an empty {@code Mono}; only the web layer turns that into this exception.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class TicketNotFoundException extends TicketTrackerException {

    public TicketNotFoundException(Long id) {
        super("Ticket with id %d not found".formatted(id));
    }
}
