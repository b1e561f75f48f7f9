/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/exception/TicketConstraintViolationException.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Storage-level rejection of a write.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The store refused a write: a check constraint (status, priority, timestamps)
 * or a foreign key (comment for a ticket that does not exist).
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class TicketConstraintViolationException extends TicketTrackerException {

    public TicketConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
