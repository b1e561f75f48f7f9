/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/exception/TicketValidationException.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Raised when a required field is missing or blank.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A required value was missing or blank (ticket title, comment body) or a value
 * could not be interpreted. Raised before the store is touched.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class TicketValidationException extends TicketTrackerException {

    public TicketValidationException(String message) {
        super(message);
    }
}
