/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/exception/TicketStorageException.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Connection or I/O failure of the underlying store.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The store could not be reached or failed mid-operation. The operation is
 * aborted as a whole.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class TicketStorageException extends TicketTrackerException {

    public TicketStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
