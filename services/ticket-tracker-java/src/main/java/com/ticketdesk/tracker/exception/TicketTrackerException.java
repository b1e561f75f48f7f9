/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/exception/TicketTrackerException.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Root of the tracker's failure hierarchy.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.exception;

/**
 * Base type for every failure the tracker core reports to its callers.
 */
public abstract class TicketTrackerException extends RuntimeException {

    protected TicketTrackerException(String message) {
        super(message);
    }

    protected TicketTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
