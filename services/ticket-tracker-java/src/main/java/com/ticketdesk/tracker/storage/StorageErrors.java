/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/storage/StorageErrors.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Translates driver and Spring data-access failures into tracker exceptions.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.storage;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

import com.ticketdesk.tracker.exception.TicketConstraintViolationException;
import com.ticketdesk.tracker.exception.TicketStorageException;
import com.ticketdesk.tracker.exception.TicketTrackerException;

import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcException;

/**
 * Single place where storage failures become {@link TicketTrackerException}s.
 * Repositories apply it with {@code onErrorMap(StorageErrors::translate)}.
 */
public final class StorageErrors {

    /** SQLSTATE class for integrity constraint violations. */
    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private StorageErrors() {
    }

    public static Throwable translate(Throwable error) {
        if (error instanceof TicketTrackerException) {
            return error;
        }
        if (isIntegrityViolation(error)) {
            return new TicketConstraintViolationException("Rejected by storage constraint: " + rootMessage(error), error);
        }
        if (isStorageFailure(error)) {
            return new TicketStorageException("Storage unavailable: " + rootMessage(error), error);
        }
        return error;
    }

    private static boolean isIntegrityViolation(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof DataIntegrityViolationException
                || current instanceof R2dbcDataIntegrityViolationException) {
                return true;
            }
            if (current instanceof R2dbcException r2dbc
                && r2dbc.getSqlState() != null
                && r2dbc.getSqlState().startsWith(INTEGRITY_VIOLATION_CLASS)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isStorageFailure(Throwable error) {
        return error instanceof DataAccessException || error instanceof R2dbcException;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
