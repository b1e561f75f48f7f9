/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/storage/Binding.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Null-aware parameter binding for DatabaseClient statements.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.storage;

import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;

/**
 * {@link GenericExecuteSpec#bind(String, Object)} rejects {@code null}; optional
 * text columns go through here instead.
 */
public final class Binding {

    private Binding() {
    }

    public static GenericExecuteSpec bindText(GenericExecuteSpec spec, String name, String value) {
        return value == null ? spec.bindNull(name, String.class) : spec.bind(name, value);
    }
}
