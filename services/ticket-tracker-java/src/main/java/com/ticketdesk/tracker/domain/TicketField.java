/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/TicketField.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Closed set of ticket columns a patch may write.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Editable ticket columns. Patches can only name these constants, so the column
 * names that end up in an UPDATE statement never come from caller input.
 */
public enum TicketField {
    TITLE("title", false),
    DESCRIPTION("description", true),
    STATUS("status", false),
    PRIORITY("priority", false),
    REQUESTER("requester", true),
    ASSIGNEE("assignee", true),
    TAGS("tags", true);

    private final String column;
    private final boolean nullable;

    TicketField(String column, boolean nullable) {
        this.column = column;
        this.nullable = nullable;
    }

    public String column() {
        return column;
    }

    public boolean nullable() {
        return nullable;
    }

    public static Optional<TicketField> fromName(String name) {
        return Arrays.stream(values())
            .filter(field -> field.column.equals(name))
            .findFirst();
    }
}
