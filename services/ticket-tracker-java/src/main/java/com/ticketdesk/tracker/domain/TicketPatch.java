/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/domain/TicketPatch.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Sparse set of field assignments applied to an existing ticket.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Partial update for a ticket.
 *
 * <p>Presence drives the write: a field that was never set on the builder is left
 * untouched, while a nullable field set to {@code null} is cleared. Values are held
 * in their stored (raw text) form.</p>
 */
public final class TicketPatch {

    private static final TicketPatch EMPTY = new TicketPatch(new EnumMap<>(TicketField.class));

    private final Map<TicketField, String> assignments;

    private TicketPatch(EnumMap<TicketField, String> assignments) {
        this.assignments = Collections.unmodifiableMap(assignments);
    }

    public static TicketPatch empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public boolean contains(TicketField field) {
        return assignments.containsKey(field);
    }

    /**
     * Value assigned to {@code field}. Empty both when the field is absent and when
     * it is being cleared; use {@link #contains(TicketField)} to tell them apart.
     */
    public Optional<String> valueOf(TicketField field) {
        return Optional.ofNullable(assignments.get(field));
    }

    /** Assignments in column declaration order. */
    public Map<TicketField, String> assignments() {
        return assignments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TicketPatch other && assignments.equals(other.assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return "TicketPatch" + assignments;
    }

    public static final class Builder {

        private final EnumMap<TicketField, String> assignments = new EnumMap<>(TicketField.class);

        private Builder() {
        }

        public Builder title(String title) {
            assignments.put(TicketField.TITLE, Objects.requireNonNull(title, "title must not be null"));
            return this;
        }

        public Builder description(String description) {
            assignments.put(TicketField.DESCRIPTION, description);
            return this;
        }

        public Builder status(TicketStatus status) {
            assignments.put(TicketField.STATUS, Objects.requireNonNull(status, "status must not be null").value());
            return this;
        }

        public Builder priority(TicketPriority priority) {
            assignments.put(TicketField.PRIORITY, Objects.requireNonNull(priority, "priority must not be null").value());
            return this;
        }

        public Builder requester(String requester) {
            assignments.put(TicketField.REQUESTER, requester);
            return this;
        }

        public Builder assignee(String assignee) {
            assignments.put(TicketField.ASSIGNEE, assignee);
            return this;
        }

        public Builder tags(String tags) {
            assignments.put(TicketField.TAGS, tags);
            return this;
        }

        public TicketPatch build() {
            if (assignments.isEmpty()) {
                return EMPTY;
            }
            return new TicketPatch(new EnumMap<>(assignments));
        }
    }
}
