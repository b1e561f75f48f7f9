/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/TicketMapper.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Conversion between API payloads and tracker domain types.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web;

import java.util.Iterator;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.ticketdesk.tracker.domain.Comment;
import com.ticketdesk.tracker.domain.NewTicket;
import com.ticketdesk.tracker.domain.Ticket;
import com.ticketdesk.tracker.domain.TicketField;
import com.ticketdesk.tracker.domain.TicketFilter;
import com.ticketdesk.tracker.domain.TicketPatch;
import com.ticketdesk.tracker.domain.TicketPriority;
import com.ticketdesk.tracker.domain.TicketStatus;
import com.ticketdesk.tracker.domain.TicketSummary;
import com.ticketdesk.tracker.exception.TicketValidationException;
import com.ticketdesk.tracker.web.dto.CommentResponse;
import com.ticketdesk.tracker.web.dto.TicketRequest;
import com.ticketdesk.tracker.web.dto.TicketResponse;
import com.ticketdesk.tracker.web.dto.TicketSummaryResponse;

/**
 * Centralises conversion between domain objects and API DTOs so the shape of
 * requests and responses stays consistent across endpoints.
 *
 * <p>Incoming text is trimmed and blank optional values become {@code null}, the
 * same normalisation the ticket form applies.</p>
 */
@Component
public class TicketMapper {

    public NewTicket toNewTicket(TicketRequest request) {
        return new NewTicket(
            trim(request.getTitle()),
            request.getDescription() == null ? "" : request.getDescription().strip(),
            parseStatus(request.getStatus()),
            parsePriority(request.getPriority()),
            trimToNull(request.getRequester()),
            trimToNull(request.getAssignee()),
            trimToNull(request.getTags())
        );
    }

    public TicketFilter toFilter(String status, String priority, String assignee) {
        return new TicketFilter(parseStatus(status), parsePriority(priority), trimToNull(assignee));
    }

    /**
     * Builds a patch from the keys present in a JSON object. An explicit
     * {@code null} clears a nullable field; unknown keys are rejected.
     */
    public TicketPatch toPatch(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new TicketValidationException("Patch body must be a JSON object");
        }
        TicketPatch.Builder patch = TicketPatch.builder();
        Iterator<Map.Entry<String, JsonNode>> entries = body.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            TicketField field = TicketField.fromName(entry.getKey())
                .orElseThrow(() -> new TicketValidationException("Field '%s' cannot be patched".formatted(entry.getKey())));
            String value = entry.getValue().isNull() ? null : entry.getValue().asText();
            if (value == null && !field.nullable()) {
                throw new TicketValidationException("Field '%s' cannot be cleared".formatted(field.column()));
            }
            switch (field) {
                case TITLE -> patch.title(value.strip());
                case DESCRIPTION -> patch.description(value == null ? null : value.strip());
                case STATUS -> patch.status(parseStatus(value));
                case PRIORITY -> patch.priority(parsePriority(value));
                case REQUESTER -> patch.requester(trimToNull(value));
                case ASSIGNEE -> patch.assignee(trimToNull(value));
                case TAGS -> patch.tags(trimToNull(value));
                default -> throw new IllegalStateException("Unhandled field " + field);
            }
        }
        return patch.build();
    }

    public TicketResponse toResponse(Ticket ticket) {
        return new TicketResponse(
            ticket.id(),
            ticket.title(),
            ticket.description(),
            ticket.status().value(),
            ticket.priority().value(),
            ticket.requester(),
            ticket.assignee(),
            ticket.tags(),
            ticket.createdAt(),
            ticket.updatedAt()
        );
    }

    public TicketSummaryResponse toResponse(TicketSummary summary) {
        return new TicketSummaryResponse(
            summary.id(),
            summary.title(),
            summary.status().value(),
            summary.priority().value(),
            summary.assignee(),
            summary.requester(),
            summary.tags(),
            summary.createdAt(),
            summary.updatedAt()
        );
    }

    public CommentResponse toResponse(Comment comment) {
        return new CommentResponse(comment.id(), comment.ticketId(), comment.author(), comment.body(), comment.createdAt());
    }

    private static TicketStatus parseStatus(String value) {
        String raw = trimToNull(value);
        if (raw == null) {
            return null;
        }
        return TicketStatus.find(raw)
            .orElseThrow(() -> new TicketValidationException("Unknown status '%s'".formatted(raw)));
    }

    private static TicketPriority parsePriority(String value) {
        String raw = trimToNull(value);
        if (raw == null) {
            return null;
        }
        return TicketPriority.find(raw)
            .orElseThrow(() -> new TicketValidationException("Unknown priority '%s'".formatted(raw)));
    }

    private static String trim(String value) {
        return value == null ? null : value.strip();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.strip();
    }
}
