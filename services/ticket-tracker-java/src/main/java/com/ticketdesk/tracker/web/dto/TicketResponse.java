/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/dto/TicketResponse.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: API response for a single ticket.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web.dto;

/**
 * API response returned to the front end for a single ticket. Enum fields and
 * timestamps carry their stored text.
 */
public class TicketResponse {

    private final Long id;
    private final String title;
    private final String description;
    private final String status;
    private final String priority;
    private final String requester;
    private final String assignee;
    private final String tags;
    private final String createdAt;
    private final String updatedAt;

    public TicketResponse(
        Long id,
        String title,
        String description,
        String status,
        String priority,
        String requester,
        String assignee,
        String tags,
        String createdAt,
        String updatedAt
    ) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.status = status;
        this.priority = priority;
        this.requester = requester;
        this.assignee = assignee;
        this.tags = tags;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getStatus() {
        return status;
    }

    public String getPriority() {
        return priority;
    }

    public String getRequester() {
        return requester;
    }

    public String getAssignee() {
        return assignee;
    }

    public String getTags() {
        return tags;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }
}
