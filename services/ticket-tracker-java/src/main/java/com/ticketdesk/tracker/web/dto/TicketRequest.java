/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/dto/TicketRequest.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Payload received from the front end when a ticket is created.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload received from the front end when a ticket should be created.
 * Status and priority are raw values ({@code open}, {@code urgent}, ...).
 */
public class TicketRequest {

    @NotBlank
    private String title;

    private String description;

    @Size(max = 32)
    private String status;

    @Size(max = 32)
    private String priority;

    private String requester;

    private String assignee;

    private String tags;

    public TicketRequest() {
    }

    public TicketRequest(
        String title,
        String description,
        String status,
        String priority,
        String requester,
        String assignee,
        String tags
    ) {
        this.title = title;
        this.description = description;
        this.status = status;
        this.priority = priority;
        this.requester = requester;
        this.assignee = assignee;
        this.tags = tags;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }

    public String getRequester() {
        return requester;
    }

    public void setRequester(String requester) {
        this.requester = requester;
    }

    public String getAssignee() {
        return assignee;
    }

    public void setAssignee(String assignee) {
        this.assignee = assignee;
    }

    public String getTags() {
        return tags;
    }

    public void setTags(String tags) {
        this.tags = tags;
    }
}
