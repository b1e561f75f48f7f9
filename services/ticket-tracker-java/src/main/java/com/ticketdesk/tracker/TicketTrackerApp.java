/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/TicketTrackerApp.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Spring Boot entry point of the ticket tracker.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.ticketdesk.tracker.config.TrackerProperties;

/**
 * Spring Boot entry point for the TicketDesk ticket tracker.
 *
 * <p>The application keeps tickets and their comments in an embedded store and
 * exposes a reactive API to create, filter, search, edit, comment on and export
 * them.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(TrackerProperties.class)
public class TicketTrackerApp {

    public static void main(String[] args) {
        SpringApplication.run(TicketTrackerApp.class, args);
    }
}
