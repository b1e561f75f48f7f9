/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/config/AppConfig.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Application-wide infrastructure beans.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Miscellaneous application-wide beans that don't belong in specific features.
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
