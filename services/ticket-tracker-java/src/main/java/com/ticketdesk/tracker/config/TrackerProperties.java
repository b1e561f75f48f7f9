/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/config/TrackerProperties.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Typed configuration bound from the tracker block of application.yml.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Configuration properties for the tracker. The structure mirrors
 * {@code application.yml}; validation fails startup on a blank export name.
 */
@Validated
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    /**
     * Log the stored ticket count once the application is ready.
     */
    private boolean startupProbe = true;

    @NestedConfigurationProperty
    private final ExportProperties export = new ExportProperties();

    public boolean isStartupProbe() {
        return startupProbe;
    }

    public void setStartupProbe(boolean startupProbe) {
        this.startupProbe = startupProbe;
    }

    public ExportProperties getExport() {
        return export;
    }

    public static class ExportProperties {

        @NotBlank
        private String fileName = "tickets_export.csv";

        public String getFileName() {
            return fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }
    }
}
