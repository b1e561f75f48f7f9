/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/test/java/com/ticketdesk/tracker/domain/TicketEnumsTest.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Tests for status and priority value tables.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Ticket Status and Priority Tests")
class TicketEnumsTest {

    @Test
    @DisplayName("Stored values resolve to their constants")
    void shouldResolveStoredValues() {
        assertThat(TicketStatus.fromValue("in_progress")).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(TicketPriority.fromValue("urgent")).isEqualTo(TicketPriority.URGENT);
    }

    @Test
    @DisplayName("Unknown values are rejected")
    void shouldRejectUnknownValues() {
        assertThat(TicketStatus.find("OPEN")).isEmpty();
        assertThatThrownBy(() -> TicketPriority.fromValue("critical"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("critical");
    }

    @Test
    @DisplayName("New tickets default to open and medium")
    void shouldDefaultNewTicket() {
        NewTicket candidate = NewTicket.of("Title", "");

        assertThat(candidate.status()).isEqualTo(TicketStatus.OPEN);
        assertThat(candidate.priority()).isEqualTo(TicketPriority.MEDIUM);
    }
}
