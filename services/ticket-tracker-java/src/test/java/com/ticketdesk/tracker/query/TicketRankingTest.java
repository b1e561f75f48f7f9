/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/test/java/com/ticketdesk/tracker/query/TicketRankingTest.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Tests for the listing rank expressions.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Ticket Ranking Tests")
class TicketRankingTest {

    @Test
    @DisplayName("Status rank puts unknown values in the closed bucket")
    void shouldRenderStatusRank() {
        assertThat(TicketRanking.statusRankSql()).isEqualTo(
            "CASE status WHEN 'open' THEN 0 WHEN 'in_progress' THEN 1 WHEN 'closed' THEN 2 ELSE 2 END");
    }

    @Test
    @DisplayName("Priority rank puts unknown values after medium")
    void shouldRenderPriorityRank() {
        assertThat(TicketRanking.priorityRankSql()).isEqualTo(
            "CASE priority WHEN 'low' THEN 3 WHEN 'medium' THEN 2 WHEN 'high' THEN 1 WHEN 'urgent' THEN 0 ELSE 3 END");
    }

    @Test
    @DisplayName("Newest first is the final tie-break")
    void shouldEndWithRecency() {
        assertThat(TicketRanking.listingOrderSql()).endsWith(", created_at DESC, id DESC");
    }
}
