/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/ticket-tracker-java/src/main/java/com/ticketdesk/tracker/web/ApiExceptionHandler.java
 * Project: TicketDesk Framework - Ticket Tracker
 * Description: Renders tracker failures as JSON error bodies.
 * Since: 2026-10-19
 */

package com.ticketdesk.tracker.web;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.ticketdesk.tracker.exception.TicketStorageException;
import com.ticketdesk.tracker.exception.TicketTrackerException;

/**
 * Maps {@link TicketTrackerException}s to the status declared on each exception
 * type, with a small JSON body the front end can show to the user.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TicketTrackerException.class)
    public ResponseEntity<Map<String, Object>> handleTrackerException(TicketTrackerException ex) {
        HttpStatus status = statusOf(ex);
        if (ex instanceof TicketStorageException) {
            log.error("Storage failure: {}", ex.getMessage(), ex);
        } else {
            log.debug("Request rejected with {}: {}", status.value(), ex.getMessage());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", ex.getMessage());
        return ResponseEntity.status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(body);
    }

    private static HttpStatus statusOf(TicketTrackerException ex) {
        ResponseStatus annotation = AnnotatedElementUtils.findMergedAnnotation(ex.getClass(), ResponseStatus.class);
        return annotation == null ? HttpStatus.INTERNAL_SERVER_ERROR : annotation.code();
    }
}
