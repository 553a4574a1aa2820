package com.demo.triage.controller;

import com.demo.triage.domain.InboundMessage;
import com.demo.triage.domain.IngestionResult;
import com.demo.triage.domain.Message;
import com.demo.triage.domain.ValidationResult;
import com.demo.triage.exception.MessageNotFoundException;
import com.demo.triage.infrastructure.IssueStore;
import com.demo.triage.service.IngestionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ingestion entry point for already verified, normalized chat records.
 */
@Slf4j
@RestController
@RequestMapping("/api/messages")
@CrossOrigin(origins = "*")
public class MessageController {

    private final IngestionCoordinator coordinator;
    private final IssueStore issueStore;

    public MessageController(IngestionCoordinator coordinator, IssueStore issueStore) {
        this.coordinator = coordinator;
        this.issueStore = issueStore;
    }

    /**
     * Accept a record for asynchronous processing
     * POST /api/messages
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody InboundMessage inbound) {
        ValidationResult validation = inbound.validate();
        if (!validation.isValid()) {
            log.warn("Rejected inbound message: errors={}", validation.getErrors());
            return error(HttpStatus.BAD_REQUEST, "Invalid message", validation.getErrorMessage());
        }

        try {
            coordinator.submit(inbound);
            log.info("Accepted inbound message: sourceRef={}", inbound.resolveSourceRef());
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(Map.of("status", "accepted", "source_ref", inbound.resolveSourceRef()));
        } catch (RejectedExecutionException e) {
            log.error("Ingestion queue rejected message: sourceRef={}", inbound.resolveSourceRef(), e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Ingestion unavailable", e.getMessage());
        }
    }

    /**
     * GET /api/messages?status=PENDING|PARKED|IRRELEVANT|CLUSTERED
     */
    @GetMapping
    public ResponseEntity<?> listByStatus(@RequestParam(value = "status", defaultValue = "PENDING") String status) {
        Message.ProcessingStatus filter;
        try {
            filter = Message.ProcessingStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, "Invalid status", "unknown status: " + status);
        }

        try {
            List<Message> messages = issueStore.findMessagesByStatus(filter);
            return ResponseEntity.ok(messages);
        } catch (DataAccessException e) {
            log.error("Error listing messages: status={}", status, e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e.getMessage());
        }
    }

    /**
     * Retry a pending or parked message now
     * POST /api/messages/{id}/retry
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<?> retry(@PathVariable("id") Long id) {
        try {
            IngestionResult result = coordinator.retry(id);
            return ResponseEntity.ok(result);

        } catch (MessageNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, "Message not found", e.getMessage());

        } catch (DataAccessException e) {
            log.error("Error retrying message: id={}", id, e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status)
                .body(Map.of("error", error, "detail", detail != null ? detail : ""));
    }
}
