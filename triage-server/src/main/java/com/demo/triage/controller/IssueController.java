package com.demo.triage.controller;

import com.demo.triage.domain.Issue;
import com.demo.triage.domain.IssueStats;
import com.demo.triage.domain.Message;
import com.demo.triage.exception.IssueNotFoundException;
import com.demo.triage.exception.MatchLockTimeoutException;
import com.demo.triage.infrastructure.IssueStore;
import com.demo.triage.service.IngestionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read side of the issue view plus the resolve command.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class IssueController {

    private final IssueStore issueStore;
    private final IngestionCoordinator coordinator;

    public IssueController(IssueStore issueStore, IngestionCoordinator coordinator) {
        this.issueStore = issueStore;
        this.coordinator = coordinator;
    }

    /**
     * List issues, most recently active first
     * GET /api/issues?status=open|resolved
     */
    @GetMapping("/issues")
    public ResponseEntity<?> listIssues(@RequestParam(value = "status", required = false) String status) {
        Issue.IssueStatus filter;
        try {
            filter = parseStatus(status);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, "Invalid status", "status must be open or resolved: " + status);
        }

        try {
            List<Issue> issues = issueStore.listIssues(filter);
            return ResponseEntity.ok(issues);
        } catch (DataAccessException e) {
            log.error("Error listing issues: status={}", status, e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e.getMessage());
        }
    }

    /**
     * GET /api/issues/{id}
     */
    @GetMapping("/issues/{id}")
    public ResponseEntity<?> getIssue(@PathVariable("id") Long id) {
        try {
            return issueStore.getIssue(id)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> error(HttpStatus.NOT_FOUND, "Issue not found", "id=" + id));
        } catch (DataAccessException e) {
            log.error("Error loading issue: id={}", id, e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e.getMessage());
        }
    }

    /**
     * Member messages in arrival order
     * GET /api/issues/{id}/messages
     */
    @GetMapping("/issues/{id}/messages")
    public ResponseEntity<?> getIssueMessages(@PathVariable("id") Long id) {
        try {
            if (issueStore.getIssue(id).isEmpty()) {
                return error(HttpStatus.NOT_FOUND, "Issue not found", "id=" + id);
            }
            List<Message> messages = issueStore.listMessages(id);
            return ResponseEntity.ok(messages);
        } catch (DataAccessException e) {
            log.error("Error loading issue messages: id={}", id, e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e.getMessage());
        }
    }

    /**
     * PUT /api/issues/{id}/resolve
     */
    @PutMapping("/issues/{id}/resolve")
    public ResponseEntity<?> resolveIssue(@PathVariable("id") Long id) {
        try {
            log.info("Resolve requested: issueId={}", id);
            Issue issue = coordinator.resolve(id);
            return ResponseEntity.ok(issue);

        } catch (IssueNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, "Issue not found", e.getMessage());

        } catch (MatchLockTimeoutException e) {
            log.warn("Resolve timed out waiting for match lock: issueId={}", id);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Busy", e.getMessage());

        } catch (DataAccessException e) {
            log.error("Error resolving issue: id={}", id, e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e.getMessage());
        }
    }

    /**
     * Dashboard counters
     * GET /api/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        try {
            IssueStats stats = issueStore.stats();
            return ResponseEntity.ok(stats);
        } catch (DataAccessException e) {
            log.error("Error computing stats", e);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e.getMessage());
        }
    }

    static Issue.IssueStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        return Issue.IssueStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status)
                .body(Map.of("error", error, "detail", detail != null ? detail : ""));
    }
}
