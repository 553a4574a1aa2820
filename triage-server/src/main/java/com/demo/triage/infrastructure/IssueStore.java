package com.demo.triage.infrastructure;

import com.demo.triage.domain.Issue;
import com.demo.triage.domain.IssueStats;
import com.demo.triage.domain.Message;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable collection of issues and messages.
 *
 * <p>Every write is atomic at the aggregate level. Returned entities are detached
 * snapshots: mutating them has no effect until they are passed back to a write method.
 */
public interface IssueStore {

    Optional<Message> findMessageBySourceRef(String sourceRef);

    Optional<Message> findMessage(Long messageId);

    /**
     * Inserts a new message.
     *
     * @throws com.demo.triage.exception.DuplicateMessageException if the source reference is taken
     */
    Message insertMessage(Message message);

    /**
     * Persists processing fields of an already stored message.
     *
     * @throws com.demo.triage.exception.IssueIntegrityException if the stored row is already
     *         {@code CLUSTERED} or {@code IRRELEVANT}
     */
    Message saveMessage(Message message);

    /**
     * Inserts the issue and links its seed message to it in one transaction.
     *
     * @throws com.demo.triage.exception.IssueIntegrityException if the seed already belongs to an issue
     */
    Issue createIssue(Issue issue, Message seed);

    /**
     * Saves the updated issue and links the message to it in one transaction.
     *
     * @throws com.demo.triage.exception.IssueIntegrityException if the message already belongs to an issue
     */
    Issue appendMessageToIssue(Issue issue, Message message);

    /**
     * @throws com.demo.triage.exception.IssueNotFoundException if no such issue exists
     */
    Issue updateIssueStatus(Long issueId, Issue.IssueStatus status, Instant at);

    List<Issue> listOpenIssuesWithEmbeddings();

    /**
     * Open issues, plus resolved ones when {@code includeResolved} is set.
     */
    List<Issue> listMatchCandidates(boolean includeResolved);

    Optional<Issue> getIssue(Long issueId);

    /**
     * All issues when {@code status} is null, most recently active first.
     */
    List<Issue> listIssues(Issue.IssueStatus status);

    List<Message> listMessages(Long issueId);

    List<Message> findMessagesByStatus(Message.ProcessingStatus status);

    IssueStats stats();
}
