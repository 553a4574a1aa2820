package com.demo.triage.infrastructure;

import com.demo.triage.domain.Issue;
import com.demo.triage.domain.IssueStats;
import com.demo.triage.domain.Message;
import com.demo.triage.exception.DuplicateMessageException;
import com.demo.triage.exception.IssueIntegrityException;
import com.demo.triage.exception.IssueNotFoundException;
import com.demo.triage.exception.MessageNotFoundException;
import com.demo.triage.repository.IssueRepository;
import com.demo.triage.repository.MessageRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Issue store backed by Spring Data JPA.
 */
@Component
@Slf4j
public class JpaIssueStore implements IssueStore {

    private final IssueRepository issueRepository;
    private final MessageRepository messageRepository;

    public JpaIssueStore(IssueRepository issueRepository,
                         MessageRepository messageRepository) {
        this.issueRepository = issueRepository;
        this.messageRepository = messageRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findMessageBySourceRef(String sourceRef) {
        return messageRepository.findBySourceRef(sourceRef);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Message> findMessage(Long messageId) {
        return messageRepository.findById(messageId);
    }

    /**
     * Not transactional here: the unique constraint violation must surface from the
     * repository's own transaction so it can be translated.
     */
    @Override
    public Message insertMessage(Message message) {
        try {
            Message saved = messageRepository.saveAndFlush(message);
            log.debug("Inserted message: id={}, sourceRef={}", saved.getId(), saved.getSourceRef());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateMessageException(message.getSourceRef(), e);
        }
    }

    @Override
    @Transactional
    public Message saveMessage(Message message) {
        if (message.getId() == null) {
            throw new IllegalArgumentException("saveMessage requires a stored message");
        }
        Message stored = messageRepository.findById(message.getId())
                .orElseThrow(() -> new MessageNotFoundException(message.getId()));
        if (!stored.isAwaitingProcessing()) {
            throw new IssueIntegrityException("Message " + stored.getId()
                    + " already finished with status " + stored.getStatus());
        }
        return messageRepository.save(message);
    }

    @Override
    @Transactional
    public Issue createIssue(Issue issue, Message seed) {
        Message stored = loadUnassigned(seed);
        Issue saved = issueRepository.save(issue);
        linkToIssue(seed, stored, saved);
        log.debug("Created issue: id={}, seedMessage={}", saved.getId(), seed.getId());
        return saved;
    }

    @Override
    @Transactional
    public Issue appendMessageToIssue(Issue issue, Message message) {
        if (issue.getId() == null || !issueRepository.existsById(issue.getId())) {
            throw new IssueNotFoundException(issue.getId());
        }
        Message stored = loadUnassigned(message);
        Issue saved = issueRepository.save(issue);
        linkToIssue(message, stored, saved);
        log.debug("Appended message to issue: issueId={}, messageId={}, members={}",
                saved.getId(), message.getId(), saved.getMemberCount());
        return saved;
    }

    @Override
    @Transactional
    public Issue updateIssueStatus(Long issueId, Issue.IssueStatus status, Instant at) {
        Issue issue = issueRepository.findById(issueId)
                .orElseThrow(() -> new IssueNotFoundException(issueId));
        if (status == Issue.IssueStatus.RESOLVED) {
            issue.resolve(at);
        } else {
            issue.reopen(at);
        }
        return issueRepository.save(issue);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Issue> listOpenIssuesWithEmbeddings() {
        return issueRepository.findCandidates(EnumSet.of(Issue.IssueStatus.OPEN));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Issue> listMatchCandidates(boolean includeResolved) {
        if (!includeResolved) {
            return listOpenIssuesWithEmbeddings();
        }
        return issueRepository.findCandidates(EnumSet.allOf(Issue.IssueStatus.class));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Issue> getIssue(Long issueId) {
        return issueRepository.findById(issueId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Issue> listIssues(Issue.IssueStatus status) {
        if (status == null) {
            return issueRepository.findAllByOrderByUpdatedAtDesc();
        }
        return issueRepository.findByStatusOrderByUpdatedAtDesc(status);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> listMessages(Long issueId) {
        return messageRepository.findByIssueIdOrderByCreatedAtAscIdAsc(issueId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Message> findMessagesByStatus(Message.ProcessingStatus status) {
        return messageRepository.findByStatusOrderByCreatedAtAsc(status);
    }

    @Override
    @Transactional(readOnly = true)
    public IssueStats stats() {
        Map<String, Long> classifications = new LinkedHashMap<>();
        for (Object[] row : messageRepository.countByClassification()) {
            classifications.put((String) row[0], ((Number) row[1]).longValue());
        }
        return IssueStats.builder()
                .totalIssues(issueRepository.count())
                .openIssues(issueRepository.countByStatus(Issue.IssueStatus.OPEN))
                .resolvedIssues(issueRepository.countByStatus(Issue.IssueStatus.RESOLVED))
                .totalMessages(messageRepository.count())
                .relevantMessages(messageRepository.countByRelevantTrue())
                .pendingMessages(messageRepository.countByStatus(Message.ProcessingStatus.PENDING)
                        + messageRepository.countByStatus(Message.ProcessingStatus.PARKED))
                .classifications(classifications)
                .build();
    }

    private Message loadUnassigned(Message message) {
        Message stored = messageRepository.findById(message.getId())
                .orElseThrow(() -> new MessageNotFoundException(message.getId()));
        if (stored.getIssueId() != null) {
            throw new IssueIntegrityException("Message " + stored.getId()
                    + " already belongs to issue " + stored.getIssueId());
        }
        return stored;
    }

    private void linkToIssue(Message source, Message stored, Issue issue) {
        stored.setClassification(source.getClassification());
        stored.setConfidence(source.getConfidence());
        stored.setRelevant(source.getRelevant());
        stored.setSummary(source.getSummary());
        stored.setEmbedding(source.getEmbedding());
        stored.setIssueId(issue.getId());
        stored.setStatus(Message.ProcessingStatus.CLUSTERED);
        stored.setLastError(null);
        messageRepository.save(stored);
        source.setIssueId(issue.getId());
        source.setStatus(Message.ProcessingStatus.CLUSTERED);
        source.setLastError(null);
    }
}
