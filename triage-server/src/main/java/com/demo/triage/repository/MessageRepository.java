package com.demo.triage.repository;

import com.demo.triage.domain.Message;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ingested chat messages
 */
@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    Optional<Message> findBySourceRef(String sourceRef);

    List<Message> findByIssueIdOrderByCreatedAtAscIdAsc(Long issueId);

    List<Message> findByStatusOrderByCreatedAtAsc(Message.ProcessingStatus status);

    long countByRelevantTrue();

    long countByStatus(Message.ProcessingStatus status);

    /**
     * Message count per classification label, unclassified messages excluded
     */
    @Query("SELECT m.classification, COUNT(m) FROM Message m " +
           "WHERE m.classification IS NOT NULL " +
           "GROUP BY m.classification")
    List<Object[]> countByClassification();
}
