package com.demo.triage.repository;

import com.demo.triage.domain.Issue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for Issue aggregates
 */
@Repository
public interface IssueRepository extends JpaRepository<Issue, Long> {

    /**
     * Match candidates, most recently active first
     */
    @Query("SELECT i FROM Issue i " +
           "WHERE i.status IN :statuses " +
           "ORDER BY i.updatedAt DESC, i.id ASC")
    List<Issue> findCandidates(@Param("statuses") Collection<Issue.IssueStatus> statuses);

    List<Issue> findByStatusOrderByUpdatedAtDesc(Issue.IssueStatus status);

    List<Issue> findAllByOrderByUpdatedAtDesc();

    long countByStatus(Issue.IssueStatus status);
}
