package com.patchpilot.orchestrator.repository;

import com.patchpilot.orchestrator.model.UsageEntry;
import com.patchpilot.orchestrator.model.UsageKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Period totals for admission control. Windows are half-open: [from, to).
 */
public interface UsageEntryRepository extends JpaRepository<UsageEntry, UUID> {

    @Query("""
            SELECT COUNT(u) FROM UsageEntry u
            WHERE u.kind = :kind
              AND u.occurredAt >= :from AND u.occurredAt < :to
            """)
    long countInWindow(@Param("kind") UsageKind kind,
                       @Param("from") Instant from,
                       @Param("to") Instant to);

    @Query("""
            SELECT COUNT(u) FROM UsageEntry u
            WHERE u.kind = :kind AND u.projectId = :projectId
              AND u.occurredAt >= :from AND u.occurredAt < :to
            """)
    long countInWindowForProject(@Param("kind") UsageKind kind,
                                 @Param("projectId") String projectId,
                                 @Param("from") Instant from,
                                 @Param("to") Instant to);

    @Query("""
            SELECT COALESCE(SUM(u.amountUsd), 0.0) FROM UsageEntry u
            WHERE u.kind = :kind
              AND u.occurredAt >= :from AND u.occurredAt < :to
            """)
    double sumInWindow(@Param("kind") UsageKind kind,
                       @Param("from") Instant from,
                       @Param("to") Instant to);

    /** Rows of {projectId, count}. */
    @Query("""
            SELECT u.projectId, COUNT(u) FROM UsageEntry u
            WHERE u.kind = :kind
              AND u.occurredAt >= :from AND u.occurredAt < :to
            GROUP BY u.projectId
            """)
    List<Object[]> countByProjectInWindow(@Param("kind") UsageKind kind,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to);
}
