package com.storyforge.orchestrator.repository;

import com.storyforge.orchestrator.model.Workflow;
import com.storyforge.orchestrator.model.WorkflowStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    Optional<Workflow> findByProjectId(UUID projectId);

    /** Conditional status change; see ProjectRepository#transition. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Workflow w SET w.status = :to, w.updatedAt = :now
            WHERE w.id = :id AND w.status IN :from
            """)
    int transition(@Param("id") UUID id,
                   @Param("from") Collection<WorkflowStatus> from,
                   @Param("to") WorkflowStatus to,
                   @Param("now") Instant now);

    /** Touches only current_node_id so a concurrent pause is never overwritten. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Workflow w SET w.currentNodeId = :nodeId, w.updatedAt = :now WHERE w.id = :id")
    int markCurrentNode(@Param("id") UUID id, @Param("nodeId") String nodeId, @Param("now") Instant now);
}
