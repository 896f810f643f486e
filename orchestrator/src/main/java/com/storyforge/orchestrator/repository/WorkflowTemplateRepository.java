package com.storyforge.orchestrator.repository;

import com.storyforge.orchestrator.model.WorkflowTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WorkflowTemplateRepository extends JpaRepository<WorkflowTemplate, UUID> {

    /** Public templates plus the caller's own, newest first. */
    @Query("""
            SELECT t FROM WorkflowTemplate t
            WHERE t.publicTemplate = true OR t.createdBy = :ownerId
            ORDER BY t.createdAt DESC
            """)
    List<WorkflowTemplate> findVisibleTo(@Param("ownerId") String ownerId);

    /** Counted in the database so concurrent applies are not lost. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE WorkflowTemplate t SET t.usageCount = t.usageCount + 1, t.updatedAt = :now
            WHERE t.id = :id
            """)
    int incrementUsage(@Param("id") UUID id, @Param("now") Instant now);
}
