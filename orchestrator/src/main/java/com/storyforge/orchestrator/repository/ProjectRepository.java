package com.storyforge.orchestrator.repository;

import com.storyforge.orchestrator.model.Project;
import com.storyforge.orchestrator.model.ProjectStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

/**
 * CRUD + conditional status transitions for the projects table.
 */
public interface ProjectRepository extends JpaRepository<Project, UUID> {

    /**
     * Move a project to {@code to} only if its current status is one of {@code from}.
     *
     * The WHERE clause is the status check, so check and write happen in one
     * statement. A concurrent writer that loses the race sees 0 rows updated.
     *
     * @return number of rows updated (0 or 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Project p
            SET p.status = :to, p.updatedAt = :now
            WHERE p.id = :id AND p.status IN :from
            """)
    int transition(@Param("id") UUID id,
                   @Param("from") Collection<ProjectStatus> from,
                   @Param("to") ProjectStatus to,
                   @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Project p SET p.completedAt = :at WHERE p.id = :id")
    int markCompletedAt(@Param("id") UUID id, @Param("at") Instant at);
}
