package com.storyforge.orchestrator.repository;

import com.storyforge.orchestrator.model.Stage;
import com.storyforge.orchestrator.model.StageStatus;
import com.storyforge.orchestrator.model.StageType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + dispatch-claim queries for the project_stages table.
 *
 * The claim queries are the per-stage mutual exclusion: only the caller that
 * flips the row to PROCESSING may submit a job for it.
 */
public interface StageRepository extends JpaRepository<Stage, UUID> {

    /** All stages of a project, in pipeline order. */
    List<Stage> findByProjectIdOrderByPositionAsc(UUID projectId);

    Optional<Stage> findByProjectIdAndStageType(UUID projectId, StageType stageType);

    /** Stages in the given statuses, oldest first (position breaks ties for rows created together). */
    List<Stage> findByProjectIdAndStatusInOrderByCreatedAtAscPositionAsc(UUID projectId,
                                                                        Collection<StageStatus> statuses);

    /** Row-locked read for read-modify-write updates. Caller must be @Transactional. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Stage s WHERE s.id = :id")
    Optional<Stage> findForUpdate(@Param("id") UUID id);

    /**
     * Flip a stage to PROCESSING unless it already is.
     *
     * @return 1 if this caller won the claim, 0 if the stage was already processing
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Stage s
            SET s.status = :processing, s.startedAt = :now, s.heartbeatAt = :now, s.completedAt = NULL,
                s.errorMessage = NULL, s.jobHandle = NULL
            WHERE s.id = :id AND s.status <> :processing
            """)
    int claim(@Param("id") UUID id,
              @Param("processing") StageStatus processing,
              @Param("now") Instant now);

    /**
     * Same as {@link #claim} but also consumes one retry; refuses once the
     * retry budget is spent.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Stage s
            SET s.status = :processing, s.startedAt = :now, s.heartbeatAt = :now, s.completedAt = NULL,
                s.errorMessage = NULL, s.jobHandle = NULL, s.retryCount = s.retryCount + 1
            WHERE s.id = :id AND s.status <> :processing AND s.retryCount < s.maxRetries
            """)
    int claimForRetry(@Param("id") UUID id,
                      @Param("processing") StageStatus processing,
                      @Param("now") Instant now);

    /** Record the job handle on a stage this caller has just claimed. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Stage s SET s.jobHandle = :handle, s.heartbeatAt = :now
            WHERE s.id = :id AND s.status = :processing
            """)
    int assignHandle(@Param("id") UUID id,
                     @Param("handle") String handle,
                     @Param("processing") StageStatus processing,
                     @Param("now") Instant now);

    /** Mark the stages owned by these live jobs as alive. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Stage s SET s.heartbeatAt = :now
            WHERE s.status = :processing AND s.jobHandle IN :handles
            """)
    int touchHeartbeats(@Param("handles") Collection<String> handles,
                        @Param("processing") StageStatus processing,
                        @Param("now") Instant now);

    /** Processing stages nobody has vouched for since {@code cutoff}. */
    @Query("""
            SELECT s FROM Stage s JOIN FETCH s.project
            WHERE s.status = :processing AND COALESCE(s.heartbeatAt, s.startedAt) < :cutoff
            ORDER BY s.startedAt
            """)
    List<Stage> findStalled(@Param("processing") StageStatus processing,
                            @Param("cutoff") Instant cutoff);
}
