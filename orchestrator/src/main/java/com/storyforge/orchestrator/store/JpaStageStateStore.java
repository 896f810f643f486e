package com.storyforge.orchestrator.store;

import com.storyforge.orchestrator.error.NotFoundException;
import com.storyforge.orchestrator.error.ErrorCode;
import com.storyforge.orchestrator.model.*;
import com.storyforge.orchestrator.repository.ProjectRepository;
import com.storyforge.orchestrator.repository.StageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Relational implementation of {@link StageStateStore}.
 *
 * Methods join the caller's transaction when there is one, so a service
 * method can claim a stage, flip the project and submit a job atomically.
 * The conditional UPDATE statements rely on the database's row locking:
 * a second writer blocks on the row, re-evaluates the WHERE clause after the
 * first commits, and updates 0 rows.
 */
@Component
public class JpaStageStateStore implements StageStateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaStageStateStore.class);

    private final ProjectRepository projectRepo;
    private final StageRepository   stageRepo;

    public JpaStageStateStore(ProjectRepository projectRepo, StageRepository stageRepo) {
        this.projectRepo = projectRepo;
        this.stageRepo   = stageRepo;
    }

    @Override
    @Transactional
    public Project createProject(String name, String ownerId) {
        Project project = projectRepo.save(new Project(name, ownerId));
        for (int i = 0; i < StageType.PIPELINE.size(); i++) {
            Stage stage = new Stage(project, StageType.PIPELINE.get(i), i);
            stageRepo.save(stage);
        }
        log.info("Created project {} with {} stages", project.getId(), StageType.PIPELINE.size());
        return project;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Project> findProject(UUID projectId) {
        return projectRepo.findById(projectId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Stage> findStage(UUID projectId, StageType stageType) {
        return stageRepo.findByProjectIdAndStageType(projectId, stageType);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Stage> listStages(UUID projectId) {
        return stageRepo.findByProjectIdOrderByPositionAsc(projectId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Stage> listResumableStages(UUID projectId) {
        return stageRepo.findByProjectIdAndStatusInOrderByCreatedAtAscPositionAsc(
                projectId, StageStatus.RESUMABLE);
    }

    @Override
    @Transactional
    public Stage updateStage(UUID stageId, Consumer<Stage> mutation) {
        Stage stage = stageRepo.findForUpdate(stageId).orElseThrow(() ->
                new NotFoundException(ErrorCode.STAGE_NOT_FOUND, "Stage not found: " + stageId));
        mutation.accept(stage);
        return stageRepo.save(stage);
    }

    @Override
    @Transactional
    public boolean transitionProject(UUID projectId, Set<ProjectStatus> from, ProjectStatus to) {
        Instant now = Instant.now();
        boolean moved = projectRepo.transition(projectId, from, to, now) == 1;
        if (moved && to == ProjectStatus.COMPLETED) {
            projectRepo.markCompletedAt(projectId, now);
        }
        if (moved) {
            log.debug("Project {} -> {}", projectId, to);
        }
        return moved;
    }

    @Override
    @Transactional
    public boolean claimStage(UUID stageId) {
        return stageRepo.claim(stageId, StageStatus.PROCESSING, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public boolean claimStageForRetry(UUID stageId) {
        return stageRepo.claimForRetry(stageId, StageStatus.PROCESSING, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public boolean assignHandle(UUID stageId, String jobHandle) {
        return stageRepo.assignHandle(stageId, jobHandle, StageStatus.PROCESSING, Instant.now()) == 1;
    }

    @Override
    @Transactional
    public int touchHeartbeats(Collection<String> jobHandles) {
        if (jobHandles.isEmpty()) {
            return 0;
        }
        return stageRepo.touchHeartbeats(jobHandles, StageStatus.PROCESSING, Instant.now());
    }

    @Override
    @Transactional(readOnly = true)
    public List<Stage> listStalledStages(Instant cutoff) {
        return stageRepo.findStalled(StageStatus.PROCESSING, cutoff);
    }
}
