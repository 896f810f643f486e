package com.storyforge.orchestrator.repository;

import com.storyforge.orchestrator.model.WorkflowExecution;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecution, UUID> {

    /** Newest execution of a workflow; the one pause/resume act on. */
    Optional<WorkflowExecution> findFirstByWorkflowIdOrderByCreatedAtDesc(UUID workflowId);

    /** Execution history, newest first. */
    List<WorkflowExecution> findTop20ByWorkflowIdOrderByCreatedAtDesc(UUID workflowId);
}
