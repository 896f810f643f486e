package com.storyforge.orchestrator.repository;

import com.storyforge.orchestrator.model.NodeResultRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NodeResultRepository extends JpaRepository<NodeResultRecord, UUID> {

    /** Results of one execution in the order nodes finished. */
    List<NodeResultRecord> findByExecutionIdOrderByRecordedAtAsc(UUID executionId);

    Optional<NodeResultRecord> findByExecutionIdAndNodeId(UUID executionId, String nodeId);
}
