package com.storyforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Result of one node within one execution, written as soon as the node
 * finishes. The set of rows for an execution is its results map; resume
 * rebuilds its upstream inputs from here.
 *
 * DB table: workflow_node_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_node_results",
       uniqueConstraints = @UniqueConstraint(columnNames = {"execution_id", "node_id"}))
public class NodeResultRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false)
    private UUID executionId;

    @Column(name = "node_id", nullable = false)
    private String nodeId;

    // Node status name: COMPLETED or FAILED.
    @Column(nullable = false)
    private String status;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> outputs;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt = Instant.now();

    protected NodeResultRecord() {}   // required by JPA

    public NodeResultRecord(UUID executionId, String nodeId, String status,
                            Map<String, Object> outputs, String error, Instant recordedAt) {
        this.executionId = executionId;
        this.nodeId      = nodeId;
        this.status      = status;
        this.outputs     = outputs;
        this.error       = error;
        this.recordedAt  = recordedAt;
    }

    /** Overwrite with a newer outcome of the same node in the same execution. */
    public void replace(String status, Map<String, Object> outputs, String error, Instant recordedAt) {
        this.status     = status;
        this.outputs    = outputs;
        this.error      = error;
        this.recordedAt = recordedAt;
    }

    public UUID                getId()          { return id; }
    public UUID                getExecutionId() { return executionId; }
    public String              getNodeId()      { return nodeId; }
    public String              getStatus()      { return status; }
    public Map<String, Object> getOutputs()     { return outputs; }
    public String              getError()       { return error; }
    public Instant             getRecordedAt()  { return recordedAt; }
}
