package com.storyforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One run of a workflow graph.
 *
 * A resume never reopens an old execution; it creates a new one pointing at
 * the previous run through resumed_from and seeds it with that run's
 * completed node results.
 *
 * DB table: workflow_executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_executions")
public class WorkflowExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "workflow_id", nullable = false)
    private Workflow workflow;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    @Column(name = "job_handle")
    private String jobHandle;

    @Convert(converter = ExecutionLogConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<ExecutionLogEntry> logs = new ArrayList<>();

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "resumed_from")
    private UUID resumedFrom;

    // Log appends come from the worker thread while pause may touch the row.
    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected WorkflowExecution() {}   // required by JPA

    public WorkflowExecution(Workflow workflow, UUID resumedFrom) {
        this.workflow    = workflow;
        this.resumedFrom = resumedFrom;
    }

    public UUID                    getId()           { return id; }
    public Workflow                getWorkflow()     { return workflow; }
    public ExecutionStatus         getStatus()       { return status; }
    public String                  getJobHandle()    { return jobHandle; }
    public List<ExecutionLogEntry> getLogs()         { return logs; }
    public String                  getErrorMessage() { return errorMessage; }
    public UUID                    getResumedFrom()  { return resumedFrom; }
    public Instant                 getCreatedAt()    { return createdAt; }
    public Instant                 getStartedAt()    { return startedAt; }
    public Instant                 getCompletedAt()  { return completedAt; }

    public void setStatus(ExecutionStatus status)     { this.status = status; }
    public void setJobHandle(String jobHandle)        { this.jobHandle = jobHandle; }
    public void setErrorMessage(String errorMessage)  { this.errorMessage = errorMessage; }
    public void setStartedAt(Instant t)               { this.startedAt = t; }
    public void setCompletedAt(Instant t)             { this.completedAt = t; }

    // Reassign rather than mutate so Hibernate sees the converted column as dirty.
    public void appendLog(ExecutionLogEntry entry) {
        List<ExecutionLogEntry> next = new ArrayList<>(logs);
        next.add(entry);
        this.logs = next;
    }

    /** The last {@code n} log lines, oldest first. */
    public List<ExecutionLogEntry> tailLogs(int n) {
        return logs.subList(Math.max(0, logs.size() - n), logs.size());
    }
}
