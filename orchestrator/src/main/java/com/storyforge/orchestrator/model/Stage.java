package com.storyforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One pipeline step of a project.
 *
 * A stage holds at most one live job handle. While status = PROCESSING the
 * handle identifies the job whose completion is allowed to write output;
 * any other completion is stale and gets discarded.
 *
 * DB table: project_stages  (created by Flyway V1, heartbeat_at added in V2)
 */
@Entity
@Table(name = "project_stages",
       uniqueConstraints = @UniqueConstraint(columnNames = {"project_id", "stage_type"}))
public class Stage {

    public static final int DEFAULT_MAX_RETRIES = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    private Project project;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage_type", nullable = false)
    private StageType stageType;

    // Pipeline index; rollback resets this stage and every later one.
    @Column(nullable = false)
    private int position;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageStatus status = StageStatus.PENDING;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "input_data", columnDefinition = "TEXT")
    private Map<String, Object> inputData;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "output_data", columnDefinition = "TEXT")
    private Map<String, Object> outputData;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = DEFAULT_MAX_RETRIES;

    @Column(name = "job_handle")
    private String jobHandle;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Touched periodically while the owning job is alive; recovery fails
    // PROCESSING stages whose heartbeat is too old.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Stage() {}   // required by JPA

    public Stage(Project project, StageType stageType, int position) {
        this.project   = project;
        this.stageType = stageType;
        this.position  = position;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                getId()           { return id; }
    public Project             getProject()      { return project; }
    public StageType           getStageType()    { return stageType; }
    public int                 getPosition()     { return position; }
    public StageStatus         getStatus()       { return status; }
    public Map<String, Object> getInputData()    { return inputData; }
    public Map<String, Object> getOutputData()   { return outputData; }
    public int                 getRetryCount()   { return retryCount; }
    public int                 getMaxRetries()   { return maxRetries; }
    public String              getJobHandle()    { return jobHandle; }
    public String              getErrorMessage() { return errorMessage; }
    public Instant             getCreatedAt()    { return createdAt; }
    public Instant             getStartedAt()    { return startedAt; }
    public Instant             getCompletedAt()  { return completedAt; }
    public Instant             getHeartbeatAt()  { return heartbeatAt; }

    public void setStatus(StageStatus status)              { this.status = status; }
    public void setInputData(Map<String, Object> data)     { this.inputData = data; }
    public void setOutputData(Map<String, Object> data)    { this.outputData = data; }
    public void setRetryCount(int retryCount)              { this.retryCount = retryCount; }
    public void setMaxRetries(int maxRetries)              { this.maxRetries = maxRetries; }
    public void setJobHandle(String jobHandle)             { this.jobHandle = jobHandle; }
    public void setErrorMessage(String errorMessage)       { this.errorMessage = errorMessage; }
    public void setStartedAt(Instant t)                    { this.startedAt = t; }
    public void setCompletedAt(Instant t)                  { this.completedAt = t; }
    public void setHeartbeatAt(Instant t)                  { this.heartbeatAt = t; }

    public boolean hasRetriesLeft() { return retryCount < maxRetries; }

    /** Back to a never-run state; used by rollback and by pause for cancelled jobs. */
    public void resetToPending(boolean clearResults) {
        this.status    = StageStatus.PENDING;
        this.jobHandle   = null;
        this.startedAt   = null;
        this.heartbeatAt = null;
        if (clearResults) {
            this.outputData   = null;
            this.errorMessage = null;
            this.retryCount   = 0;
            this.completedAt  = null;
        }
    }
}
