package com.storyforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A content project: owns one Stage per pipeline entry.
 *
 * Status only changes through PipelineService and StageCompletionService,
 * which use conditional updates so concurrent requests cannot both win
 * the same transition.
 *
 * DB table: projects  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "projects")
public class Project {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    // Opaque user id; forwarded to the dispatcher for attribution only.
    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProjectStatus status = ProjectStatus.DRAFT;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Project() {}   // required by JPA

    public Project(String name, String ownerId) {
        this.name    = name;
        this.ownerId = ownerId;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()          { return id; }
    public String        getName()        { return name; }
    public String        getOwnerId()     { return ownerId; }
    public ProjectStatus getStatus()      { return status; }
    public Instant       getCreatedAt()   { return createdAt; }
    public Instant       getUpdatedAt()   { return updatedAt; }
    public Instant       getCompletedAt() { return completedAt; }

    public void setStatus(ProjectStatus status)   { this.status = status; }
    public void setCompletedAt(Instant t)         { this.completedAt = t; }
}
