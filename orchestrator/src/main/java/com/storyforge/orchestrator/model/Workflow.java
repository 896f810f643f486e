package com.storyforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The user-assembled node graph of a project (one per project).
 *
 * graph_json is the editor's {nodes, edges} document; it is rejected for
 * update while the workflow is RUNNING.
 *
 * template_id records the template the graph was last copied from, if any.
 *
 * DB table: workflows  (created by Flyway V1 migration, template_id added in V3)
 */
@Entity
@Table(name = "workflows")
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_id", nullable = false, unique = true)
    private UUID projectId;

    @Column(name = "graph_json", nullable = false, columnDefinition = "TEXT")
    private String graphJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowStatus status = WorkflowStatus.DRAFT;

    // Last node that finished (or was running) when the workflow stopped.
    @Column(name = "current_node_id")
    private String currentNodeId;

    @Column(name = "template_id")
    private UUID templateId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected Workflow() {}   // required by JPA

    public Workflow(UUID projectId, String graphJson) {
        this.projectId = projectId;
        this.graphJson = graphJson;
    }

    public UUID           getId()            { return id; }
    public UUID           getProjectId()     { return projectId; }
    public String         getGraphJson()     { return graphJson; }
    public WorkflowStatus getStatus()        { return status; }
    public String         getCurrentNodeId() { return currentNodeId; }
    public UUID           getTemplateId()    { return templateId; }
    public Instant        getCreatedAt()     { return createdAt; }
    public Instant        getUpdatedAt()     { return updatedAt; }

    public void setGraphJson(String graphJson)         { this.graphJson = graphJson; }
    public void setStatus(WorkflowStatus status)       { this.status = status; }
    public void setCurrentNodeId(String currentNodeId) { this.currentNodeId = currentNodeId; }
    public void setTemplateId(UUID templateId)         { this.templateId = templateId; }
}
