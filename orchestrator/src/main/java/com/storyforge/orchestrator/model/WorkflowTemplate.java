package com.storyforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A saved {nodes, edges} graph that can be copied into any project's workflow.
 *
 * Public templates are listed to everyone; private ones only to their creator.
 *
 * DB table: workflow_templates  (created by Flyway V3 migration)
 */
@Entity
@Table(name = "workflow_templates")
public class WorkflowTemplate {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description = "";

    @Column(name = "graph_json", nullable = false, columnDefinition = "TEXT")
    private String graphJson;

    @Column(name = "preview_image", nullable = false, length = 512)
    private String previewImage = "";

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "is_public", nullable = false)
    private boolean publicTemplate;

    @Column(name = "usage_count", nullable = false)
    private int usageCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    protected WorkflowTemplate() {}   // required by JPA

    public WorkflowTemplate(String name, String description, String graphJson,
                            String previewImage, String createdBy, boolean publicTemplate) {
        this.name           = name;
        this.description    = description == null ? "" : description;
        this.graphJson      = graphJson;
        this.previewImage   = previewImage == null ? "" : previewImage;
        this.createdBy      = createdBy;
        this.publicTemplate = publicTemplate;
    }

    public UUID    getId()           { return id; }
    public String  getName()         { return name; }
    public String  getDescription()  { return description; }
    public String  getGraphJson()    { return graphJson; }
    public String  getPreviewImage() { return previewImage; }
    public String  getCreatedBy()    { return createdBy; }
    public boolean isPublic()        { return publicTemplate; }
    public int     getUsageCount()   { return usageCount; }
    public Instant getCreatedAt()    { return createdAt; }
    public Instant getUpdatedAt()    { return updatedAt; }
}
