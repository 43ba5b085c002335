package com.labvault.lims.model;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_log", indexes = {
        @Index(name = "idx_audit_log_created_at", columnList = "created_at")
})
public class AuditEntry {
    public static final String SEQUENCING_IMPORT = "SEQUENCING_IMPORT";
    public static final String SEQUENCING_RUN_DELETE = "SEQUENCING_RUN_DELETE";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "action", length = 64, nullable = false)
    private String action;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "entity_id")
    private Long entityId;

    @Column(name = "params", columnDefinition = "text")
    private String params;

    @Column(name = "affected_count")
    private Long affectedCount;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Long getEntityId() { return entityId; }
    public void setEntityId(Long entityId) { this.entityId = entityId; }

    public String getParams() { return params; }
    public void setParams(String params) { this.params = params; }

    public Long getAffectedCount() { return affectedCount; }
    public void setAffectedCount(Long affectedCount) { this.affectedCount = affectedCount; }
}
