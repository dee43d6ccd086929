package com.assettrack.inventory.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDateTime;

@Entity
@Table(name = "asset_assignments", indexes = {
        @Index(name = "idx_assignments_asset_active", columnList = "asset_id, is_active"),
        @Index(name = "idx_assignments_user", columnList = "user_id")
})
public class AssetAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "asset_id", nullable = false, foreignKey = @ForeignKey(name = "fk_assignment_asset"))
    private Asset asset;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false, foreignKey = @ForeignKey(name = "fk_assignment_user"))
    private AppUser user;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    private AssignmentStatus status = AssignmentStatus.ACTIVE;

    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "expected_return_at")
    private LocalDateTime expectedReturnAt;

    private String purpose;

    @Column(name = "assigned_by", length = 100)
    private String assignedBy;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at")
    private Instant createdAt;

    public AssetAssignment() {}

    public AssetAssignment(Asset asset, AppUser user) {
        this.asset = asset;
        this.user = user;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Asset getAsset() { return asset; }
    public void setAsset(Asset asset) { this.asset = asset; }
    public AppUser getUser() { return user; }
    public void setUser(AppUser user) { this.user = user; }
    public AssignmentStatus getStatus() { return status; }
    public void setStatus(AssignmentStatus status) { this.status = status; }
    public Instant getAssignedAt() { return assignedAt; }
    public void setAssignedAt(Instant assignedAt) { this.assignedAt = assignedAt; }
    public LocalDateTime getExpectedReturnAt() { return expectedReturnAt; }
    public void setExpectedReturnAt(LocalDateTime expectedReturnAt) { this.expectedReturnAt = expectedReturnAt; }
    public String getPurpose() { return purpose; }
    public void setPurpose(String purpose) { this.purpose = purpose; }
    public String getAssignedBy() { return assignedBy; }
    public void setAssignedBy(String assignedBy) { this.assignedBy = assignedBy; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
