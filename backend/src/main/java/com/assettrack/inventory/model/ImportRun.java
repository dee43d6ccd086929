package com.assettrack.inventory.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "import_run", indexes = {
        @Index(name = "idx_importrun_started_at", columnList = "started_at")
})
public class ImportRun {
    public static final String STATUS_IN_PROGRESS = "IN_PROGRESS";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_ABORTED = "ABORTED";
    public static final String STATUS_FAILED = "FAILED";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 32, nullable = false)
    private String kind; // assets | users | assignments

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_by", length = 100)
    private String createdBy; // caller identity passed in with the request

    @Column(name = "has_headers", nullable = false)
    private boolean hasHeaders;

    @Column(name = "skip_errors", nullable = false)
    private boolean skipErrors;

    @Column(name = "rows_total")
    private Integer rowsTotal = 0;

    @Column(name = "rows_success")
    private Integer rowsSuccess = 0;

    @Column(name = "rows_failed")
    private Integer rowsFailed = 0;

    @Column(name = "aborted_at_row")
    private Integer abortedAtRow;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 32)
    private String status = STATUS_IN_PROGRESS;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public boolean isHasHeaders() { return hasHeaders; }
    public void setHasHeaders(boolean hasHeaders) { this.hasHeaders = hasHeaders; }
    public boolean isSkipErrors() { return skipErrors; }
    public void setSkipErrors(boolean skipErrors) { this.skipErrors = skipErrors; }
    public Integer getRowsTotal() { return rowsTotal; }
    public void setRowsTotal(Integer rowsTotal) { this.rowsTotal = rowsTotal; }
    public Integer getRowsSuccess() { return rowsSuccess; }
    public void setRowsSuccess(Integer rowsSuccess) { this.rowsSuccess = rowsSuccess; }
    public Integer getRowsFailed() { return rowsFailed; }
    public void setRowsFailed(Integer rowsFailed) { this.rowsFailed = rowsFailed; }
    public Integer getAbortedAtRow() { return abortedAtRow; }
    public void setAbortedAtRow(Integer abortedAtRow) { this.abortedAtRow = abortedAtRow; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
