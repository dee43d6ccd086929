package com.assettrack.inventory.dto;

import java.time.Instant;

public class ImportRunSummaryDTO {
    private Long id;
    private String kind;
    private String status;
    private Integer rowsTotal;
    private Integer rowsSuccess;
    private Integer rowsFailed;
    private Integer abortedAtRow;
    private String notes;
    private String createdBy;
    private Instant startedAt;
    private Instant finishedAt;

    public ImportRunSummaryDTO() {}

    public ImportRunSummaryDTO(Long id, String kind, String status, Integer rowsTotal, Integer rowsSuccess, Integer rowsFailed,
                               Integer abortedAtRow, String notes, String createdBy, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.kind = kind;
        this.status = status;
        this.rowsTotal = rowsTotal;
        this.rowsSuccess = rowsSuccess;
        this.rowsFailed = rowsFailed;
        this.abortedAtRow = abortedAtRow;
        this.notes = notes;
        this.createdBy = createdBy;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public Long getId() { return id; }
    public String getKind() { return kind; }
    public String getStatus() { return status; }
    public Integer getRowsTotal() { return rowsTotal; }
    public Integer getRowsSuccess() { return rowsSuccess; }
    public Integer getRowsFailed() { return rowsFailed; }
    public Integer getAbortedAtRow() { return abortedAtRow; }
    public String getNotes() { return notes; }
    public String getCreatedBy() { return createdBy; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}
