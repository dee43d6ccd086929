package com.assettrack.inventory.dto;

import com.assettrack.inventory.importer.ImportReport;
import com.assettrack.inventory.importer.ImportRunResult;

import java.util.ArrayList;
import java.util.List;

/** Body of a completed import call, whether or not rows failed. */
public class ImportResponseDTO {
    private boolean success;
    private String message;
    private int totalRows;
    private int importedRows;
    private int failedRows;
    private List<String> errors = new ArrayList<>();
    private boolean aborted;
    private Integer abortedAtRow;
    private Long importRunId;

    public ImportResponseDTO() {}

    public static ImportResponseDTO from(ImportRunResult result) {
        ImportReport report = result.report();
        ImportResponseDTO r = new ImportResponseDTO();
        r.success = report.success();
        r.message = report.message();
        r.totalRows = report.totalRows();
        r.importedRows = report.importedRows();
        r.failedRows = report.failedRows();
        r.errors = report.errors();
        r.aborted = report.aborted();
        r.abortedAtRow = report.abortedAtRow();
        r.importRunId = result.importRunId();
        return r;
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public int getTotalRows() { return totalRows; }
    public int getImportedRows() { return importedRows; }
    public int getFailedRows() { return failedRows; }
    public List<String> getErrors() { return errors; }
    public boolean isAborted() { return aborted; }
    public Integer getAbortedAtRow() { return abortedAtRow; }
    public Long getImportRunId() { return importRunId; }
}
