package com.assettrack.inventory.dto;

/** One failed row of a run; {@code rawData} is the line as it appeared in the payload. */
public class ImportErrorDTO {
    private Long id;
    private Integer rowNumber;
    private String failureKind;
    private String errorMessage;
    private String rawData;

    public ImportErrorDTO() {}

    public ImportErrorDTO(Long id, Integer rowNumber, String failureKind, String errorMessage, String rawData) {
        this.id = id;
        this.rowNumber = rowNumber;
        this.failureKind = failureKind;
        this.errorMessage = errorMessage;
        this.rawData = rawData;
    }

    public Long getId() { return id; }
    public Integer getRowNumber() { return rowNumber; }
    public String getFailureKind() { return failureKind; }
    public String getErrorMessage() { return errorMessage; }
    public String getRawData() { return rawData; }
}
