package com.assettrack.inventory.importer;

import java.util.List;

/**
 * Aggregate outcome of one import run.
 *
 * <p>{@code errors} lists at most the first {@code maxReportedErrors} failure messages while
 * {@code failedRows} counts every failure. A run that stopped on a failure with rows left over
 * has {@code aborted == true}, {@code abortedAtRow} pointing at the failing row, and
 * {@code importedRows + failedRows < totalRows}.
 */
public record ImportReport(
        int totalRows,
        int importedRows,
        int failedRows,
        List<String> errors,
        boolean success,
        boolean aborted,
        Integer abortedAtRow
) {

    public ImportReport {
        errors = List.copyOf(errors);
    }

    public static ImportReport from(int totalRows, List<RowOutcome> outcomes, boolean skipErrors, int maxReportedErrors) {
        int imported = (int) outcomes.stream().filter(o -> !o.isFailed()).count();
        int failed = outcomes.size() - imported;
        List<String> errors = outcomes.stream()
                .filter(RowOutcome::isFailed)
                .map(RowOutcome::message)
                .limit(Math.max(0, maxReportedErrors))
                .toList();
        boolean success = failed == 0 || (skipErrors && imported > 0);
        boolean aborted = imported + failed < totalRows;
        Integer abortedAtRow = aborted && !outcomes.isEmpty() ? outcomes.get(outcomes.size() - 1).rowIndex() : null;
        return new ImportReport(totalRows, imported, failed, errors, success, aborted, abortedAtRow);
    }

    public String message() {
        return "Import completed. " + importedRows + " records imported, " + failedRows + " failed.";
    }
}
