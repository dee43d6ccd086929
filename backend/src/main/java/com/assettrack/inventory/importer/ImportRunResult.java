package com.assettrack.inventory.importer;

/** The report of a run together with the id of its audit record. */
public record ImportRunResult(Long importRunId, ImportReport report) {
}
