package com.assettrack.inventory.importer;

/**
 * One bulk import as submitted by a caller. {@code importType} is kept as received so an
 * unknown kind can be reported as a request error; {@code notes} is carried to the audit
 * record untouched.
 */
public record ImportRequest(String importType, boolean hasHeaders, boolean skipErrors, String payload, String notes) {
}
