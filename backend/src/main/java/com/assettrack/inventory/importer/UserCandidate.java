package com.assettrack.inventory.importer;

public record UserCandidate(
        String id,
        String name,
        String email,
        String department,
        String jobTitle,
        String employeeId,
        String phone,
        String role,
        boolean active
) implements CandidateRecord {

    @Override
    public ImportKind kind() { return ImportKind.USERS; }
}
