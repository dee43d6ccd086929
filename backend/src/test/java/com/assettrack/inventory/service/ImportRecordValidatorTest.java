package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.AssetCandidate;
import com.assettrack.inventory.importer.AssignmentCandidate;
import com.assettrack.inventory.importer.Coerced;
import com.assettrack.inventory.importer.UserCandidate;
import com.assettrack.inventory.importer.ValueCoercion;
import com.assettrack.inventory.service.ImportRecordValidator.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class ImportRecordValidatorTest {

    private final ImportRecordValidator validator = new ImportRecordValidator();

    private static AssetCandidate asset(String tag, String name, String category, String price, String status) {
        return new AssetCandidate(tag, name, category, null, null, null, null, Coerced.missing(),
                price, null, status, "good", null, null, null, null, null, null);
    }

    @Test
    void asset_validMinimalRecord() {
        assertThat(validator.validateAsset(asset("A-1", "Laptop", "other", null, "available")).isValid()).isTrue();
    }

    @Test
    void asset_requiredFieldsAndFormats() {
        ValidationResult r = validator.validateAsset(asset("", null, "spaceship", "12.345", "broken"));

        assertThat(r.isValid()).isFalse();
        assertThat(r.getErrors()).contains("Asset tag is required", "Asset name is required", "Invalid price format");
        assertThat(r.getErrors()).anyMatch(e -> e.startsWith("Invalid category 'spaceship'"));
        assertThat(r.getErrors()).anyMatch(e -> e.startsWith("Invalid status 'broken'"));
        assertThat(r.summary()).contains("; ");
    }

    @Test
    void asset_lengthLimits() {
        String tag = "T".repeat(51);
        AssetCandidate a = new AssetCandidate(tag, "Laptop", "laptop", null, null, null, null, Coerced.missing(),
                "100", "abc", "available", "excellent", null, "F".repeat(21), null, null, null, null);

        ValidationResult r = validator.validateAsset(a);

        assertThat(r.getErrors()).containsExactly(
                "Asset tag must be at most 50 characters",
                "Invalid value format",
                "Floor must be at most 20 characters");
    }

    @Test
    void asset_malformedPurchaseDate() {
        AssetCandidate a = new AssetCandidate("A-1", "Laptop", "laptop", null, null, null, null, ValueCoercion.toDate("31/31/2024"),
                null, null, "available", "good", null, null, null, null, null, null);

        assertThat(validator.validateAsset(a).getErrors()).containsExactly("Invalid purchase date: 31/31/2024");
    }

    @Test
    void asset_wellFormedDateAndAmounts() {
        AssetCandidate a = new AssetCandidate("A-1", "Laptop", "laptop", null, null, null, null, new Coerced<>("2024-01-01", LocalDate.of(2024, 1, 1)),
                "999.99", "10", "retired", "damaged", null, null, null, null, null, null);

        assertThat(validator.validateAsset(a).isValid()).isTrue();
    }

    @Test
    void user_emailAndRole() {
        UserCandidate ok = new UserCandidate("import-1", "Jane", "jane@example.com", null, null, null, null, "viewer", true);
        UserCandidate bad = new UserCandidate("import-2", " ", "not-an-email", null, null, null, "1".repeat(21), "owner", false);

        assertThat(validator.validateUser(ok).isValid()).isTrue();
        ValidationResult r = validator.validateUser(bad);
        assertThat(r.getErrors()).contains("Name is required", "Invalid email address", "Phone must be at most 20 characters");
        assertThat(r.getErrors()).anyMatch(e -> e.startsWith("Invalid role 'owner'") && e.contains("super_admin"));
    }

    @Test
    void user_missingEmail() {
        UserCandidate u = new UserCandidate("import-3", "Jane", null, null, null, null, null, "user", false);

        assertThat(validator.validateUser(u).getErrors()).containsExactly("Invalid email address");
    }

    @Test
    void assignment_requiresIdsAndWellFormedDate() {
        AssignmentCandidate bad = new AssignmentCandidate(0, null, null, ValueCoercion.toDateTime("someday"), null);
        AssignmentCandidate ok = new AssignmentCandidate(5, "import-1", "Onboarding", Coerced.missing(), null);

        assertThat(validator.validateAssignment(bad).getErrors())
                .containsExactly("Asset ID is required", "User ID is required", "Invalid expected return date: someday");
        assertThat(validator.validateAssignment(ok).isValid()).isTrue();
    }
}
