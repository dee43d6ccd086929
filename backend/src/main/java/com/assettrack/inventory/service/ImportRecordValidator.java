package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.AssetCandidate;
import com.assettrack.inventory.importer.AssignmentCandidate;
import com.assettrack.inventory.importer.Coerced;
import com.assettrack.inventory.importer.UserCandidate;
import com.assettrack.inventory.model.AssetCategory;
import com.assettrack.inventory.model.AssetCondition;
import com.assettrack.inventory.model.AssetStatus;
import com.assettrack.inventory.model.UserRole;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Field rules for each record kind. These are the same rules the entry forms apply, so an
 * imported record is never looser than a hand-entered one.
 */
@Service
public class ImportRecordValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern AMOUNT = Pattern.compile("^\\d+(\\.\\d{1,2})?$");

    public static class ValidationResult {
        private final List<String> errors;

        public ValidationResult(List<String> errors) {
            this.errors = List.copyOf(errors);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<String> getErrors() { return errors; }

        /** All errors in one line, as reported for the row. */
        public String summary() { return String.join("; ", errors); }
    }

    public ValidationResult validateAsset(AssetCandidate a) {
        List<String> errors = new ArrayList<>();
        required(errors, a.assetTag(), 50, "Asset tag");
        required(errors, a.name(), 255, "Asset name");
        oneOf(errors, "category", a.category(), AssetCategory::fromValue, Arrays.stream(AssetCategory.values()).map(AssetCategory::value).toList());
        maxLength(errors, a.subcategory(), 100, "Subcategory");
        maxLength(errors, a.serialNumber(), 255, "Serial number");
        maxLength(errors, a.model(), 255, "Model");
        maxLength(errors, a.manufacturer(), 255, "Manufacturer");
        wellFormedDate(errors, a.purchaseDate(), "purchase date");
        if (a.purchasePrice() != null && !AMOUNT.matcher(a.purchasePrice()).matches()) errors.add("Invalid price format");
        if (a.currentValue() != null && !AMOUNT.matcher(a.currentValue()).matches()) errors.add("Invalid value format");
        oneOf(errors, "status", a.status(), AssetStatus::fromValue, Arrays.stream(AssetStatus.values()).map(AssetStatus::value).toList());
        oneOf(errors, "condition", a.condition(), AssetCondition::fromValue, Arrays.stream(AssetCondition.values()).map(AssetCondition::value).toList());
        maxLength(errors, a.building(), 100, "Building");
        maxLength(errors, a.floor(), 20, "Floor");
        maxLength(errors, a.room(), 50, "Room");
        maxLength(errors, a.desk(), 50, "Desk");
        return new ValidationResult(errors);
    }

    public ValidationResult validateUser(UserCandidate u) {
        List<String> errors = new ArrayList<>();
        required(errors, u.name(), 255, "Name");
        if (isBlank(u.email()) || !EMAIL.matcher(u.email()).matches()) {
            errors.add("Invalid email address");
        } else {
            maxLength(errors, u.email(), 255, "Email");
        }
        maxLength(errors, u.department(), 100, "Department");
        maxLength(errors, u.jobTitle(), 100, "Job title");
        maxLength(errors, u.employeeId(), 50, "Employee ID");
        maxLength(errors, u.phone(), 20, "Phone");
        oneOf(errors, "role", u.role(), UserRole::fromValue, Arrays.stream(UserRole.values()).map(UserRole::value).toList());
        return new ValidationResult(errors);
    }

    public ValidationResult validateAssignment(AssignmentCandidate a) {
        List<String> errors = new ArrayList<>();
        if (a.assetId() <= 0) errors.add("Asset ID is required");
        if (isBlank(a.userId())) errors.add("User ID is required");
        maxLength(errors, a.purpose(), 255, "Purpose");
        wellFormedDate(errors, a.expectedReturnAt(), "expected return date");
        return new ValidationResult(errors);
    }

    private void required(List<String> errors, String value, int max, String label) {
        if (isBlank(value)) {
            errors.add(label + " is required");
        } else {
            maxLength(errors, value, max, label);
        }
    }

    private void maxLength(List<String> errors, String value, int max, String label) {
        if (value != null && value.length() > max) errors.add(label + " must be at most " + max + " characters");
    }

    private void wellFormedDate(List<String> errors, Coerced<?> value, String label) {
        if (value != null && value.isMalformed()) errors.add("Invalid " + label + ": " + value.raw());
    }

    private <E> void oneOf(List<String> errors, String label, String value, Function<String, Optional<E>> parser, List<String> allowed) {
        if (parser.apply(value).isEmpty()) {
            errors.add("Invalid " + label + " '" + value + "' (expected one of: " + String.join(", ", allowed) + ")");
        }
    }

    private boolean isBlank(String s) { return s == null || s.trim().isEmpty(); }
}
