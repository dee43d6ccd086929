package com.assettrack.inventory.importer;

import java.time.LocalDate;

/**
 * Asset row. Category, status and condition hold their wire values with defaults applied;
 * prices stay as text until validation checks their format.
 */
public record AssetCandidate(
        String assetTag,
        String name,
        String category,
        String subcategory,
        String serialNumber,
        String model,
        String manufacturer,
        Coerced<LocalDate> purchaseDate,
        String purchasePrice,
        String currentValue,
        String status,
        String condition,
        String building,
        String floor,
        String room,
        String desk,
        String description,
        String notes
) implements CandidateRecord {

    @Override
    public ImportKind kind() { return ImportKind.ASSETS; }
}
