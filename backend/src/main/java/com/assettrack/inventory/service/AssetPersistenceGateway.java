package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.AssetCandidate;
import com.assettrack.inventory.model.Asset;
import com.assettrack.inventory.model.AssetCategory;
import com.assettrack.inventory.model.AssetCondition;
import com.assettrack.inventory.model.AssetStatus;
import com.assettrack.inventory.repository.AssetRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;

@Service
public class AssetPersistenceGateway implements PersistenceGateway<AssetCandidate> {

    private final AssetRepository assetRepository;

    public AssetPersistenceGateway(AssetRepository assetRepository) {
        this.assetRepository = assetRepository;
    }

    @Override
    @Transactional
    public void insert(AssetCandidate candidate, String requestedBy) {
        if (assetRepository.existsByAssetTag(candidate.assetTag())) {
            throw new RecordPersistenceException("Asset tag already exists");
        }
        if (candidate.serialNumber() != null && assetRepository.existsBySerialNumber(candidate.serialNumber())) {
            throw new RecordPersistenceException("Serial number already exists");
        }

        Asset asset = new Asset(candidate.assetTag(), candidate.name(), AssetCategory.fromValue(candidate.category()).orElseThrow());
        asset.setSubcategory(candidate.subcategory());
        asset.setStatus(AssetStatus.fromValue(candidate.status()).orElseThrow());
        asset.setCondition(AssetCondition.fromValue(candidate.condition()).orElseThrow());
        asset.setSerialNumber(candidate.serialNumber());
        asset.setModel(candidate.model());
        asset.setManufacturer(candidate.manufacturer());
        asset.setPurchaseDate(candidate.purchaseDate().value());
        asset.setPurchasePrice(amount(candidate.purchasePrice()));
        asset.setCurrentValue(amount(candidate.currentValue()));
        asset.setBuilding(candidate.building());
        asset.setFloor(candidate.floor());
        asset.setRoom(candidate.room());
        asset.setDesk(candidate.desk());
        asset.setDescription(candidate.description());
        asset.setNotes(candidate.notes());
        asset.setCreatedBy(requestedBy);
        Instant now = Instant.now();
        asset.setCreatedAt(now);
        asset.setUpdatedAt(now);
        assetRepository.save(asset);
    }

    private static BigDecimal amount(String text) {
        return text == null ? null : new BigDecimal(text);
    }
}
