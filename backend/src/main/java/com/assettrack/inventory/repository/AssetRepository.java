package com.assettrack.inventory.repository;

import com.assettrack.inventory.model.Asset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AssetRepository extends JpaRepository<Asset, Long> {
    boolean existsByAssetTag(String assetTag);
    boolean existsBySerialNumber(String serialNumber);
    Optional<Asset> findByAssetTag(String assetTag);
}
