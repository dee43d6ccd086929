package com.assettrack.inventory.repository;

import com.assettrack.inventory.model.AssetAssignment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AssetAssignmentRepository extends JpaRepository<AssetAssignment, Long> {
    List<AssetAssignment> findByAssetIdAndActiveTrue(Long assetId);
}
