package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.AssignmentCandidate;
import com.assettrack.inventory.model.AppUser;
import com.assettrack.inventory.model.Asset;
import com.assettrack.inventory.model.AssetAssignment;
import com.assettrack.inventory.model.AssetStatus;
import com.assettrack.inventory.model.AssignmentStatus;
import com.assettrack.inventory.repository.AppUserRepository;
import com.assettrack.inventory.repository.AssetAssignmentRepository;
import com.assettrack.inventory.repository.AssetRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Creates an active assignment and flips the asset to {@code assigned}. Both writes share one
 * transaction, so a failed row leaves neither behind.
 */
@Service
public class AssignmentPersistenceGateway implements PersistenceGateway<AssignmentCandidate> {

    private final AssetRepository assetRepository;
    private final AppUserRepository userRepository;
    private final AssetAssignmentRepository assignmentRepository;

    public AssignmentPersistenceGateway(AssetRepository assetRepository,
                                        AppUserRepository userRepository,
                                        AssetAssignmentRepository assignmentRepository) {
        this.assetRepository = assetRepository;
        this.userRepository = userRepository;
        this.assignmentRepository = assignmentRepository;
    }

    @Override
    @Transactional
    public void insert(AssignmentCandidate candidate, String requestedBy) {
        Asset asset = assetRepository.findById(candidate.assetId())
                .orElseThrow(() -> new RecordPersistenceException("Asset with id " + candidate.assetId() + " not found"));
        AppUser user = userRepository.findById(candidate.userId())
                .orElseThrow(() -> new RecordPersistenceException("User with id " + candidate.userId() + " not found"));
        if (asset.getStatus() != AssetStatus.AVAILABLE) {
            throw new RecordPersistenceException("Asset " + asset.getAssetTag() + " is not available");
        }

        Instant now = Instant.now();
        AssetAssignment assignment = new AssetAssignment(asset, user);
        assignment.setStatus(AssignmentStatus.ACTIVE);
        assignment.setActive(true);
        assignment.setAssignedAt(now);
        assignment.setExpectedReturnAt(candidate.expectedReturnAt().value());
        assignment.setPurpose(candidate.purpose());
        assignment.setNotes(candidate.notes());
        assignment.setAssignedBy(requestedBy);
        assignment.setCreatedAt(now);
        assignmentRepository.save(assignment);

        asset.setStatus(AssetStatus.ASSIGNED);
        asset.setUpdatedAt(now);
        assetRepository.save(asset);
    }
}
