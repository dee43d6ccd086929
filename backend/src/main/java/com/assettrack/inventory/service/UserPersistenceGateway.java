package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.UserCandidate;
import com.assettrack.inventory.model.AppUser;
import com.assettrack.inventory.model.UserRole;
import com.assettrack.inventory.repository.AppUserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Locale;

@Service
public class UserPersistenceGateway implements PersistenceGateway<UserCandidate> {

    private final AppUserRepository userRepository;

    public UserPersistenceGateway(AppUserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /** Emails are stored lower-cased, so uniqueness is case-insensitive. */
    @Override
    @Transactional
    public void insert(UserCandidate candidate, String requestedBy) {
        String email = candidate.email().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmail(email)) {
            throw new RecordPersistenceException("Email already exists");
        }
        if (candidate.employeeId() != null && userRepository.existsByEmployeeId(candidate.employeeId())) {
            throw new RecordPersistenceException("Employee ID already exists");
        }

        AppUser user = new AppUser(candidate.id(), candidate.name(), email);
        user.setRole(UserRole.fromValue(candidate.role()).orElseThrow());
        user.setDepartment(candidate.department());
        user.setJobTitle(candidate.jobTitle());
        user.setEmployeeId(candidate.employeeId());
        user.setPhone(candidate.phone());
        user.setActive(candidate.active());
        Instant now = Instant.now();
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        userRepository.save(user);
    }
}
