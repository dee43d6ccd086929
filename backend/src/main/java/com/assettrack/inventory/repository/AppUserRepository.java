package com.assettrack.inventory.repository;

import com.assettrack.inventory.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface AppUserRepository extends JpaRepository<AppUser, String> {
    boolean existsByEmail(String email);
    boolean existsByEmployeeId(String employeeId);
    Optional<AppUser> findByEmail(String email);
}
