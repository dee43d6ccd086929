package com.assettrack.inventory.repository;

import com.assettrack.inventory.model.ImportError;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportErrorRepository extends JpaRepository<ImportError, Long> {
    List<ImportError> findByImportRunIdOrderByRowNumberAsc(Long importRunId);
}
