package com.assettrack.inventory.controller;

import com.assettrack.inventory.dto.ImportErrorDTO;
import com.assettrack.inventory.dto.ImportResponseDTO;
import com.assettrack.inventory.dto.ImportRunSummaryDTO;
import com.assettrack.inventory.importer.ImportRequest;
import com.assettrack.inventory.model.ImportRun;
import com.assettrack.inventory.repository.ImportErrorRepository;
import com.assettrack.inventory.repository.ImportRunRepository;
import com.assettrack.inventory.service.BulkImportService;
import com.assettrack.inventory.service.InvalidImportRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Bulk import endpoints. The caller identity arrives in {@code X-User-Id}, set by the gateway that
 * already decided the caller may import; it is passed through without inspection.
 */
@RestController
@RequestMapping("/api/import")
@CrossOrigin(origins = "*")
public class ImportController {

    private static final Logger log = LoggerFactory.getLogger(ImportController.class);

    private final BulkImportService importService;
    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;
    private final String defaultRequestedBy;

    public ImportController(BulkImportService importService,
                            ImportRunRepository importRunRepository,
                            ImportErrorRepository importErrorRepository,
                            @Value("${assettrack.import.default-requested-by:system}") String defaultRequestedBy) {
        this.importService = importService;
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
        this.defaultRequestedBy = defaultRequestedBy;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> importFile(
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "importType", required = false) String importType,
            @RequestParam(defaultValue = "false") boolean hasHeaders,
            @RequestParam(defaultValue = "false") boolean skipErrors,
            @RequestParam(value = "notes", required = false) String notes,
            @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        String payload;
        try {
            payload = file == null ? null : new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.warn("[Import][Upload] Could not read uploaded file '{}': {}", file.getOriginalFilename(), ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("success", false, "error", "Could not read uploaded file"));
        }
        return execute(new ImportRequest(importType, hasHeaders, skipErrors, payload, notes), userId);
    }

    public record TextImportRequest(String importType, Boolean hasHeaders, Boolean skipErrors, String notes, String payload) {}

    @PostMapping(path = "/text", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> importText(@RequestBody TextImportRequest req,
                                        @RequestHeader(value = "X-User-Id", required = false) String userId) {
        ImportRequest request = new ImportRequest(
                req.importType(),
                Boolean.TRUE.equals(req.hasHeaders()),
                Boolean.TRUE.equals(req.skipErrors()),
                req.payload(),
                req.notes());
        return execute(request, userId);
    }

    @GetMapping("/runs")
    public List<ImportRunSummaryDTO> listRuns(@RequestParam(value = "page", defaultValue = "0") int page,
                                              @RequestParam(value = "size", defaultValue = "20") int size) {
        Page<ImportRun> p = importRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(page, size));
        return p.map(this::toDto).getContent();
    }

    @GetMapping("/runs/{id}/errors")
    public ResponseEntity<List<ImportErrorDTO>> listErrors(@PathVariable("id") Long id) {
        if (!importRunRepository.existsById(id)) return ResponseEntity.notFound().build();
        List<ImportErrorDTO> errors = importErrorRepository.findByImportRunIdOrderByRowNumberAsc(id).stream()
                .map(e -> new ImportErrorDTO(e.getId(), e.getRowNumber(), e.getFailureKind(), e.getReason(), e.getPayload()))
                .toList();
        return ResponseEntity.ok(errors);
    }

    private ResponseEntity<?> execute(ImportRequest request, String userId) {
        String requestedBy = (userId == null || userId.isBlank()) ? defaultRequestedBy : userId.trim();
        try {
            return ResponseEntity.ok(ImportResponseDTO.from(importService.run(request, requestedBy)));
        } catch (InvalidImportRequestException ex) {
            log.info("[Import] Rejected request ({}): {}", ex.getReason(), ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("success", false, "error", ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("[Import] Unexpected failure for importType={} requestedBy='{}'", request.importType(), requestedBy, ex);
            return ResponseEntity.internalServerError().body(Map.of("success", false, "error", "Import failed due to an internal error"));
        }
    }

    private ImportRunSummaryDTO toDto(ImportRun run) {
        return new ImportRunSummaryDTO(
                run.getId(),
                run.getKind(),
                run.getStatus(),
                run.getRowsTotal(),
                run.getRowsSuccess(),
                run.getRowsFailed(),
                run.getAbortedAtRow(),
                run.getNotes(),
                run.getCreatedBy(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
