package com.assettrack.inventory.service;

import com.assettrack.inventory.importer.AssetCandidate;
import com.assettrack.inventory.importer.AssetRecordBuilder;
import com.assettrack.inventory.importer.AssignmentCandidate;
import com.assettrack.inventory.importer.AssignmentRecordBuilder;
import com.assettrack.inventory.importer.CandidateRecord;
import com.assettrack.inventory.importer.FieldMapper;
import com.assettrack.inventory.importer.ImportKind;
import com.assettrack.inventory.importer.ImportReport;
import com.assettrack.inventory.importer.ImportRequest;
import com.assettrack.inventory.importer.ImportRunResult;
import com.assettrack.inventory.importer.RawRow;
import com.assettrack.inventory.importer.RecordBuilder;
import com.assettrack.inventory.importer.RowOutcome;
import com.assettrack.inventory.importer.UserCandidate;
import com.assettrack.inventory.importer.UserRecordBuilder;
import com.assettrack.inventory.model.ImportError;
import com.assettrack.inventory.model.ImportRun;
import com.assettrack.inventory.repository.ImportErrorRepository;
import com.assettrack.inventory.repository.ImportRunRepository;
import com.assettrack.inventory.service.ImportRecordValidator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs one import: splits the payload, then builds, validates and stores each row in order.
 *
 * <p>Rows are processed one at a time and each store completes before the next row starts.
 * Row failures become outcomes; with {@code skipErrors == false} the first failure ends the run
 * and later rows are left unprocessed. Every run is audited as an {@link ImportRun} with one
 * {@link ImportError} per failed row.
 */
@Service
public class BulkImportService {

    private static final Logger log = LoggerFactory.getLogger(BulkImportService.class);
    static final String STORAGE_ERROR_REASON = "Record could not be stored";

    private final FieldMapper fieldMapper;
    private final ImportRunRepository importRunRepository;
    private final ImportErrorRepository importErrorRepository;
    private final int maxReportedErrors;
    private final Map<ImportKind, KindPipeline<?>> pipelines = new EnumMap<>(ImportKind.class);

    public BulkImportService(FieldMapper fieldMapper,
                             AssetRecordBuilder assetRecordBuilder,
                             UserRecordBuilder userRecordBuilder,
                             AssignmentRecordBuilder assignmentRecordBuilder,
                             ImportRecordValidator validator,
                             PersistenceGateway<AssetCandidate> assetGateway,
                             PersistenceGateway<UserCandidate> userGateway,
                             PersistenceGateway<AssignmentCandidate> assignmentGateway,
                             ImportRunRepository importRunRepository,
                             ImportErrorRepository importErrorRepository,
                             @Value("${assettrack.import.max-reported-errors:10}") int maxReportedErrors) {
        this.fieldMapper = fieldMapper;
        this.importRunRepository = importRunRepository;
        this.importErrorRepository = importErrorRepository;
        this.maxReportedErrors = maxReportedErrors;
        pipelines.put(ImportKind.ASSETS, new KindPipeline<>(assetRecordBuilder, validator::validateAsset, assetGateway));
        pipelines.put(ImportKind.USERS, new KindPipeline<>(userRecordBuilder, validator::validateUser, userGateway));
        pipelines.put(ImportKind.ASSIGNMENTS, new KindPipeline<>(assignmentRecordBuilder, validator::validateAssignment, assignmentGateway));
    }

    /**
     * @param requestedBy identity of the caller, already authorized upstream; recorded on the run
     *                    and on created records, never inspected
     * @throws InvalidImportRequestException when the kind is unknown or the payload has no data rows
     */
    public ImportRunResult run(ImportRequest request, String requestedBy) {
        ImportKind kind = ImportKind.fromRequestValue(request.importType())
                .orElseThrow(() -> InvalidImportRequestException.invalidKind(request.importType()));
        if (request.payload() == null) {
            throw InvalidImportRequestException.missingPayload();
        }
        List<RawRow> rows = fieldMapper.split(request.payload(), request.hasHeaders());
        if (rows.isEmpty()) {
            throw InvalidImportRequestException.emptyPayload();
        }

        ImportRun run = startRun(kind, request, requestedBy, rows.size());
        log.info("[Import][START] runId={} kind={} rows={} hasHeaders={} skipErrors={} requestedBy='{}'",
                run.getId(), kind.requestValue(), rows.size(), request.hasHeaders(), request.skipErrors(), requestedBy);

        KindPipeline<?> pipeline = pipelines.get(kind);
        List<RowOutcome> outcomes = new ArrayList<>(rows.size());
        List<ImportError> errors = new ArrayList<>();
        try {
            for (RawRow row : rows) {
                RowOutcome outcome = pipeline.process(row, requestedBy);
                outcomes.add(outcome);
                if (outcome.isFailed()) {
                    errors.add(toImportError(run, row, outcome));
                    if (!request.skipErrors()) {
                        log.info("[Import][ABORT] runId={} stopped at row {} of {}", run.getId(), row.index(), rows.size());
                        break;
                    }
                }
            }
        } catch (RuntimeException ex) {
            log.error("[Import][FAILED] runId={} kind={} unexpected error after {} row(s)",
                    run.getId(), kind.requestValue(), outcomes.size(), ex);
            markFailed(run, errors, ex);
            throw ex;
        }

        ImportReport report = ImportReport.from(rows.size(), outcomes, request.skipErrors(), maxReportedErrors);
        finishRun(run, report, errors);
        log.info("[Import][END] runId={} kind={} total={} imported={} failed={} aborted={}",
                run.getId(), kind.requestValue(), report.totalRows(), report.importedRows(), report.failedRows(), report.aborted());
        return new ImportRunResult(run.getId(), report);
    }

    private ImportRun startRun(ImportKind kind, ImportRequest request, String requestedBy, int totalRows) {
        ImportRun run = new ImportRun();
        run.setKind(kind.requestValue());
        run.setNotes(request.notes());
        run.setCreatedBy(requestedBy);
        run.setHasHeaders(request.hasHeaders());
        run.setSkipErrors(request.skipErrors());
        run.setRowsTotal(totalRows);
        run.setRowsSuccess(0);
        run.setRowsFailed(0);
        run.setStatus(ImportRun.STATUS_IN_PROGRESS);
        run.setStartedAt(Instant.now());
        return importRunRepository.save(run);
    }

    private void finishRun(ImportRun run, ImportReport report, List<ImportError> errors) {
        if (!errors.isEmpty()) {
            importErrorRepository.saveAll(errors);
        }
        run.setRowsSuccess(report.importedRows());
        run.setRowsFailed(report.failedRows());
        run.setAbortedAtRow(report.abortedAtRow());
        run.setStatus(report.aborted() ? ImportRun.STATUS_ABORTED : ImportRun.STATUS_COMPLETED);
        run.setFinishedAt(Instant.now());
        importRunRepository.save(run);
    }

    private void markFailed(ImportRun run, List<ImportError> errors, RuntimeException cause) {
        try {
            if (!errors.isEmpty()) {
                importErrorRepository.saveAll(errors);
            }
            run.setStatus(ImportRun.STATUS_FAILED);
            run.setFinishedAt(Instant.now());
            importRunRepository.save(run);
        } catch (RuntimeException auditEx) {
            cause.addSuppressed(auditEx);
        }
    }

    private ImportError toImportError(ImportRun run, RawRow row, RowOutcome outcome) {
        ImportError error = new ImportError();
        error.setImportRun(run);
        error.setRowNumber(row.index());
        error.setFailureKind(outcome.failureKind().name());
        error.setPayload(row.line());
        error.setReason(outcome.reason());
        error.setCreatedAt(Instant.now());
        return error;
    }

    /** Builder, rules and gateway of one kind, chosen once per run. */
    private static final class KindPipeline<C extends CandidateRecord> {
        private final RecordBuilder<C> builder;
        private final Function<C, ValidationResult> validator;
        private final PersistenceGateway<C> gateway;

        KindPipeline(RecordBuilder<C> builder, Function<C, ValidationResult> validator, PersistenceGateway<C> gateway) {
            this.builder = builder;
            this.validator = validator;
            this.gateway = gateway;
        }

        RowOutcome process(RawRow row, String requestedBy) {
            C candidate = builder.build(row);
            ValidationResult validation = validator.apply(candidate);
            if (!validation.isValid()) {
                log.info("[Import][Validation] {} row {} rejected: {}", candidate.kind().requestValue(), row.index(), validation.summary());
                return RowOutcome.failed(row.index(), RowOutcome.FailureKind.VALIDATION, validation.summary());
            }
            try {
                gateway.insert(candidate, requestedBy);
            } catch (RecordPersistenceException ex) {
                log.warn("[Import][Persistence] {} row {} rejected: {}", candidate.kind().requestValue(), row.index(), ex.getMessage());
                return RowOutcome.failed(row.index(), RowOutcome.FailureKind.PERSISTENCE, ex.getMessage());
            } catch (DataAccessException ex) {
                // driver text may carry the SQL statement; it stays in the log only
                log.warn("[Import][Persistence] {} row {} storage error", candidate.kind().requestValue(), row.index(), ex);
                return RowOutcome.failed(row.index(), RowOutcome.FailureKind.PERSISTENCE, STORAGE_ERROR_REASON);
            }
            return RowOutcome.imported(row.index());
        }
    }
}
