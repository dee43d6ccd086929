package com.assettrack.inventory.importer;

import com.assettrack.inventory.importer.RowOutcome.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImportReportTest {

    @Test
    void errorsAreCappedButEveryFailureIsCounted() {
        List<RowOutcome> outcomes = new ArrayList<>();
        for (int i = 1; i <= 25; i++) {
            outcomes.add(RowOutcome.failed(i, FailureKind.VALIDATION, "bad"));
        }

        ImportReport report = ImportReport.from(25, outcomes, true, 10);

        assertThat(report.failedRows()).isEqualTo(25);
        assertThat(report.errors()).hasSize(10);
        assertThat(report.errors().get(0)).isEqualTo("Row 1: bad");
        assertThat(report.errors().get(9)).isEqualTo("Row 10: bad");
    }

    @Test
    void successPredicate() {
        List<RowOutcome> mixed = List.of(RowOutcome.imported(1), RowOutcome.failed(2, FailureKind.PERSISTENCE, "dup"));
        List<RowOutcome> allFailed = List.of(RowOutcome.failed(1, FailureKind.VALIDATION, "bad"));

        assertThat(ImportReport.from(2, mixed, true, 10).success()).isTrue();
        assertThat(ImportReport.from(2, mixed, false, 10).success()).isFalse();
        assertThat(ImportReport.from(1, allFailed, true, 10).success()).isFalse();
        assertThat(ImportReport.from(1, List.of(RowOutcome.imported(1)), false, 10).success()).isTrue();
    }

    @Test
    void abortIsExplicitWhenRowsRemain() {
        List<RowOutcome> outcomes = List.of(RowOutcome.imported(1), RowOutcome.failed(2, FailureKind.VALIDATION, "bad"));

        ImportReport aborted = ImportReport.from(5, outcomes, false, 10);
        ImportReport completed = ImportReport.from(2, outcomes, false, 10);

        assertThat(aborted.aborted()).isTrue();
        assertThat(aborted.abortedAtRow()).isEqualTo(2);
        assertThat(aborted.importedRows() + aborted.failedRows()).isLessThan(aborted.totalRows());
        assertThat(completed.aborted()).isFalse();
        assertThat(completed.abortedAtRow()).isNull();
    }

    @Test
    void sameOutcomesGiveEqualReports() {
        List<RowOutcome> outcomes = List.of(RowOutcome.imported(1), RowOutcome.failed(2, FailureKind.VALIDATION, "bad"));

        assertThat(ImportReport.from(2, outcomes, true, 10)).isEqualTo(ImportReport.from(2, outcomes, true, 10));
    }

    @Test
    void message() {
        ImportReport report = ImportReport.from(3, List.of(RowOutcome.imported(1), RowOutcome.imported(2),
                RowOutcome.failed(3, FailureKind.VALIDATION, "x")), true, 10);

        assertThat(report.message()).isEqualTo("Import completed. 2 records imported, 1 failed.");
    }
}
