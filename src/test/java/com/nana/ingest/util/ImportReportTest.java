package com.nana.ingest.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ImportReport}.
 */
class ImportReportTest {

    private static final LocalDateTime AT = LocalDateTime.of(2025, 1, 15, 14, 32, 0);

    private ImportReport.Builder<String> builder() {
        return new ImportReport.Builder<String>("accounts.csv", "customer").importedAt(AT);
    }

    @Test
    @DisplayName("Row results are counted and ordered by row number")
    void countsAndOrder() {
        ImportReport<String> report = builder()
                .totalRows(3)
                .addFailure(3, ImportReport.RowResult.Outcome.MALFORMED_ROW, "Row 3: Expected 15 fields but got 2")
                .addSuccess(2)
                .addFailure(4, ImportReport.RowResult.Outcome.VALIDATION_ERROR, "Status: Invalid status")
                .addAccepted("C-1")
                .build();

        assertEquals(1, report.getSuccessCount());
        assertEquals(2, report.getFailureCount());
        assertEquals(List.of(2, 3, 4),
                report.getRowResults().stream().map(ImportReport.RowResult::getRowNumber).toList());
        assertEquals(2, report.getFailedRows().size());
        assertFalse(report.isFullSuccess());
        assertFalse(report.isRejected());
        assertEquals("Imported 1 of 3 rows. 2 failed.", report.getSummary());
    }

    @Test
    @DisplayName("Full success summary")
    void fullSuccess() {
        ImportReport<String> report = builder().totalRows(2).addSuccess(2).addSuccess(3).build();
        assertTrue(report.isFullSuccess());
        assertEquals("Successfully imported all 2 rows.", report.getSummary());
    }

    @Test
    @DisplayName("addFailure refuses a SUCCESS outcome")
    void failureMustNotBeSuccess() {
        assertThrows(IllegalArgumentException.class,
                () -> builder().addFailure(2, ImportReport.RowResult.Outcome.SUCCESS, ""));
    }

    @Test
    @DisplayName("Structural error is reported in the summary and report text")
    void structuralError() {
        ImportReport<String> report = builder()
                .structuralError(new ParseError(0, "CSV file is empty", ParseErrorCode.EMPTY_FILE))
                .build();

        assertTrue(report.isRejected());
        assertTrue(report.getStructuralError().isPresent());
        assertEquals("Import failed: CSV file is empty", report.getSummary());
        assertTrue(report.toReportText().contains("EMPTY_FILE"));
        assertTrue(report.getRowResults().isEmpty());
    }

    @Test
    @DisplayName("Upload error without a parse error still rejects the report")
    void uploadError() {
        ImportReport<String> report = builder()
                .uploadError(FileUploadErrorCode.FILE_TOO_LARGE, "File exceeds maximum size of 10MB")
                .build();

        assertTrue(report.isRejected());
        assertTrue(report.getStructuralError().isEmpty());
        assertEquals(FileUploadErrorCode.FILE_TOO_LARGE, report.getUploadErrorCode().orElseThrow());
        assertEquals("Import failed: File exceeds maximum size of 10MB", report.getSummary());
    }

    @Test
    @DisplayName("Report text lists failed rows and warnings")
    void reportText() {
        ImportReport<String> report = builder()
                .totalRows(2)
                .addSuccess(2)
                .addFailure(3, ImportReport.RowResult.Outcome.VALIDATION_ERROR, "Status: Invalid status")
                .addWarnings(List.of("Row 2: Account Name: Potential formula injection detected: \"=1...\""))
                .putHealthScore("C-1", 72.5)
                .build();

        String text = report.toReportText();
        assertTrue(text.contains("CRM Account Import - Import Report"));
        assertTrue(text.contains("accounts.csv"));
        assertTrue(text.contains("2025-01-15 14:32:00"));
        assertTrue(text.contains("FAILED ROWS:"));
        assertTrue(text.contains("VALIDATION_ERROR"));
        assertTrue(text.contains("Status: Invalid status"));
        assertTrue(text.contains("WARNINGS:"));
        assertEquals(72.5, report.getHealthScores().get("C-1"));
    }

    @Test
    @DisplayName("Built report is unmodifiable")
    void immutable() {
        ImportReport<String> report = builder().addAccepted("C-1").build();
        assertThrows(UnsupportedOperationException.class, () -> report.getAcceptedRecords().add("C-2"));
        assertThrows(UnsupportedOperationException.class, () -> report.getHealthScores().put("C-2", 1.0));
    }
}
