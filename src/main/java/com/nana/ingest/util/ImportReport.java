package com.nana.ingest.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ImportReport - Immutable outcome of one CSV import
 *
 * <p>An import can partially succeed: some rows are accepted, others are
 * rejected by the parser or the validator. The report keeps a
 * {@link RowResult} for every data row, the records that were accepted,
 * the health score computed for each valid customer, and every sanitizer
 * warning, so a caller can show or persist exactly what happened.
 *
 * <p>A report with a structural error (empty file, bad headers, file that
 * could not be read) has no row results; the error explains why nothing
 * was processed.
 *
 * <p>Built incrementally through {@link Builder}; once built, nothing
 * changes and the report can be handed between threads freely.
 *
 * @param <R> the record type the import produced
 */
public final class ImportReport<R> {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final String              sourceName;
    private final String              shapeName;
    private final LocalDateTime       importedAt;
    private final ParseError          structuralError;
    private final FileUploadErrorCode uploadErrorCode;
    private final String              uploadErrorMessage;
    private final int                 totalRows;
    private final int                 successCount;
    private final int                 failureCount;
    private final List<RowResult>     rowResults;
    private final List<R>             acceptedRecords;
    private final Map<String, Double> healthScores;
    private final List<String>        warnings;

    private ImportReport(Builder<R> builder) {
        this.sourceName         = builder.sourceName;
        this.shapeName          = builder.shapeName;
        this.importedAt         = builder.importedAt;
        this.structuralError    = builder.structuralError;
        this.uploadErrorCode    = builder.uploadErrorCode;
        this.uploadErrorMessage = builder.uploadErrorMessage;
        this.totalRows       = builder.totalRows;
        this.successCount    = builder.successCount;
        this.failureCount    = builder.failureCount;
        this.rowResults      = Collections.unmodifiableList(new ArrayList<>(builder.rowResults));
        this.acceptedRecords = Collections.unmodifiableList(new ArrayList<>(builder.acceptedRecords));
        this.healthScores    = Collections.unmodifiableMap(new LinkedHashMap<>(builder.healthScores));
        this.warnings        = Collections.unmodifiableList(new ArrayList<>(builder.warnings));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return display name of the imported source, e.g. the file name */
    public String getSourceName()          { return sourceName; }

    /** @return the record shape name ("customer" or "sentiment") */
    public String getShapeName()           { return shapeName; }

    public LocalDateTime getImportedAt()   { return importedAt; }

    /** @return the error that stopped the import before any row was read */
    public Optional<ParseError> getStructuralError() {
        return Optional.ofNullable(structuralError);
    }

    /** @return non-blank data rows in the file, header excluded */
    public int getTotalRows()              { return totalRows; }

    /** @return rows accepted without any error */
    public int getSuccessCount()           { return successCount; }

    /** @return rows that were rejected or carry validation errors */
    public int getFailureCount()           { return failureCount; }

    public List<RowResult> getRowResults() { return rowResults; }

    /** @return records that passed the pipeline, in file order */
    public List<R> getAcceptedRecords()    { return acceptedRecords; }

    /** @return health score per customer ID; empty for sentiment imports */
    public Map<String, Double> getHealthScores() { return healthScores; }

    /** @return sanitizer warnings, each prefixed with its row */
    public List<String> getWarnings()      { return warnings; }

    /** @return row results with a non-SUCCESS outcome */
    public List<RowResult> getFailedRows() {
        return rowResults.stream()
                .filter(r -> r.getOutcome() != RowResult.Outcome.SUCCESS)
                .toList();
    }

    /** @return why the file itself was refused by {@link CsvFileLoader} */
    public Optional<FileUploadErrorCode> getUploadErrorCode() {
        return Optional.ofNullable(uploadErrorCode);
    }

    /**
     * @return true if no row was processed because the file was refused,
     *         unreadable, or structurally invalid
     */
    public boolean isRejected() {
        return structuralError != null || uploadErrorCode != null;
    }

    /**
     * @return true if the file was read and every row was accepted cleanly
     */
    public boolean isFullSuccess() {
        return !isRejected() && failureCount == 0;
    }

    /**
     * Returns a one-line summary.
     *
     * @return e.g. "Imported 47 of 50 rows. 3 failed."
     */
    public String getSummary() {
        if (structuralError != null) {
            return "Import failed: " + structuralError.getMessage();
        }
        if (uploadErrorCode != null) {
            return "Import failed: " + uploadErrorMessage;
        }
        if (totalRows == 0) {
            return "No data rows found in the file.";
        }
        if (failureCount == 0) {
            return String.format("Successfully imported all %d rows.", totalRows);
        }
        return String.format("Imported %d of %d rows. %d failed.",
                successCount, totalRows, failureCount);
    }

    // -----------------------------------------------------------------------
    // REPORT TEXT GENERATION
    // -----------------------------------------------------------------------

    /**
     * Generates the plain-text report written next to a source file whose
     * import had failures.
     *
     * <pre>
     * ============================================================
     *  CRM Account Import - Import Report
     * ============================================================
     *  Source File   : accounts.csv
     *  Record Type   : customer
     *  Imported At   : 2025-01-15 14:32:00
     *  Total Rows    : 50
     *  Succeeded     : 47
     *  Failed        : 3
     *  Warnings      : 1
     * ------------------------------------------------------------
     *  FAILED ROWS:
     * ------------------------------------------------------------
     *  Row 3     | VALIDATION_ERROR     | Status: Invalid status. ...
     * ------------------------------------------------------------
     *  WARNINGS:
     * ------------------------------------------------------------
     *  Row 9: Account Name: Potential formula injection detected: ...
     * ============================================================
     * </pre>
     *
     * @return the report as a multi-line string
     */
    public String toReportText() {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);

        sb.append(line60).append("\n");
        sb.append(" CRM Account Import - Import Report\n");
        sb.append(line60).append("\n");
        sb.append(String.format(" %-14s: %s%n", "Source File",
                sourceName != null ? sourceName : "Unknown"));
        sb.append(String.format(" %-14s: %s%n", "Record Type", shapeName));
        sb.append(String.format(" %-14s: %s%n", "Imported At",
                importedAt.format(DISPLAY_FORMAT)));

        if (structuralError != null) {
            sb.append(line60d).append("\n");
            sb.append(String.format(" %-14s: %s%n", "Error", structuralError.getCode()));
            sb.append(" ").append(structuralError.getMessage()).append("\n");
            sb.append(line60).append("\n");
            return sb.toString();
        }
        if (uploadErrorCode != null) {
            sb.append(line60d).append("\n");
            sb.append(String.format(" %-14s: %s%n", "Error", uploadErrorCode));
            sb.append(" ").append(uploadErrorMessage).append("\n");
            sb.append(line60).append("\n");
            return sb.toString();
        }

        sb.append(String.format(" %-14s: %d%n", "Total Rows", totalRows));
        sb.append(String.format(" %-14s: %d%n", "Succeeded",  successCount));
        sb.append(String.format(" %-14s: %d%n", "Failed",     failureCount));
        sb.append(String.format(" %-14s: %d%n", "Warnings",   warnings.size()));
        sb.append(line60d).append("\n");

        if (failureCount == 0) {
            sb.append(" All rows imported successfully.\n");
        } else {
            sb.append(" FAILED ROWS:\n");
            sb.append(line60d).append("\n");
            for (RowResult rr : getFailedRows()) {
                sb.append(String.format(" Row %-5d | %-20s | %s%n",
                        rr.getRowNumber(), rr.getOutcome().name(), rr.getMessage()));
            }
        }

        if (!warnings.isEmpty()) {
            sb.append(line60d).append("\n");
            sb.append(" WARNINGS:\n");
            sb.append(line60d).append("\n");
            for (String warning : warnings) {
                sb.append(" ").append(warning).append("\n");
            }
        }

        sb.append(line60).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ImportReport{source=" + sourceName
               + ", shape=" + shapeName
               + ", total=" + totalRows
               + ", success=" + successCount
               + ", failed=" + failureCount
               + ", warnings=" + warnings.size()
               + (structuralError != null ? ", error=" + structuralError.getCode() : "")
               + (uploadErrorCode != null ? ", uploadError=" + uploadErrorCode : "")
               + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: RowResult
    // -----------------------------------------------------------------------

    /**
     * Outcome of one data row, keyed by its row number in the source file
     * (header is row 1).
     */
    public static final class RowResult {

        public enum Outcome {
            /** Row was mapped and passed validation. */
            SUCCESS,

            /** Row could not be mapped: wrong field count or missing identifier. */
            MALFORMED_ROW,

            /** Row was mapped but failed one or more field checks. */
            VALIDATION_ERROR
        }

        private final int     rowNumber;
        private final Outcome outcome;
        private final String  message;

        public RowResult(int rowNumber, Outcome outcome, String message) {
            this.rowNumber = rowNumber;
            this.outcome   = outcome;
            this.message   = message == null ? "" : message;
        }

        public int getRowNumber()   { return rowNumber; }
        public Outcome getOutcome() { return outcome; }

        /** @return human-readable detail; empty for SUCCESS */
        public String getMessage()  { return message; }

        public boolean isSuccess() {
            return outcome == Outcome.SUCCESS;
        }

        @Override
        public String toString() {
            return "RowResult{row=" + rowNumber
                   + ", outcome=" + outcome
                   + (message.isBlank() ? "" : ", message='" + message + "'")
                   + "}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /**
     * Mutable accumulator; one per import. Each data row must be recorded
     * exactly once through {@link #addSuccess} or {@link #addFailure}.
     *
     * @param <R> the record type
     */
    public static final class Builder<R> {

        private final String  sourceName;
        private final String  shapeName;
        private LocalDateTime importedAt   = LocalDateTime.now();
        private ParseError    structuralError;
        private FileUploadErrorCode uploadErrorCode;
        private String        uploadErrorMessage;
        private int           totalRows    = 0;
        private int           successCount = 0;
        private int           failureCount = 0;
        private final List<RowResult>     rowResults      = new ArrayList<>();
        private final List<R>             acceptedRecords = new ArrayList<>();
        private final Map<String, Double> healthScores    = new LinkedHashMap<>();
        private final List<String>        warnings        = new ArrayList<>();

        /**
         * @param sourceName display name of the source; may be null
         * @param shapeName  record shape name
         */
        public Builder(String sourceName, String shapeName) {
            this.sourceName = sourceName;
            this.shapeName  = shapeName;
        }

        public Builder<R> importedAt(LocalDateTime importedAt) {
            this.importedAt = importedAt;
            return this;
        }

        /** Marks the import as stopped before any row was processed. */
        public Builder<R> structuralError(ParseError error) {
            this.structuralError = error;
            return this;
        }

        /** Marks the import as stopped because the file could not be loaded. */
        public Builder<R> uploadError(FileUploadErrorCode code, String message) {
            this.uploadErrorCode    = code;
            this.uploadErrorMessage = message;
            return this;
        }

        /** Sets the data-row count reported by the parser. */
        public Builder<R> totalRows(int totalRows) {
            this.totalRows = totalRows;
            return this;
        }

        public Builder<R> addSuccess(int rowNumber) {
            rowResults.add(new RowResult(rowNumber, RowResult.Outcome.SUCCESS, ""));
            successCount++;
            return this;
        }

        public Builder<R> addFailure(int rowNumber, RowResult.Outcome outcome, String message) {
            if (outcome == RowResult.Outcome.SUCCESS) {
                throw new IllegalArgumentException("Use addSuccess for successful rows.");
            }
            rowResults.add(new RowResult(rowNumber, outcome, message));
            failureCount++;
            return this;
        }

        public Builder<R> addAccepted(R record) {
            acceptedRecords.add(record);
            return this;
        }

        public Builder<R> putHealthScore(String customerId, double score) {
            healthScores.put(customerId, score);
            return this;
        }

        public Builder<R> addWarnings(List<String> rowWarnings) {
            warnings.addAll(rowWarnings);
            return this;
        }

        /**
         * Row results are sorted by row number so parse and validation
         * failures interleave in file order.
         */
        public ImportReport<R> build() {
            rowResults.sort((a, b) -> Integer.compare(a.getRowNumber(), b.getRowNumber()));
            return new ImportReport<>(this);
        }
    }
}
