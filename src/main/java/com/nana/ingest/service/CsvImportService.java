package com.nana.ingest.service;

import com.nana.ingest.domain.CustomerRecord;
import com.nana.ingest.domain.Result;
import com.nana.ingest.domain.SentimentRecord;
import com.nana.ingest.util.AppLogger;
import com.nana.ingest.util.CsvFileLoader;
import com.nana.ingest.util.CsvRecordParser;
import com.nana.ingest.util.FileUploadErrorCode;
import com.nana.ingest.util.FileUploadException;
import com.nana.ingest.util.ImportConfig;
import com.nana.ingest.util.ImportReport;
import com.nana.ingest.util.LoadedFile;
import com.nana.ingest.util.ParseError;
import com.nana.ingest.util.ParseErrorCode;
import com.nana.ingest.util.ParseResult;
import com.nana.ingest.util.RecordShapes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * CsvImportService - Runs a CRM export through the whole import pipeline
 *
 * <p>CUSTOMER IMPORT:
 * <ol>
 *   <li>Parse with {@link RecordShapes#CUSTOMER}. A structural failure
 *       ends the import with an empty report carrying the error.
 *       Malformed rows become {@code MALFORMED_ROW} results.</li>
 *   <li>Sanitize every mapped record; warnings are prefixed with the
 *       record's source row.</li>
 *   <li>Validate the unsanitized batch in the configured
 *       {@link ValidationMode}, keeping source row numbers. The sanitized
 *       record is the one accepted and scored.</li>
 *   <li>Score every valid record with the {@link HealthScoreCalculator}.</li>
 * </ol>
 * In LENIENT mode a record with field errors is still accepted (with
 * defaults filled in) but reported as {@code VALIDATION_ERROR} and not
 * scored.
 *
 * <p>SENTIMENT IMPORT: parse and sanitize only; every mapped row is
 * accepted.
 *
 * <p>FILE IMPORTS: the {@link Path} overloads load the file through
 * {@link CsvFileLoader} first. A refused file never throws; it yields a
 * rejected report. When the import is not a full success and companion
 * reports are enabled, {@code <name>_import_report.txt} is written next to
 * the source file.
 *
 * <p>Every import runs under the {@code CSV_IMPORT} MDC operation context.
 */
public class CsvImportService {

    private static final Logger log = LoggerFactory.getLogger(CsvImportService.class);

    static final String OPERATION = "CSV_IMPORT";
    static final String COMPANION_SUFFIX = "_import_report.txt";

    private final ImportConfig                     config;
    private final HealthScoreCalculator            healthScoreCalculator;
    private final CsvRecordParser<CustomerRecord>  customerParser;
    private final CsvRecordParser<SentimentRecord> sentimentParser;
    private final FieldValidator                   validator;
    private final InputSanitizer                   sanitizer;
    private final CsvFileLoader                    fileLoader;

    /**
     * @param config                import settings; must not be null
     * @param healthScoreCalculator scorer for valid customers; must not be null
     */
    public CsvImportService(ImportConfig config, HealthScoreCalculator healthScoreCalculator) {
        if (config == null) {
            throw new IllegalArgumentException("ImportConfig must not be null.");
        }
        if (healthScoreCalculator == null) {
            throw new IllegalArgumentException("HealthScoreCalculator must not be null.");
        }
        this.config                = config;
        this.healthScoreCalculator = healthScoreCalculator;
        this.customerParser        = new CsvRecordParser<>(RecordShapes.CUSTOMER);
        this.sentimentParser       = new CsvRecordParser<>(RecordShapes.SENTIMENT);
        this.validator             = new FieldValidator(config.getValidationMode());
        this.sanitizer             = new InputSanitizer();
        this.fileLoader            = new CsvFileLoader(config);
    }

    // -----------------------------------------------------------------------
    // CUSTOMER IMPORT
    // -----------------------------------------------------------------------

    /**
     * Imports customer rows from decoded CSV text.
     *
     * @param content the CSV text
     * @return the import report
     */
    public ImportReport<CustomerRecord> importCustomers(String content) {
        return runWithContext(null,
                () -> importCustomerContent(content, null));
    }

    /**
     * Loads and imports a customer CSV file.
     *
     * @param file the file to import
     * @return the import report; never throws for a bad file
     */
    public ImportReport<CustomerRecord> importCustomers(Path file) {
        return importFile(file, RecordShapes.CUSTOMER.getName(), this::importCustomerContent);
    }

    private ImportReport<CustomerRecord> importCustomerContent(String content, String sourceName) {
        log.info("Starting customer import: source='{}', mode={}.",
                sourceName, validator.getMode());
        ImportReport.Builder<CustomerRecord> report =
                new ImportReport.Builder<>(sourceName, RecordShapes.CUSTOMER.getName());

        Result<ParseResult<CustomerRecord>, ParseError> parsed = customerParser.parse(content);
        if (parsed.isFailure()) {
            return rejected(report, parsed.getError());
        }

        ParseResult<CustomerRecord> parseResult = parsed.getValue();
        report.totalRows(parseResult.getTotalRows());
        recordMalformedRows(report, parseResult);

        List<Integer> sourceRows = parseResult.getSourceRows();
        List<CustomerRecord> sanitized = sanitizeAll(report, parseResult.getRecords(), sourceRows,
                r -> sanitizer.sanitizeRecord(r, RecordShapes.CUSTOMER));

        // Checks see raw values; escaping changes what a money value parses to.
        BatchValidationResult validation =
                validator.validateBatch(parseResult.getRecords(), sourceRows);
        List<ValidatedRecord> validatedData = validation.getValidatedData();

        for (int i = 0; i < validatedData.size(); i++) {
            ValidatedRecord validated = validatedData.get(i);
            CustomerRecord accepted = validator.applyDefaults(sanitized.get(i));
            int row = sourceRows.get(i);

            if (validated.isValid()) {
                report.addSuccess(row);
                report.addAccepted(accepted);
                scoreRecord(report, accepted, row);
                continue;
            }

            report.addFailure(row, ImportReport.RowResult.Outcome.VALIDATION_ERROR,
                    describe(validated.getErrors()));
            if (validator.getMode() == ValidationMode.LENIENT) {
                report.addAccepted(accepted);
            }
        }

        return finish(report);
    }

    // -----------------------------------------------------------------------
    // SENTIMENT IMPORT
    // -----------------------------------------------------------------------

    /**
     * Imports sentiment rows from decoded CSV text.
     *
     * @param content the CSV text
     * @return the import report
     */
    public ImportReport<SentimentRecord> importSentiment(String content) {
        return runWithContext(null,
                () -> importSentimentContent(content, null));
    }

    /**
     * Loads and imports a sentiment CSV file.
     *
     * @param file the file to import
     * @return the import report; never throws for a bad file
     */
    public ImportReport<SentimentRecord> importSentiment(Path file) {
        return importFile(file, RecordShapes.SENTIMENT.getName(), this::importSentimentContent);
    }

    private ImportReport<SentimentRecord> importSentimentContent(String content, String sourceName) {
        log.info("Starting sentiment import: source='{}'.", sourceName);
        ImportReport.Builder<SentimentRecord> report =
                new ImportReport.Builder<>(sourceName, RecordShapes.SENTIMENT.getName());

        Result<ParseResult<SentimentRecord>, ParseError> parsed = sentimentParser.parse(content);
        if (parsed.isFailure()) {
            return rejected(report, parsed.getError());
        }

        ParseResult<SentimentRecord> parseResult = parsed.getValue();
        report.totalRows(parseResult.getTotalRows());
        recordMalformedRows(report, parseResult);

        List<Integer> sourceRows = parseResult.getSourceRows();
        List<SentimentRecord> sanitized = sanitizeAll(report, parseResult.getRecords(), sourceRows,
                r -> sanitizer.sanitizeRecord(r, RecordShapes.SENTIMENT));

        for (int i = 0; i < sanitized.size(); i++) {
            report.addSuccess(sourceRows.get(i));
            report.addAccepted(sanitized.get(i));
        }

        return finish(report);
    }

    // -----------------------------------------------------------------------
    // PRIVATE - FILE HANDLING
    // -----------------------------------------------------------------------

    private <R> ImportReport<R> importFile(Path file, String shapeName,
                                           BiFunction<String, String, ImportReport<R>> importer) {
        if (file == null) {
            throw new IllegalArgumentException("file must not be null.");
        }
        String sourceName = file.getFileName() != null ? file.getFileName().toString() : file.toString();

        return runWithContext(sourceName, () -> {
            ImportReport<R> report;
            try {
                LoadedFile loaded = fileLoader.load(file);
                report = importer.apply(loaded.getContent(), sourceName);
            } catch (FileUploadException ex) {
                log.warn("File '{}' refused: {} ({}).", file, ex.getMessage(), ex.getCode());
                AppLogger.logWarningEvent("CSV_IMPORT_REFUSED",
                        "file=" + sourceName + ", code=" + ex.getCode());
                report = refused(sourceName, shapeName, ex);
            }

            if (!report.isFullSuccess() && config.isCompanionReportEnabled()) {
                writeCompanionReport(report, file);
            }
            return report;
        });
    }

    /**
     * Maps a loader failure onto the report. Encoding and empty-file
     * failures are also exposed as structural parse errors.
     */
    private <R> ImportReport<R> refused(String sourceName, String shapeName,
                                        FileUploadException ex) {
        ImportReport.Builder<R> builder = new ImportReport.Builder<R>(sourceName, shapeName)
                .uploadError(ex.getCode(), ex.getMessage());

        if (ex.getCode() == FileUploadErrorCode.ENCODING_ERROR) {
            builder.structuralError(new ParseError(0, ex.getMessage(), ParseErrorCode.INVALID_ENCODING));
        } else if (ex.getCode() == FileUploadErrorCode.EMPTY_FILE) {
            builder.structuralError(new ParseError(0, "CSV file is empty", ParseErrorCode.EMPTY_FILE));
        }
        return builder.build();
    }

    /**
     * Writes {@code <name>_import_report.txt} next to the source file.
     * Failures are logged; the import outcome is already decided.
     */
    private void writeCompanionReport(ImportReport<?> report, Path sourceFile) {
        Path parent = sourceFile.toAbsolutePath().getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            log.debug("No directory for companion report of '{}'.", sourceFile);
            return;
        }

        String originalName = sourceFile.getFileName().toString();
        String baseName = originalName.contains(".")
                ? originalName.substring(0, originalName.lastIndexOf('.'))
                : originalName;
        Path reportPath = parent.resolve(baseName + COMPANION_SUFFIX);

        try {
            Files.writeString(reportPath, report.toReportText(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            log.info("Import report written to: {}", reportPath);
        } catch (IOException ex) {
            AppLogger.logErrorEvent("IMPORT_REPORT_WRITE_FAILED", "path=" + reportPath, ex);
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE - PIPELINE STEPS
    // -----------------------------------------------------------------------

    private <R> ImportReport<R> rejected(ImportReport.Builder<R> report, ParseError error) {
        AppLogger.logWarningEvent("CSV_IMPORT_REJECTED",
                "code=" + error.getCode() + ", message=" + error.getMessage());
        return report.structuralError(error).build();
    }

    private <R> void recordMalformedRows(ImportReport.Builder<R> report, ParseResult<R> parseResult) {
        for (ParseError error : parseResult.getErrors()) {
            report.addFailure(error.getRow(),
                    ImportReport.RowResult.Outcome.MALFORMED_ROW, error.getMessage());
        }
    }

    private <R> List<R> sanitizeAll(ImportReport.Builder<R> report,
                                    List<R> records,
                                    List<Integer> sourceRows,
                                    Function<R, SanitizationResult<R>> sanitize) {
        List<R> sanitized = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            SanitizationResult<R> result = sanitize.apply(records.get(i));
            sanitized.add(result.getValue());
            if (result.hasWarnings()) {
                String prefix = "Row " + sourceRows.get(i) + ": ";
                report.addWarnings(result.getWarnings().stream()
                        .map(w -> prefix + w)
                        .collect(Collectors.toList()));
            }
        }
        return sanitized;
    }

    private void scoreRecord(ImportReport.Builder<CustomerRecord> report,
                             CustomerRecord record, int row) {
        try {
            double score = healthScoreCalculator.calculate(record);
            report.putHealthScore(record.getCustomerId(), score);
        } catch (RuntimeException ex) {
            log.warn("Health score failed for customer '{}' (row {}): {}",
                    record.getCustomerId(), row, ex.getMessage());
            AppLogger.logWarningEvent("HEALTH_SCORE_FAILED",
                    "customerId=" + record.getCustomerId() + ", row=" + row);
        }
    }

    private <R> ImportReport<R> finish(ImportReport.Builder<R> builder) {
        ImportReport<R> report = builder.build();
        AppLogger.logEvent("CSV_IMPORT_COMPLETE", report.toString());
        log.info("Import complete: {}", report.getSummary());
        return report;
    }

    private static String describe(List<ValidationError> errors) {
        return errors.stream()
                .map(e -> e.getField() + ": " + e.getMessage())
                .collect(Collectors.joining("; "));
    }

    private <T> T runWithContext(String sourceName, Supplier<T> work) {
        AppLogger.setOperationContext(OPERATION);
        if (sourceName != null) {
            AppLogger.setSourceContext(sourceName);
        }
        try {
            return work.get();
        } finally {
            AppLogger.clearOperationContext();
        }
    }
}
