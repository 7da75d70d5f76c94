package com.nana.ingest.service;

import com.nana.ingest.domain.AccountType;
import com.nana.ingest.domain.CustomerField;
import com.nana.ingest.domain.CustomerRecord;
import com.nana.ingest.domain.CustomerStatus;
import com.nana.ingest.domain.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * FieldValidator - Field-level checks for parsed customer records
 *
 * <p>Checks run in a fixed order and accumulate, so one record can report
 * several errors at once:
 * <ol>
 *   <li>Required fields: customer ID, account owner, status, account type,
 *       created date.</li>
 *   <li>Date format of {@code Created Date} and {@code Latest Login}.</li>
 *   <li>{@code MRR (converted)} contains a number.</li>
 *   <li>{@code Status} and {@code Account Type} are known values.</li>
 *   <li>{@code MRR (converted)} is not negative.</li>
 * </ol>
 * Optional checks (2 to 5) skip blank values; a blank required field is
 * reported once, by check 1.
 *
 * <p>The {@link ValidationMode} is fixed at construction. In
 * {@code STRICT} mode any error fails the record. In {@code LENIENT} mode
 * the record is returned with its errors and with defaults filled into
 * blank optional fields.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public class FieldValidator {

    private static final Logger log = LoggerFactory.getLogger(FieldValidator.class);

    // -----------------------------------------------------------------------
    // PATTERNS
    // -----------------------------------------------------------------------

    /** DD/MM/YYYY with an optional ", HH:mm" suffix. */
    private static final Pattern DATE_PATTERN = Pattern.compile(
            "^(\\d{1,2})/(\\d{1,2})/(\\d{4})(, \\d{1,2}:\\d{2})?$");

    /** Characters kept before reading a number out of a money value. */
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.-]");

    /** Longest leading decimal, as a lenient float reader would take it. */
    private static final Pattern LEADING_DECIMAL = Pattern.compile(
            "-?(\\d+(\\.\\d*)?|\\.\\d+)");

    private static final int MIN_YEAR = 1900;
    private static final int MAX_YEAR = 2100;

    // -----------------------------------------------------------------------
    // LENIENT DEFAULTS
    // -----------------------------------------------------------------------

    static final String DEFAULT_MRR           = "0";
    static final String DEFAULT_CHANNELS      = "";
    static final String DEFAULT_LANGUAGE      = "Unknown";
    static final String DEFAULT_PROPERTY_TYPE = "Other";

    private final ValidationMode mode;

    /** Creates a strict validator. */
    public FieldValidator() {
        this(ValidationMode.STRICT);
    }

    /**
     * @param mode how records with errors are treated; must not be null
     */
    public FieldValidator(ValidationMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("ValidationMode must not be null.");
        }
        this.mode = mode;
    }

    public ValidationMode getMode() {
        return mode;
    }

    /** @return a validator with the same rules and the given mode */
    public FieldValidator withMode(ValidationMode newMode) {
        return newMode == mode ? this : new FieldValidator(newMode);
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Validates one record.
     *
     * @param record    the record to check; must not be null
     * @param rowNumber row number attached to every error
     * @return in STRICT mode, a failure carrying all errors if there are
     *         any; otherwise a {@link ValidatedRecord} (with defaults applied
     *         in LENIENT mode)
     */
    public Result<ValidatedRecord, List<ValidationError>> validate(CustomerRecord record,
                                                                   int rowNumber) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null.");
        }

        List<ValidationError> errors = new ArrayList<>();
        validateRequiredFields(record, rowNumber, errors);
        validateTypes(record, rowNumber, errors);
        validateValues(record, rowNumber, errors);

        boolean valid = errors.isEmpty();
        if (!valid && mode == ValidationMode.STRICT) {
            return Result.failure(List.copyOf(errors));
        }
        return Result.success(new ValidatedRecord(applyDefaults(record), valid, errors));
    }

    /**
     * Validates records numbered 1, 2, 3... in list order.
     *
     * @param records the records to check
     * @return totals, all errors, and one {@link ValidatedRecord} per input
     */
    public BatchValidationResult validateBatch(List<CustomerRecord> records) {
        List<Integer> rowNumbers = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            rowNumbers.add(i + 1);
        }
        return validateBatch(records, rowNumbers);
    }

    /**
     * Validates records using the row numbers they had in the source file.
     *
     * <p>A record rejected in STRICT mode appears in {@code validatedData}
     * as the original record, marked invalid, with its errors.
     *
     * @param records    the records to check
     * @param rowNumbers row number for each record; same size as {@code records}
     * @return totals, all errors, and one {@link ValidatedRecord} per input
     */
    public BatchValidationResult validateBatch(List<CustomerRecord> records,
                                               List<Integer> rowNumbers) {
        if (records.size() != rowNumbers.size()) {
            throw new IllegalArgumentException("Got " + records.size()
                    + " records but " + rowNumbers.size() + " row numbers.");
        }

        List<ValidatedRecord> validatedData = new ArrayList<>(records.size());
        List<ValidationError> allErrors     = new ArrayList<>();
        int validCount   = 0;
        int invalidCount = 0;

        for (int i = 0; i < records.size(); i++) {
            Result<ValidatedRecord, List<ValidationError>> result =
                    validate(records.get(i), rowNumbers.get(i));

            if (result.isSuccess()) {
                ValidatedRecord validated = result.getValue();
                validatedData.add(validated);
                if (validated.isValid()) {
                    validCount++;
                } else {
                    invalidCount++;
                    allErrors.addAll(validated.getErrors());
                }
            } else {
                invalidCount++;
                allErrors.addAll(result.getError());
                validatedData.add(new ValidatedRecord(records.get(i), false, result.getError()));
            }
        }

        log.debug("Validated {} records in {} mode: {} valid, {} invalid.",
                records.size(), mode, validCount, invalidCount);
        return new BatchValidationResult(records.size(), validCount, invalidCount,
                allErrors, validatedData);
    }

    // -----------------------------------------------------------------------
    // PRIVATE - CHECKS
    // -----------------------------------------------------------------------

    private void validateRequiredFields(CustomerRecord record, int row,
                                        List<ValidationError> errors) {
        requireField(record, CustomerField.CUSTOMER_ID,   ValidationErrorCode.MISSING_CUSTOMER_ID,   row, errors);
        requireField(record, CustomerField.ACCOUNT_OWNER, ValidationErrorCode.MISSING_ACCOUNT_OWNER, row, errors);
        requireField(record, CustomerField.STATUS,        ValidationErrorCode.MISSING_STATUS,        row, errors);
        requireField(record, CustomerField.ACCOUNT_TYPE,  ValidationErrorCode.MISSING_ACCOUNT_TYPE,  row, errors);
        requireField(record, CustomerField.CREATED_DATE,  ValidationErrorCode.MISSING_CREATED_DATE,  row, errors);
    }

    private void requireField(CustomerRecord record, CustomerField field,
                              ValidationErrorCode code, int row,
                              List<ValidationError> errors) {
        String value = record.get(field);
        if (value.isBlank()) {
            errors.add(new ValidationError(row, field.getHeaderName(), value,
                    "Required field '" + field.getHeaderName() + "' is missing", code));
        }
    }

    private void validateTypes(CustomerRecord record, int row, List<ValidationError> errors) {
        for (CustomerField field : List.of(CustomerField.CREATED_DATE, CustomerField.LATEST_LOGIN)) {
            String value = record.get(field);
            if (!value.isBlank() && !isValidDate(value)) {
                errors.add(new ValidationError(row, field.getHeaderName(), value,
                        "Invalid date format. Expected DD/MM/YYYY or DD/MM/YYYY, HH:mm",
                        ValidationErrorCode.INVALID_DATE_FORMAT));
            }
        }

        String mrr = record.getMrr();
        if (!mrr.isBlank() && parseMoney(mrr).isEmpty()) {
            errors.add(new ValidationError(row, CustomerField.MRR.getHeaderName(), mrr,
                    "Invalid number format for MRR", ValidationErrorCode.INVALID_NUMBER));
        }
    }

    private void validateValues(CustomerRecord record, int row, List<ValidationError> errors) {
        String status = record.getStatus();
        if (!status.isBlank() && CustomerStatus.fromLabel(status).isEmpty()) {
            errors.add(new ValidationError(row, CustomerField.STATUS.getHeaderName(), status,
                    "Invalid status. Must be '" + CustomerStatus.ACTIVE.getLabel()
                    + "' or '" + CustomerStatus.INACTIVE.getLabel() + "'",
                    ValidationErrorCode.INVALID_STATUS));
        }

        String accountType = record.getAccountType();
        if (!accountType.isBlank() && AccountType.fromLabel(accountType).isEmpty()) {
            errors.add(new ValidationError(row, CustomerField.ACCOUNT_TYPE.getHeaderName(), accountType,
                    "Invalid account type. Must be '" + AccountType.PRO.getLabel()
                    + "' or '" + AccountType.STARTER.getLabel() + "'",
                    ValidationErrorCode.INVALID_ACCOUNT_TYPE));
        }

        String mrr = record.getMrr();
        if (!mrr.isBlank()) {
            OptionalDouble amount = parseMoney(mrr);
            if (amount.isPresent() && amount.getAsDouble() < 0) {
                errors.add(new ValidationError(row, CustomerField.MRR.getHeaderName(), mrr,
                        "MRR must be non-negative", ValidationErrorCode.INVALID_MRR));
            }
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE - HELPERS
    // -----------------------------------------------------------------------

    /**
     * Checks the date pattern and component ranges. Day is only checked
     * against 1..31, so 31/02/2024 is accepted.
     */
    static boolean isValidDate(String value) {
        Matcher m = DATE_PATTERN.matcher(value);
        if (!m.matches()) {
            return false;
        }
        int day   = Integer.parseInt(m.group(1));
        int month = Integer.parseInt(m.group(2));
        int year  = Integer.parseInt(m.group(3));

        if (month < 1 || month > 12) return false;
        if (day < 1 || day > 31) return false;
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    /**
     * Reads a money value such as {@code "$1,234.50"}: everything except
     * digits, dots and minus signs is dropped, then the leading decimal is
     * parsed. Empty when no leading decimal remains.
     */
    static OptionalDouble parseMoney(String value) {
        String cleaned = NON_NUMERIC.matcher(value).replaceAll("");
        Matcher m = LEADING_DECIMAL.matcher(cleaned);
        if (!m.lookingAt()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(m.group()));
    }

    /** Fills blank optional fields in LENIENT mode; returns the record unchanged in STRICT mode. */
    CustomerRecord applyDefaults(CustomerRecord record) {
        if (mode == ValidationMode.STRICT) {
            return record;
        }
        CustomerRecord.Builder b = record.toBuilder();
        if (record.getMrr().isEmpty())          b.mrr(DEFAULT_MRR);
        if (record.getChannels().isEmpty())     b.channels(DEFAULT_CHANNELS);
        if (record.getLanguage().isEmpty())     b.language(DEFAULT_LANGUAGE);
        if (record.getPropertyType().isEmpty()) b.propertyType(DEFAULT_PROPERTY_TYPE);
        return b.build();
    }
}
