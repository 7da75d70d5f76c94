package com.nana.ingest.service;

import java.util.List;

/**
 * Totals and per-record outcomes of {@link FieldValidator#validateBatch}.
 * {@code validatedData} has one entry per input record, in input order.
 */
public final class BatchValidationResult {

    private final int                   totalRecords;
    private final int                   validRecords;
    private final int                   invalidRecords;
    private final List<ValidationError> errors;
    private final List<ValidatedRecord> validatedData;

    public BatchValidationResult(int totalRecords,
                                 int validRecords,
                                 int invalidRecords,
                                 List<ValidationError> errors,
                                 List<ValidatedRecord> validatedData) {
        this.totalRecords   = totalRecords;
        this.validRecords   = validRecords;
        this.invalidRecords = invalidRecords;
        this.errors         = List.copyOf(errors);
        this.validatedData  = List.copyOf(validatedData);
    }

    public int getTotalRecords()                  { return totalRecords; }
    public int getValidRecords()                  { return validRecords; }
    public int getInvalidRecords()                { return invalidRecords; }
    public List<ValidationError> getErrors()      { return errors; }
    public List<ValidatedRecord> getValidatedData() { return validatedData; }

    @Override
    public String toString() {
        return "BatchValidationResult{total=" + totalRecords
               + ", valid=" + validRecords
               + ", invalid=" + invalidRecords
               + ", errors=" + errors.size() + "}";
    }
}
