package com.nana.ingest.service;

import com.nana.ingest.domain.CustomerRecord;

import java.util.List;
import java.util.Objects;

/**
 * A customer record after validation, with whatever errors it carries.
 *
 * <p>In lenient mode the record may have defaults applied and still be
 * invalid; {@link #isValid()} is true only when {@link #getErrors()} is
 * empty.
 */
public final class ValidatedRecord {

    private final CustomerRecord        record;
    private final boolean               valid;
    private final List<ValidationError> errors;

    public ValidatedRecord(CustomerRecord record, boolean valid, List<ValidationError> errors) {
        this.record = Objects.requireNonNull(record, "record");
        this.valid  = valid;
        this.errors = List.copyOf(errors);
    }

    public CustomerRecord getRecord()       { return record; }
    public boolean isValid()                { return valid; }
    public List<ValidationError> getErrors() { return errors; }

    @Override
    public String toString() {
        return "ValidatedRecord{customerId='" + record.getCustomerId()
               + "', valid=" + valid + ", errors=" + errors.size() + "}";
    }
}
