package com.nana.ingest.service;

import java.util.Objects;

/**
 * One failed field check, tied to the row and column it came from.
 */
public final class ValidationError {

    private final int                 rowNumber;
    private final String              field;
    private final String              value;
    private final String              message;
    private final ValidationErrorCode code;

    /**
     * @param rowNumber row the record came from
     * @param field     header name of the offending column
     * @param value     the raw value that failed; null is stored as ""
     * @param message   human-readable explanation
     * @param code      failure category
     */
    public ValidationError(int rowNumber, String field, String value,
                           String message, ValidationErrorCode code) {
        this.rowNumber = rowNumber;
        this.field     = Objects.requireNonNull(field, "field");
        this.value     = value == null ? "" : value;
        this.message   = Objects.requireNonNull(message, "message");
        this.code      = Objects.requireNonNull(code, "code");
    }

    public int getRowNumber()             { return rowNumber; }
    public String getField()              { return field; }
    public String getValue()              { return value; }
    public String getMessage()            { return message; }
    public ValidationErrorCode getCode()  { return code; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError)) return false;
        ValidationError that = (ValidationError) o;
        return rowNumber == that.rowNumber
                && field.equals(that.field)
                && value.equals(that.value)
                && message.equals(that.message)
                && code == that.code;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, field, value, message, code);
    }

    @Override
    public String toString() {
        return "ValidationError{row=" + rowNumber + ", field='" + field
               + "', code=" + code + ", message='" + message + "'}";
    }
}
