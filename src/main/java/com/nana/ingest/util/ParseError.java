package com.nana.ingest.util;

import java.util.Objects;
import java.util.Optional;

/**
 * ParseError - One problem found while reading a CSV file.
 *
 * <p>{@code row} is 1-based and counts non-blank lines, with the header as
 * row 1. File-level problems use row 0. {@code column} names the offending
 * column when one is known.
 */
public final class ParseError {

    private final int            row;
    private final String         column;
    private final String         message;
    private final ParseErrorCode code;

    /**
     * Creates an error without column context.
     *
     * @param row     1-based row number, or 0 for file-level errors
     * @param message human-readable description
     * @param code    the error category
     */
    public ParseError(int row, String message, ParseErrorCode code) {
        this(row, null, message, code);
    }

    /**
     * Creates an error with column context.
     *
     * @param row     1-based row number, or 0 for file-level errors
     * @param column  the offending column header; may be null
     * @param message human-readable description
     * @param code    the error category
     */
    public ParseError(int row, String column, String message, ParseErrorCode code) {
        this.row     = row;
        this.column  = column;
        this.message = message == null ? "" : message;
        this.code    = Objects.requireNonNull(code, "code must not be null");
    }

    public int getRow()               { return row; }

    public Optional<String> getColumn() { return Optional.ofNullable(column); }

    public String getMessage()        { return message; }

    public ParseErrorCode getCode()   { return code; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseError)) return false;
        ParseError that = (ParseError) o;
        return row == that.row
               && Objects.equals(column, that.column)
               && message.equals(that.message)
               && code == that.code;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, message, code);
    }

    @Override
    public String toString() {
        return "ParseError{row=" + row
               + (column == null ? "" : ", column='" + column + "'")
               + ", code=" + code
               + ", message='" + message + "'}";
    }
}
