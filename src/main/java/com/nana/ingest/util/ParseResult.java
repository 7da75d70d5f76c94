package com.nana.ingest.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ParseResult - Outcome of a parse that got past the header row.
 *
 * <p>Holds the records that mapped cleanly and the row-level errors for
 * those that did not. {@link #getSourceRows()} runs parallel to
 * {@link #getRecords()}: entry {@code i} is the row number record
 * {@code i} came from, so later stages can report errors against the row
 * the user sees.
 *
 * @param <R> the record type
 */
public final class ParseResult<R> {

    private final List<R>          records;
    private final List<Integer>    sourceRows;
    private final List<ParseError> errors;
    private final int              totalRows;

    /**
     * @param records    records in file order
     * @param sourceRows source row number of each record; same size as {@code records}
     * @param errors     row-level errors in file order
     * @param totalRows  number of non-blank data rows (header excluded)
     */
    public ParseResult(List<R> records,
                       List<Integer> sourceRows,
                       List<ParseError> errors,
                       int totalRows) {
        if (records.size() != sourceRows.size()) {
            throw new IllegalArgumentException(
                    "Expected one source row per record, got "
                    + sourceRows.size() + " for " + records.size() + " records.");
        }
        this.records    = Collections.unmodifiableList(new ArrayList<>(records));
        this.sourceRows = Collections.unmodifiableList(new ArrayList<>(sourceRows));
        this.errors     = Collections.unmodifiableList(new ArrayList<>(errors));
        this.totalRows  = totalRows;
    }

    /** @return the successfully mapped records in file order */
    public List<R> getRecords()          { return records; }

    /** @return the 1-based source row of each record */
    public List<Integer> getSourceRows() { return sourceRows; }

    /** @return the row-level errors in file order */
    public List<ParseError> getErrors()  { return errors; }

    /** @return the number of data rows seen (header and blank lines excluded) */
    public int getTotalRows()            { return totalRows; }

    /** @return the number of rows that produced a record */
    public int getSuccessfulRows()       { return records.size(); }

    /** @return true if no row was rejected */
    public boolean isFullSuccess()       { return errors.isEmpty(); }

    @Override
    public String toString() {
        return "ParseResult{total=" + totalRows
               + ", successful=" + records.size()
               + ", errors=" + errors.size() + "}";
    }
}
