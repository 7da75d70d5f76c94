package com.nana.ingest.util;

import com.nana.ingest.domain.RecordField;
import com.nana.ingest.domain.Result;

import java.util.List;
import java.util.Map;

/**
 * RecordShape - The contract for one kind of CSV export.
 *
 * <p>A shape supplies everything the generic {@link CsvRecordParser}
 * needs to know about a file type: which headers it must carry, which
 * fields a record has, and how a tokenized row becomes a record. The
 * parser is handed a shape as a strategy object; there is one
 * implementation per export ({@link CustomerRecordShape},
 * {@link SentimentRecordShape}).
 *
 * @param <R> the record type produced by this shape
 */
public interface RecordShape<R> {

    /** @return a short name for logs and reports (e.g., "customer") */
    String getName();

    /** @return the header contract every file of this shape must satisfy */
    HeaderContract getHeaderContract();

    /** @return every field of the record, in canonical column order */
    List<? extends RecordField<R>> getFields();

    /**
     * Maps one tokenized data row to a record.
     *
     * @param fields    the tokenized row
     * @param headers   the tokenized header row
     * @param rowNumber 1-based row number, for error messages
     * @return the record, or a failure carrying a human-readable reason
     */
    Result<R, String> mapFields(List<String> fields, List<String> headers, int rowNumber);

    /**
     * Builds a record from header-keyed values. Headers absent from the
     * map produce empty fields.
     *
     * @param valuesByHeader column values keyed by exact header name
     * @return the record
     */
    R fromValues(Map<String, String> valuesByHeader);
}
