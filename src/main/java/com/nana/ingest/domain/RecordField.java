package com.nana.ingest.domain;

/**
 * A single named column of a record shape.
 *
 * <p>Implemented by the per-shape field enums ({@link CustomerField},
 * {@link SentimentField}) so that code which must visit every column of a
 * record (the sanitizer, the report writer) can do so without knowing the
 * concrete record type.
 *
 * @param <R> the record type the field belongs to
 */
public interface RecordField<R> {

    /**
     * @return the bit-exact CSV column header for this field
     */
    String getHeaderName();

    /**
     * Reads this field's value from a record.
     *
     * @param record the record to read; may be null
     * @return the field value, or an empty string for a null record
     */
    String extract(R record);
}
