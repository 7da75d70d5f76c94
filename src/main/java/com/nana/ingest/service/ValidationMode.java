package com.nana.ingest.service;

/**
 * How {@link FieldValidator} treats a record with field errors.
 */
public enum ValidationMode {

    /** Any field error rejects the record. */
    STRICT,

    /**
     * Records are kept even with field errors; errors are reported and
     * blank optional fields receive defaults.
     */
    LENIENT
}
