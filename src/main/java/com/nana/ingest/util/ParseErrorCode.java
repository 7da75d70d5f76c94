package com.nana.ingest.util;

/**
 * ParseErrorCode - Categorises a {@link ParseError}.
 *
 * <p>Three codes are structural and stop the whole parse; one is
 * row-level and only drops the offending row.
 */
public enum ParseErrorCode {

    /** The header row is missing one or more required columns. Structural. */
    INVALID_HEADERS(true),

    /**
     * A data row could not be mapped: wrong field count, or its
     * identifying field is blank. Row-level.
     */
    MALFORMED_ROW(false),

    /** No content, or a header row with no data rows. Structural. */
    EMPTY_FILE(true),

    /** The file could not be decoded as UTF-8 text. Structural. */
    INVALID_ENCODING(true);

    private final boolean structural;

    ParseErrorCode(boolean structural) {
        this.structural = structural;
    }

    /** @return true if this error halts the whole parse */
    public boolean isStructural() {
        return structural;
    }
}
