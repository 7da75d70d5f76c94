package com.nana.ingest.util;

/**
 * Reasons a CSV file can be refused before or while it is read.
 */
public enum FileUploadErrorCode {

    /** Neither the MIME type nor the extension identifies a CSV file. */
    INVALID_TYPE,

    /** The file is larger than the configured maximum. */
    FILE_TOO_LARGE,

    /** The file has zero bytes. */
    EMPTY_FILE,

    /** The file could not be opened or read. */
    READ_ERROR,

    /** The bytes are not valid UTF-8. */
    ENCODING_ERROR,

    /** The reading thread was interrupted. */
    CANCELLED
}
