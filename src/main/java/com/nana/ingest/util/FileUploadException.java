package com.nana.ingest.util;

/**
 * FileUploadException - Checked exception raised at the file boundary
 *
 * <p>Thrown by {@link CsvFileLoader} when a file is refused (wrong type,
 * too large, empty) or cannot be read (I/O failure, bad encoding,
 * interrupted read). Callers that import whole batches convert it into a
 * structural {@link ParseError} so the import still produces a report.
 */
public class FileUploadException extends Exception {

    private final FileUploadErrorCode code;

    public FileUploadException(FileUploadErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FileUploadException(FileUploadErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** @return the reason the file was refused */
    public FileUploadErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "FileUploadException{code=" + code + ", message='" + getMessage() + "'}";
    }
}
