package com.nana.ingest.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CsvFileLoader - Reads a CSV export from disk for the import pipeline
 *
 * <p>Checks run in this order, each raising {@link FileUploadException}
 * with its own code:
 * <ol>
 *   <li>The path is an existing, readable regular file ({@code READ_ERROR}).</li>
 *   <li>Size is non-zero ({@code EMPTY_FILE}).</li>
 *   <li>Size does not exceed the configured maximum ({@code FILE_TOO_LARGE}).</li>
 *   <li>MIME type is accepted, or the name ends in {@code .csv}
 *       ({@code INVALID_TYPE}).</li>
 * </ol>
 *
 * <p>The whole file is then decoded as strict UTF-8: malformed or
 * unmappable bytes raise {@code ENCODING_ERROR} instead of being replaced.
 * A read on an interrupted thread raises {@code CANCELLED}.
 *
 * <p>The decoded text is returned as-is; BOM stripping and line splitting
 * belong to {@link CsvRecordParser}.
 */
public class CsvFileLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvFileLoader.class);

    private static final long BYTES_PER_MIB = 1024L * 1024L;

    private final long         maxSizeBytes;
    private final List<String> acceptedMimeTypes;

    /** Creates a loader using the limits in {@code config}. */
    public CsvFileLoader(ImportConfig config) {
        this(config.getMaxSizeBytes(), config.getAcceptedMimeTypes());
    }

    /**
     * @param maxSizeBytes      largest accepted size in bytes; must be positive
     * @param acceptedMimeTypes MIME types treated as CSV, compared case-insensitively
     */
    public CsvFileLoader(long maxSizeBytes, List<String> acceptedMimeTypes) {
        if (maxSizeBytes <= 0) {
            throw new IllegalArgumentException(
                    "maxSizeBytes must be positive, got " + maxSizeBytes);
        }
        if (acceptedMimeTypes == null) {
            throw new IllegalArgumentException("acceptedMimeTypes must not be null.");
        }
        this.maxSizeBytes      = maxSizeBytes;
        List<String> normalized = new ArrayList<>(acceptedMimeTypes.size());
        for (String type : acceptedMimeTypes) {
            normalized.add(type.trim().toLowerCase(Locale.ROOT));
        }
        this.acceptedMimeTypes = List.copyOf(normalized);
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Checks a file's metadata without reading it.
     *
     * @param metadata the file to check
     * @throws FileUploadException with {@code EMPTY_FILE}, {@code FILE_TOO_LARGE}
     *                             or {@code INVALID_TYPE}
     */
    public void validate(FileMetadata metadata) throws FileUploadException {
        if (metadata.getSize() == 0) {
            throw new FileUploadException(FileUploadErrorCode.EMPTY_FILE, "File is empty");
        }
        if (metadata.getSize() > maxSizeBytes) {
            throw new FileUploadException(FileUploadErrorCode.FILE_TOO_LARGE,
                    "File exceeds maximum size of "
                    + Math.round((double) maxSizeBytes / BYTES_PER_MIB) + "MB");
        }
        if (!isAcceptedType(metadata)) {
            throw new FileUploadException(FileUploadErrorCode.INVALID_TYPE,
                    "File must be a CSV file");
        }
    }

    /**
     * Validates and reads a file as UTF-8 text.
     *
     * @param path the file to read
     * @return the decoded content with its metadata
     * @throws FileUploadException if the file is refused or cannot be decoded
     */
    public LoadedFile load(Path path) throws FileUploadException {
        FileMetadata metadata = describe(path);
        validate(metadata);

        if (Thread.currentThread().isInterrupted()) {
            throw new FileUploadException(FileUploadErrorCode.CANCELLED,
                    "File read was cancelled");
        }

        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (ClosedByInterruptException ex) {
            throw new FileUploadException(FileUploadErrorCode.CANCELLED,
                    "File read was cancelled", ex);
        } catch (IOException ex) {
            log.error("Failed to read '{}'.", path, ex);
            throw new FileUploadException(FileUploadErrorCode.READ_ERROR,
                    "Failed to read file", ex);
        }

        String content = decodeUtf8(bytes, metadata.getName());
        log.debug("Loaded '{}': {} bytes, {} chars.",
                metadata.getName(), bytes.length, content.length());
        return new LoadedFile(content, metadata);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    /**
     * Collects metadata for a path, failing with {@code READ_ERROR} if it is
     * missing, not a regular file, or unreadable.
     */
    private FileMetadata describe(Path path) throws FileUploadException {
        if (path == null) {
            throw new IllegalArgumentException("path must not be null.");
        }
        if (!Files.exists(path)) {
            throw new FileUploadException(FileUploadErrorCode.READ_ERROR,
                    "File does not exist: " + path.toAbsolutePath());
        }
        if (!Files.isRegularFile(path)) {
            throw new FileUploadException(FileUploadErrorCode.READ_ERROR,
                    "Path is not a regular file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new FileUploadException(FileUploadErrorCode.READ_ERROR,
                    "File is not readable (check permissions): " + path);
        }

        try {
            long size = Files.size(path);
            String mimeType = Files.probeContentType(path);
            Instant modified = Files.getLastModifiedTime(path).toInstant();
            return new FileMetadata(path.getFileName().toString(), size, mimeType, modified);
        } catch (NoSuchFileException ex) {
            throw new FileUploadException(FileUploadErrorCode.READ_ERROR,
                    "File does not exist: " + path.toAbsolutePath(), ex);
        } catch (IOException ex) {
            throw new FileUploadException(FileUploadErrorCode.READ_ERROR,
                    "Failed to read file", ex);
        }
    }

    private boolean isAcceptedType(FileMetadata metadata) {
        String mime = metadata.getMimeType().toLowerCase(Locale.ROOT);
        if (!mime.isEmpty() && acceptedMimeTypes.contains(mime)) {
            return true;
        }
        return metadata.getName().toLowerCase(Locale.ROOT).endsWith(".csv");
    }

    private String decodeUtf8(byte[] bytes, String name) throws FileUploadException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException ex) {
            log.warn("'{}' is not valid UTF-8: {}", name, ex.toString());
            throw new FileUploadException(FileUploadErrorCode.ENCODING_ERROR,
                    "File is not valid UTF-8 text", ex);
        }
    }
}
