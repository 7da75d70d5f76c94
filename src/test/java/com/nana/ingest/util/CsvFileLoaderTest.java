package com.nana.ingest.util;

import com.nana.ingest.service.ValidationMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Properties;

import static com.nana.ingest.CsvFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CsvFileLoader} and the {@link ImportConfig} values it reads.
 */
class CsvFileLoaderTest {

    @TempDir
    Path tempDir;

    private final CsvFileLoader loader = new CsvFileLoader(ImportConfig.defaults());

    private static FileMetadata meta(String name, long size, String mime) {
        return new FileMetadata(name, size, mime, Instant.EPOCH);
    }

    // ======================================================================
    // METADATA VALIDATION
    // ======================================================================

    @Nested
    @DisplayName("validate(FileMetadata)")
    class ValidateTests {

        @Test
        @DisplayName("Zero-byte file is EMPTY_FILE")
        void emptyFile() {
            FileUploadException ex = assertThrows(FileUploadException.class,
                    () -> loader.validate(meta("a.csv", 0, "text/csv")));
            assertEquals(FileUploadErrorCode.EMPTY_FILE, ex.getCode());
            assertEquals("File is empty", ex.getMessage());
        }

        @Test
        @DisplayName("File over the limit is FILE_TOO_LARGE")
        void tooLarge() {
            FileUploadException ex = assertThrows(FileUploadException.class,
                    () -> loader.validate(meta("a.csv", 10L * 1024 * 1024 + 1, "text/csv")));
            assertEquals(FileUploadErrorCode.FILE_TOO_LARGE, ex.getCode());
            assertEquals("File exceeds maximum size of 10MB", ex.getMessage());
        }

        @Test
        @DisplayName("File exactly at the limit is accepted")
        void atLimit() {
            assertDoesNotThrow(() -> loader.validate(meta("a.csv", 10L * 1024 * 1024, "text/csv")));
        }

        @Test
        @DisplayName("Accepted MIME types pass regardless of extension")
        void acceptedMimeTypes() {
            for (String mime : List.of("text/csv", "application/csv", "text/plain",
                    "application/vnd.ms-excel", "TEXT/CSV")) {
                assertDoesNotThrow(() -> loader.validate(meta("export", 10, mime)), mime);
            }
        }

        @Test
        @DisplayName("Configured MIME types are matched regardless of their case")
        void configuredMimeTypesIgnoreCase() {
            CsvFileLoader custom = new CsvFileLoader(1024, List.of("TEXT/CSV", " Application/X-Export "));

            assertDoesNotThrow(() -> custom.validate(meta("export", 10, "text/csv")));
            assertDoesNotThrow(() -> custom.validate(meta("export", 10, "application/x-export")));
            FileUploadException ex = assertThrows(FileUploadException.class,
                    () -> custom.validate(meta("export", 10, "text/plain")));
            assertEquals(FileUploadErrorCode.INVALID_TYPE, ex.getCode());
        }

        @Test
        @DisplayName("Unknown MIME type passes only with a .csv extension")
        void extensionFallback() {
            assertDoesNotThrow(() -> loader.validate(meta("Export.CSV", 10, "application/octet-stream")));
            assertDoesNotThrow(() -> loader.validate(meta("export.csv", 10, "")));

            FileUploadException ex = assertThrows(FileUploadException.class,
                    () -> loader.validate(meta("export.xlsx", 10, "application/octet-stream")));
            assertEquals(FileUploadErrorCode.INVALID_TYPE, ex.getCode());
            assertEquals("File must be a CSV file", ex.getMessage());
        }
    }

    // ======================================================================
    // READING FILES
    // ======================================================================

    @Nested
    @DisplayName("load(Path)")
    class LoadTests {

        @Test
        @DisplayName("UTF-8 CSV file is loaded with its metadata")
        void loadsFile() throws Exception {
            Path file = tempDir.resolve("accounts.csv");
            String content = csv(CUSTOMER_HEADER, VALID_CUSTOMER_ROW);
            Files.writeString(file, content, StandardCharsets.UTF_8);

            LoadedFile loaded = loader.load(file);

            assertEquals(content, loaded.getContent());
            assertEquals("accounts.csv", loaded.getMetadata().getName());
            assertEquals(Files.size(file), loaded.getMetadata().getSize());
            assertNotNull(loaded.getMetadata().getLastModified());
        }

        @Test
        @DisplayName("BOM is passed through for the parser to strip")
        void keepsBom() throws Exception {
            Path file = tempDir.resolve("bom.csv");
            Files.writeString(file, "\uFEFF" + csv(SENTIMENT_HEADER, VALID_SENTIMENT_ROW),
                    StandardCharsets.UTF_8);

            assertTrue(loader.load(file).getContent().startsWith("\uFEFF"));
        }

        @Test
        @DisplayName("Missing file is READ_ERROR")
        void missingFile() {
            FileUploadException ex = assertThrows(FileUploadException.class,
                    () -> loader.load(tempDir.resolve("nope.csv")));
            assertEquals(FileUploadErrorCode.READ_ERROR, ex.getCode());
        }

        @Test
        @DisplayName("Directory is READ_ERROR")
        void directory() throws IOException {
            Path dir = Files.createDirectory(tempDir.resolve("folder.csv"));
            FileUploadException ex = assertThrows(FileUploadException.class, () -> loader.load(dir));
            assertEquals(FileUploadErrorCode.READ_ERROR, ex.getCode());
        }

        @Test
        @DisplayName("Empty file is EMPTY_FILE")
        void emptyFile() throws IOException {
            Path file = Files.createFile(tempDir.resolve("empty.csv"));
            FileUploadException ex = assertThrows(FileUploadException.class, () -> loader.load(file));
            assertEquals(FileUploadErrorCode.EMPTY_FILE, ex.getCode());
        }

        @Test
        @DisplayName("Malformed UTF-8 is ENCODING_ERROR")
        void malformedUtf8() throws IOException {
            Path file = tempDir.resolve("latin1.csv");
            Files.write(file, new byte[] {'a', ',', (byte) 0xC3, (byte) 0x28, '\n'});

            FileUploadException ex = assertThrows(FileUploadException.class, () -> loader.load(file));
            assertEquals(FileUploadErrorCode.ENCODING_ERROR, ex.getCode());
        }

        @Test
        @DisplayName("File over a configured limit is FILE_TOO_LARGE")
        void configuredLimit() throws IOException {
            Properties overrides = new Properties();
            overrides.setProperty(ImportConfig.KEY_MAX_SIZE_BYTES, "16");
            CsvFileLoader small = new CsvFileLoader(ImportConfig.load(overrides));

            Path file = tempDir.resolve("big.csv");
            Files.writeString(file, csv(SENTIMENT_HEADER, VALID_SENTIMENT_ROW));

            FileUploadException ex = assertThrows(FileUploadException.class, () -> small.load(file));
            assertEquals(FileUploadErrorCode.FILE_TOO_LARGE, ex.getCode());
        }

        @Test
        @DisplayName("Read on an interrupted thread is CANCELLED")
        void interrupted() throws IOException {
            Path file = tempDir.resolve("accounts.csv");
            Files.writeString(file, csv(SENTIMENT_HEADER, VALID_SENTIMENT_ROW));

            Thread.currentThread().interrupt();
            try {
                FileUploadException ex = assertThrows(FileUploadException.class, () -> loader.load(file));
                assertEquals(FileUploadErrorCode.CANCELLED, ex.getCode());
            } finally {
                Thread.interrupted();
            }
        }
    }

    // ======================================================================
    // CONFIGURATION
    // ======================================================================

    @Nested
    @DisplayName("ImportConfig")
    class ImportConfigTests {

        @Test
        @DisplayName("Defaults match the documented values")
        void defaults() {
            ImportConfig config = ImportConfig.defaults();
            assertEquals(ValidationMode.STRICT, config.getValidationMode());
            assertEquals(10L * 1024 * 1024, config.getMaxSizeBytes());
            assertEquals(List.of("text/csv", "application/csv", "text/plain",
                    "application/vnd.ms-excel"), config.getAcceptedMimeTypes());
            assertTrue(config.isCompanionReportEnabled());
        }

        @Test
        @DisplayName("Classpath file loads without changing the defaults")
        void classpathFile() {
            ImportConfig config = ImportConfig.load();
            assertEquals(ValidationMode.STRICT, config.getValidationMode());
            assertEquals(10485760L, config.getMaxSizeBytes());
        }

        @Test
        @DisplayName("Overrides win over defaults and the classpath file")
        void overrides() {
            Properties overrides = new Properties();
            overrides.setProperty(ImportConfig.KEY_VALIDATION_MODE, "lenient");
            overrides.setProperty(ImportConfig.KEY_COMPANION_REPORT, "false");
            overrides.setProperty(ImportConfig.KEY_ACCEPTED_MIME_TYPES, " Text/CSV , ");

            ImportConfig config = ImportConfig.load(overrides);
            assertEquals(ValidationMode.LENIENT, config.getValidationMode());
            assertFalse(config.isCompanionReportEnabled());
            assertEquals(List.of("text/csv"), config.getAcceptedMimeTypes());
        }

        @Test
        @DisplayName("Bad values fall back instead of failing")
        void badValues() {
            Properties overrides = new Properties();
            overrides.setProperty(ImportConfig.KEY_VALIDATION_MODE, "sloppy");
            overrides.setProperty(ImportConfig.KEY_MAX_SIZE_BYTES, "ten");

            ImportConfig config = ImportConfig.load(overrides);
            assertEquals(ValidationMode.STRICT, config.getValidationMode());
            assertEquals(ImportConfig.DEFAULT_MAX_SIZE_BYTES, config.getMaxSizeBytes());
        }
    }
}
