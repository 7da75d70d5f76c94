package com.nana.ingest.util;

import com.nana.ingest.service.ValidationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * ImportConfig - Import Pipeline Configuration
 *
 * <p>Values resolve in three layers: built-in defaults, then the
 * classpath resource {@code csv-import.properties}, then any overrides the
 * caller passes to {@link #load(Properties)}. An instance is immutable;
 * build a new one for a run that needs different settings.
 */
public final class ImportConfig {

    private static final Logger log = LoggerFactory.getLogger(ImportConfig.class);

    public static final String RESOURCE_NAME = "csv-import.properties";

    public static final String KEY_VALIDATION_MODE      = "validation.mode";
    public static final String KEY_MAX_SIZE_BYTES       = "upload.max.size.bytes";
    public static final String KEY_ACCEPTED_MIME_TYPES  = "upload.accepted.mime.types";
    public static final String KEY_COMPANION_REPORT     = "report.companion.enabled";

    public static final long DEFAULT_MAX_SIZE_BYTES = 10L * 1024 * 1024;

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_VALIDATION_MODE,     ValidationMode.STRICT.name());
        DEFAULTS.setProperty(KEY_MAX_SIZE_BYTES,      String.valueOf(DEFAULT_MAX_SIZE_BYTES));
        DEFAULTS.setProperty(KEY_ACCEPTED_MIME_TYPES,
                "text/csv,application/csv,text/plain,application/vnd.ms-excel");
        DEFAULTS.setProperty(KEY_COMPANION_REPORT,    "true");
    }

    private final Properties props;

    private ImportConfig(Properties props) {
        this.props = props;
    }

    // -----------------------------------------------------------------------
    // FACTORIES
    // -----------------------------------------------------------------------

    /** @return built-in defaults only, ignoring the classpath resource */
    public static ImportConfig defaults() {
        return new ImportConfig(new Properties(DEFAULTS));
    }

    /** @return defaults overlaid with {@code csv-import.properties}, if present */
    public static ImportConfig load() {
        return load(new Properties());
    }

    /**
     * Loads defaults, then the classpath resource, then {@code overrides}.
     *
     * @param overrides caller-supplied values; may be empty
     * @return the resolved configuration
     */
    public static ImportConfig load(Properties overrides) {
        Properties resolved = new Properties(DEFAULTS);
        try (InputStream in = ImportConfig.class.getClassLoader()
                .getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                resolved.load(in);
                log.debug("Loaded {} from classpath.", RESOURCE_NAME);
            } else {
                log.debug("{} not found on classpath; using defaults.", RESOURCE_NAME);
            }
        } catch (IOException ex) {
            log.warn("Failed to load {}: {}", RESOURCE_NAME, ex.getMessage());
        }
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                resolved.setProperty(key, overrides.getProperty(key));
            }
        }
        return new ImportConfig(resolved);
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Property '{}' is not a number ('{}'); using {}.",
                    key, raw, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key) {
        String val = props.getProperty(key, "false").toLowerCase(Locale.ROOT).trim();
        return val.equals("true") || val.equals("yes") || val.equals("1");
    }

    /**
     * Returns the validation mode. An unrecognised value falls back to
     * {@link ValidationMode#STRICT}.
     *
     * @return the configured mode
     */
    public ValidationMode getValidationMode() {
        String raw = props.getProperty(KEY_VALIDATION_MODE, "");
        try {
            return ValidationMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown validation mode '{}'; using STRICT.", raw);
            return ValidationMode.STRICT;
        }
    }

    /** @return the largest file size accepted for import, in bytes */
    public long getMaxSizeBytes() {
        return getLong(KEY_MAX_SIZE_BYTES, DEFAULT_MAX_SIZE_BYTES);
    }

    /** @return the MIME types accepted as CSV, lower-cased */
    public List<String> getAcceptedMimeTypes() {
        List<String> types = new ArrayList<>();
        for (String type : props.getProperty(KEY_ACCEPTED_MIME_TYPES, "").split(",")) {
            if (!type.isBlank()) {
                types.add(type.trim().toLowerCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableList(types);
    }

    /** @return true if a companion report file should be written for failed imports */
    public boolean isCompanionReportEnabled() {
        return getBoolean(KEY_COMPANION_REPORT);
    }

    @Override
    public String toString() {
        return "ImportConfig{mode=" + getValidationMode()
               + ", maxSizeBytes=" + getMaxSizeBytes()
               + ", mimeTypes=" + getAcceptedMimeTypes()
               + ", companionReport=" + isCompanionReportEnabled() + "}";
    }
}
