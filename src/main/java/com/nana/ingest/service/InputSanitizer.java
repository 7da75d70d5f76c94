package com.nana.ingest.service;

import com.nana.ingest.domain.CustomerRecord;
import com.nana.ingest.domain.RecordField;
import com.nana.ingest.domain.SentimentRecord;
import com.nana.ingest.util.RecordShapes;
import com.nana.ingest.util.RecordShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * InputSanitizer - Neutralises spreadsheet formulas and markup in CSV values
 *
 * <p>Every value goes through two steps:
 * <ol>
 *   <li><b>Formula injection.</b> A value whose first non-whitespace
 *       character is {@code = + - @}, a tab, CR or LF is prefixed with a
 *       single quote so spreadsheet tools show it as text. Signed numbers
 *       such as {@code -100} or {@code +44} are left alone. A warning
 *       quoting the first 20 characters is recorded.</li>
 *   <li><b>Markup.</b> {@code & < > " '} become
 *       {@code &amp; &lt; &gt; &quot; &#x27;}.</li>
 * </ol>
 * The quote added in step 1 is itself escaped by step 2.
 *
 * <p>Sanitizing never fails and never drops a value. Output is not
 * meant to be sanitized a second time: {@code &} in an already escaped
 * value is escaped again.
 */
public class InputSanitizer {

    private static final Logger log = LoggerFactory.getLogger(InputSanitizer.class);

    private static final String FORMULA_TRIGGERS = "=+-@\t\r\n";
    private static final Pattern SIGNED_NUMBER   = Pattern.compile("^[-+]\\d");
    private static final int PREVIEW_LENGTH      = 20;

    // -----------------------------------------------------------------------
    // STRINGS
    // -----------------------------------------------------------------------

    /**
     * Sanitizes one value.
     *
     * @param input raw value; null is treated as empty
     * @return the escaped value and at most one formula warning
     */
    public SanitizationResult<String> sanitizeString(String input) {
        if (input == null || input.isEmpty()) {
            return new SanitizationResult<>("", List.of());
        }

        List<String> warnings = new ArrayList<>(1);
        String sanitized = input;

        if (isFormulaInjection(input)) {
            String preview = input.length() > PREVIEW_LENGTH
                    ? input.substring(0, PREVIEW_LENGTH) : input;
            warnings.add("Potential formula injection detected: \"" + preview + "...\"");
            sanitized = "'" + sanitized;
        }

        return new SanitizationResult<>(escapeHtml(sanitized), warnings);
    }

    // -----------------------------------------------------------------------
    // RECORDS
    // -----------------------------------------------------------------------

    /**
     * Sanitizes every field of a record. Warnings are prefixed with the
     * field's header, e.g. {@code "Account Name: Potential formula ..."}.
     *
     * @param record the record to clean
     * @param shape  the shape describing the record's fields
     * @param <R>    record type
     * @return a new record with every field sanitized
     */
    public <R> SanitizationResult<R> sanitizeRecord(R record, RecordShape<R> shape) {
        List<String> warnings = new ArrayList<>();
        Map<String, String> cleaned = new HashMap<>();

        for (RecordField<R> field : shape.getFields()) {
            SanitizationResult<String> result = sanitizeString(field.extract(record));
            cleaned.put(field.getHeaderName(), result.getValue());
            for (String warning : result.getWarnings()) {
                warnings.add(field.getHeaderName() + ": " + warning);
            }
        }

        return new SanitizationResult<>(shape.fromValues(cleaned), warnings);
    }

    public SanitizationResult<CustomerRecord> sanitizeRecord(CustomerRecord record) {
        return sanitizeRecord(record, RecordShapes.CUSTOMER);
    }

    public SanitizationResult<SentimentRecord> sanitizeRecord(SentimentRecord record) {
        return sanitizeRecord(record, RecordShapes.SENTIMENT);
    }

    /**
     * Sanitizes a list of records. Warnings are prefixed with
     * {@code "Row N: "}, N being the record's 1-based position in the list.
     *
     * @param records the records to clean
     * @param shape   the shape describing the records' fields
     * @param <R>     record type
     * @return the cleaned records, same size and order as the input
     */
    public <R> SanitizationResult<List<R>> sanitizeBatch(List<R> records, RecordShape<R> shape) {
        List<R> sanitized = new ArrayList<>(records.size());
        List<String> warnings = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            SanitizationResult<R> result = sanitizeRecord(records.get(i), shape);
            sanitized.add(result.getValue());
            for (String warning : result.getWarnings()) {
                warnings.add("Row " + (i + 1) + ": " + warning);
            }
        }

        if (!warnings.isEmpty()) {
            log.warn("Sanitized {} {} records with {} warning(s).",
                    records.size(), shape.getName(), warnings.size());
        }
        return new SanitizationResult<>(sanitized, warnings);
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private boolean isFormulaInjection(String input) {
        String trimmed = input.strip();
        if (trimmed.isEmpty()) {
            return false;
        }
        if (FORMULA_TRIGGERS.indexOf(trimmed.charAt(0)) < 0) {
            return false;
        }
        return !SIGNED_NUMBER.matcher(trimmed).lookingAt();
    }

    private String escapeHtml(String input) {
        StringBuilder sb = new StringBuilder(input.length() + 16);
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            switch (c) {
                case '&':  sb.append("&amp;");  break;
                case '<':  sb.append("&lt;");   break;
                case '>':  sb.append("&gt;");   break;
                case '"':  sb.append("&quot;"); break;
                case '\'': sb.append("&#x27;"); break;
                default:   sb.append(c);
            }
        }
        return sb.toString();
    }
}
