package com.nana.ingest.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * RecordShapes - Shape instances, shape detection and the row-mapping
 * helpers shared by the shape implementations.
 */
public final class RecordShapes {

    /** The customer-account export. */
    public static final CustomerRecordShape CUSTOMER = new CustomerRecordShape();

    /** The sentiment interaction export. */
    public static final SentimentRecordShape SENTIMENT = new SentimentRecordShape();

    private RecordShapes() {
        throw new UnsupportedOperationException(
                "RecordShapes is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // SHAPE DETECTION
    // -----------------------------------------------------------------------

    /**
     * Returns true if the first line of {@code content} carries every
     * sentiment header.
     *
     * <p>This is a cheap pre-check for routing an upload to the right
     * importer. The header line is split on plain commas, so quoted header
     * names containing commas are not supported here; the full parser
     * still validates the header row properly.
     *
     * @param content the raw file content
     * @return true if the file looks like a sentiment export
     */
    public static boolean isSentimentCsv(String content) {
        return hasAllHeaders(content, SENTIMENT.getHeaderContract());
    }

    /**
     * Returns true if the first line of {@code content} carries every
     * customer header.
     *
     * @param content the raw file content
     * @return true if the file looks like a customer export
     */
    public static boolean isCustomerCsv(String content) {
        return hasAllHeaders(content, CUSTOMER.getHeaderContract());
    }

    private static boolean hasAllHeaders(String content, HeaderContract contract) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        String firstLine = text.split("[\r\n]", 2)[0];
        if (firstLine.isBlank()) {
            return false;
        }

        List<String> headers = new ArrayList<>();
        for (String raw : firstLine.split(",", -1)) {
            headers.add(raw.trim().replaceAll("^\"|\"$", ""));
        }
        return contract.validate(headers).isValid();
    }

    // -----------------------------------------------------------------------
    // ROW-MAPPING HELPERS
    // -----------------------------------------------------------------------

    /**
     * Checks that a row has one field per header.
     *
     * @return the error message, or null if the counts match
     */
    static String checkFieldCount(List<String> fields, List<String> headers, int rowNumber) {
        if (fields.size() != headers.size()) {
            return "Row " + rowNumber + ": Expected " + headers.size()
                   + " fields but got " + fields.size();
        }
        return null;
    }

    /**
     * Builds a trimmed-header to value lookup for a row whose field count
     * has already been checked.
     */
    static Map<String, String> buildLookup(List<String> fields, List<String> headers) {
        Map<String, String> lookup = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String value = fields.get(i);
            lookup.put(headers.get(i).trim(), value == null ? "" : value);
        }
        return lookup;
    }

    static String missingFieldMessage(int rowNumber, String header) {
        return "Row " + rowNumber + ": Missing required field '" + header + "'";
    }
}
