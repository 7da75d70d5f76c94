package com.nana.ingest.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * HeaderContract - The required columns of one record shape.
 *
 * <p>Header names are compared exactly (after trimming the observed
 * names). Order does not matter and extra columns are tolerated, so a
 * file whose columns were reordered, or which carries additional CRM
 * columns, still satisfies the contract.
 */
public final class HeaderContract {

    private final List<String> requiredHeaders;

    /**
     * Creates a contract for the given required headers.
     *
     * @param requiredHeaders the header names every file must contain;
     *                        must not be null or empty
     */
    public HeaderContract(List<String> requiredHeaders) {
        if (requiredHeaders == null || requiredHeaders.isEmpty()) {
            throw new IllegalArgumentException(
                    "A header contract needs at least one required header.");
        }
        this.requiredHeaders = Collections.unmodifiableList(
                new ArrayList<>(requiredHeaders));
    }

    /** @return the required header names in declaration order */
    public List<String> getRequiredHeaders() {
        return requiredHeaders;
    }

    /**
     * Checks an observed header row against this contract.
     *
     * @param observedHeaders the header row as tokenized from the file
     * @return the validation outcome, never null
     */
    public HeaderValidation validate(List<String> observedHeaders) {
        List<String> actual = new ArrayList<>();
        if (observedHeaders != null) {
            for (String header : observedHeaders) {
                actual.add(header == null ? "" : header.trim());
            }
        }

        Set<String> observed = new LinkedHashSet<>(actual);
        Set<String> required = new LinkedHashSet<>(requiredHeaders);

        List<String> missing = new ArrayList<>();
        for (String header : requiredHeaders) {
            if (!observed.contains(header)) {
                missing.add(header);
            }
        }

        List<String> extra = new ArrayList<>();
        for (String header : actual) {
            if (!required.contains(header)) {
                extra.add(header);
            }
        }

        return new HeaderValidation(missing, extra, actual);
    }
}
