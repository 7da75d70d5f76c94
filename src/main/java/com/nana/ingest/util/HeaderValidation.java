package com.nana.ingest.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of checking an observed header row against a
 * {@link HeaderContract}.
 *
 * <p>{@link #isValid()} is true exactly when no required header is missing.
 * Extra headers are reported for information only.
 */
public final class HeaderValidation {

    private final List<String> missingHeaders;
    private final List<String> extraHeaders;
    private final List<String> actualHeaders;

    /**
     * @param missingHeaders required headers absent from the file
     * @param extraHeaders   headers in the file that the contract does not name
     * @param actualHeaders  the file's headers, trimmed, in file order
     */
    public HeaderValidation(List<String> missingHeaders,
                            List<String> extraHeaders,
                            List<String> actualHeaders) {
        this.missingHeaders = Collections.unmodifiableList(new ArrayList<>(missingHeaders));
        this.extraHeaders   = Collections.unmodifiableList(new ArrayList<>(extraHeaders));
        this.actualHeaders  = Collections.unmodifiableList(new ArrayList<>(actualHeaders));
    }

    /** @return true if every required header is present */
    public boolean isValid()                { return missingHeaders.isEmpty(); }

    public List<String> getMissingHeaders() { return missingHeaders; }

    public List<String> getExtraHeaders()   { return extraHeaders; }

    public List<String> getActualHeaders()  { return actualHeaders; }

    @Override
    public String toString() {
        return "HeaderValidation{valid=" + isValid()
               + ", missing=" + missingHeaders
               + ", extra=" + extraHeaders + "}";
    }
}
