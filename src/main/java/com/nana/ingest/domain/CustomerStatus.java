package com.nana.ingest.domain;

import java.util.Optional;

/**
 * CustomerStatus - Activity status of a CRM account.
 *
 * <p>The CRM exports the long labels ("Active Customer",
 * "Inactive Customer"). Hand-edited files frequently carry the short form
 * ("Active", "Inactive"), which is accepted as the same value.
 * Matching is case-sensitive: the export never varies the case, and
 * anything else is treated as a data error by the validator.
 */
public enum CustomerStatus {

    /** Account is paying and in use. */
    ACTIVE("Active Customer", "Active"),

    /** Account has churned or is suspended. */
    INACTIVE("Inactive Customer", "Inactive");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    /** The label the CRM writes to the Status column. */
    private final String label;

    /** Accepted short form of {@link #label}. */
    private final String shortLabel;

    CustomerStatus(String label, String shortLabel) {
        this.label      = label;
        this.shortLabel = shortLabel;
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return the exported label (e.g., "Active Customer") */
    public String getLabel() {
        return label;
    }

    /** @return the short label (e.g., "Active") */
    public String getShortLabel() {
        return shortLabel;
    }

    /**
     * Resolves a Status column value.
     *
     * <p>Unlike {@code valueOf()} this never throws: an unknown value
     * yields an empty {@link Optional} so the validator can report it as
     * a row error.
     *
     * @param value the raw column value
     * @return the matching status, or empty if the value is not recognised
     */
    public static Optional<CustomerStatus> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (CustomerStatus s : values()) {
            if (s.label.equals(value) || s.shortLabel.equals(value)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
