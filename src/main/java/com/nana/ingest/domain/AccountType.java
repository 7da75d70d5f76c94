package com.nana.ingest.domain;

import java.util.Optional;

/**
 * AccountType - Subscription tier of a CRM account.
 */
public enum AccountType {

    PRO("Pro"),

    STARTER("Starter");

    private final String label;

    AccountType(String label) {
        this.label = label;
    }

    /** @return the exported label ("Pro" or "Starter") */
    public String getLabel() {
        return label;
    }

    /**
     * Resolves an Account Type column value (exact match).
     *
     * @param value the raw column value
     * @return the matching type, or empty if the value is not recognised
     */
    public static Optional<AccountType> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (AccountType t : values()) {
            if (t.label.equals(value)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
