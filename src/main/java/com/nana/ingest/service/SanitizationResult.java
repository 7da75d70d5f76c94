package com.nana.ingest.service;

import java.util.List;
import java.util.Objects;

/**
 * A sanitized value and the advisory warnings raised while producing it.
 *
 * @param <T> the sanitized value type
 */
public final class SanitizationResult<T> {

    private final T            value;
    private final List<String> warnings;

    public SanitizationResult(T value, List<String> warnings) {
        this.value    = Objects.requireNonNull(value, "value");
        this.warnings = List.copyOf(warnings);
    }

    public T getValue() {
        return value;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "SanitizationResult{value=" + value + ", warnings=" + warnings + "}";
    }
}
