package com.nana.ingest.domain;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Result - Success-or-Failure Value
 *
 * <p>Every boundary of the import pipeline that can fail for a reason the
 * caller must act on returns a {@code Result} instead of throwing: the row
 * mapper (a malformed row), the record parser (an empty file or a bad
 * header row) and the field validator in strict mode.
 *
 * <p>Exactly one of {@link #getValue()} and {@link #getError()} is
 * available. Calling the other one throws {@link NoSuchElementException}.
 *
 * @param <T> the success value type
 * @param <E> the failure value type
 */
public final class Result<T, E> {

    private final boolean success;
    private final T       value;
    private final E       error;

    private Result(boolean success, T value, E error) {
        this.success = success;
        this.value   = value;
        this.error   = error;
    }

    // -----------------------------------------------------------------------
    // FACTORIES
    // -----------------------------------------------------------------------

    /**
     * Creates a successful result.
     *
     * @param value the success value; must not be null
     * @return a success result wrapping {@code value}
     */
    public static <T, E> Result<T, E> success(T value) {
        return new Result<>(true,
                Objects.requireNonNull(value, "value must not be null"), null);
    }

    /**
     * Creates a failed result.
     *
     * @param error the failure value; must not be null
     * @return a failure result wrapping {@code error}
     */
    public static <T, E> Result<T, E> failure(E error) {
        return new Result<>(false, null,
                Objects.requireNonNull(error, "error must not be null"));
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    /** @return true if this result carries a success value */
    public boolean isSuccess() { return success; }

    /** @return true if this result carries a failure value */
    public boolean isFailure() { return !success; }

    /**
     * Returns the success value.
     *
     * @return the success value
     * @throws NoSuchElementException if this is a failure
     */
    public T getValue() {
        if (!success) {
            throw new NoSuchElementException(
                    "Result is a failure: " + error);
        }
        return value;
    }

    /**
     * Returns the failure value.
     *
     * @return the failure value
     * @throws NoSuchElementException if this is a success
     */
    public E getError() {
        if (success) {
            throw new NoSuchElementException("Result is a success.");
        }
        return error;
    }

    /**
     * Transforms the success value, passing a failure through unchanged.
     *
     * @param mapper the transformation for the success value
     * @return a new result
     */
    public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (!success) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return success
                ? "Result{success, value=" + value + "}"
                : "Result{failure, error=" + error + "}";
    }
}
