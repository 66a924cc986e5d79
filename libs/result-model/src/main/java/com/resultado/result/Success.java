package com.resultado.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.function.Function;

/**
 * Successful outcome.
 *
 * @param value the produced value; may be {@code null}, so check for that
 * @param message optional message to pass along; left out of JSON when absent
 * @param kind success-range kind, {@link Kind#OK} when {@code null}
 * @param <T> type of the value
 */
public record Success<T>(
        T value, @JsonInclude(JsonInclude.Include.NON_NULL) String message, Kind kind)
        implements Result<T> {

    static final String NON_SUCCESS_KIND = "Cannot set non-success status to a success result.";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if kind is in the failure range
     */
    public Success {
        if (kind == null) {
            kind = Kind.OK;
        }
        if (!kind.isSuccess()) {
            throw new IllegalArgumentException(NON_SUCCESS_KIND);
        }
    }

    /**
     * @throws IllegalArgumentException if kind is in the failure range
     */
    public Success<T> withKind(Kind kind) {
        return new Success<>(value, message, kind);
    }

    public Success<T> withMessage(String message) {
        return new Success<>(value, message, kind);
    }

    @Override
    public <R> R match(
            Function<? super Success<T>, ? extends R> onSuccess,
            Function<? super Failure<T>, ? extends R> onFailure) {
        return onSuccess.apply(this);
    }

    @Override
    public <U> Success<U> map(Function<? super T, ? extends U> mapper) {
        return new Success<>(mapper.apply(value), message, kind);
    }
}
