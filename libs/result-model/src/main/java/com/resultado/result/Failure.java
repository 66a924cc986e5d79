package com.resultado.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Failed outcome.
 *
 * <p>Carries no value, so a failure of one value type can be re-typed to any other with {@link
 * #into()} without losing anything.
 *
 * <p>{@link #errors()} is computed on every read: the plain errors given at construction when
 * there are any, otherwise the detail of each validation error. Producers only need to fill one
 * of the two collections.
 *
 * @param title short summary of the problem type; should not change between occurrences, e.g.
 *     "You do not have enough credit." Never {@code null}.
 * @param detail explanation specific to this occurrence, e.g. "Your current balance is 30, but
 *     that costs 50."; may be {@code null}
 * @param errors plain error messages, for display only
 * @param validationErrors structured field-level errors
 * @param traceId identifier to trace the failure back to its origin; may be {@code null}
 * @param kind failure-range kind; when {@code null}, {@link Kind#INVALID} if there are validation
 *     errors and {@link Kind#ERROR} otherwise
 * @param <T> value type of the result this failure stands in for
 */
public record Failure<T>(
        String title,
        @JsonInclude(JsonInclude.Include.NON_NULL) String detail,
        List<String> errors,
        List<ValidationError> validationErrors,
        @JsonInclude(JsonInclude.Include.NON_NULL) String traceId,
        Kind kind)
        implements Result<T> {

    static final String NON_ERROR_KIND = "Cannot set non-error status to a failure result.";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if title is null or kind is in the success range
     */
    public Failure {
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
        validationErrors = validationErrors == null ? List.of() : List.copyOf(validationErrors);
        if (kind == null) {
            kind = validationErrors.isEmpty() ? Kind.ERROR : Kind.INVALID;
        }
        if (!kind.isFailure()) {
            throw new IllegalArgumentException(NON_ERROR_KIND);
        }
    }

    /**
     * Plain error messages: the ones supplied explicitly, or the validation error details when
     * none were.
     */
    @Override
    public List<String> errors() {
        if (!errors.isEmpty()) {
            return errors;
        }
        return validationErrors.stream().map(ValidationError::detail).toList();
    }

    /** Re-types this failure; every field is carried over unchanged. */
    public <U> Failure<U> into() {
        return new Failure<>(title, detail, errors, validationErrors, traceId, kind);
    }

    public Failure<T> withTitle(String title) {
        return new Failure<>(title, detail, errors, validationErrors, traceId, kind);
    }

    public Failure<T> withDetail(String detail) {
        return new Failure<>(title, detail, errors, validationErrors, traceId, kind);
    }

    public Failure<T> withErrors(Collection<String> errors) {
        return new Failure<>(title, detail, List.copyOf(errors), validationErrors, traceId, kind);
    }

    /** Replaces the validation errors; the kind is kept as is. */
    public Failure<T> withValidationErrors(Collection<ValidationError> validationErrors) {
        return new Failure<>(
                title, detail, errors, List.copyOf(validationErrors), traceId, kind);
    }

    public Failure<T> withTraceId(String traceId) {
        return new Failure<>(title, detail, errors, validationErrors, traceId, kind);
    }

    /**
     * @throws IllegalArgumentException if kind is in the success range
     */
    public Failure<T> withKind(Kind kind) {
        return new Failure<>(title, detail, errors, validationErrors, traceId, kind);
    }

    @Override
    public <R> R match(
            Function<? super Success<T>, ? extends R> onSuccess,
            Function<? super Failure<T>, ? extends R> onFailure) {
        return onFailure.apply(this);
    }

    @Override
    public <U> Failure<U> map(Function<? super T, ? extends U> mapper) {
        return into();
    }
}
