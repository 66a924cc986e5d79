package com.resultado.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Outcome of an operation: either a {@link Success} or a {@link Failure}.
 *
 * <p>Sealed so that no third variant can exist. A failure is ordinary data returned to the caller;
 * only caller defects (such as assigning a failure kind to a success) are thrown.
 *
 * <p><strong>Exhaustive dispatch:</strong>
 *
 * <pre>{@code
 * String text = result.match(
 *         success -> "Created " + success.value().id(),
 *         failure -> "Failed: " + failure.title());
 * }</pre>
 *
 * @param <T> type of the success value
 */
public sealed interface Result<T> permits Success, Failure {

    /** Outcome category; always within the variant's range. */
    Kind kind();

    /** True only for {@link Success}. */
    @JsonIgnore
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /** True only for {@link Failure}. */
    @JsonIgnore
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * Applies the function matching this variant.
     *
     * @param onSuccess called when this is a {@link Success}
     * @param onFailure called when this is a {@link Failure}
     * @return whatever the chosen function returns
     */
    <R> R match(
            Function<? super Success<T>, ? extends R> onSuccess,
            Function<? super Failure<T>, ? extends R> onFailure);

    /**
     * Maps the success value, keeping message and kind. A failure is passed through unchanged
     * apart from its value type.
     */
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    // ── Success factories ──

    /** Success without a value or message. */
    static Success<Void> succeed() {
        return new Success<>(null, null, Kind.OK);
    }

    static <T> Success<T> succeed(T value) {
        return new Success<>(value, null, Kind.OK);
    }

    /**
     * @throws IllegalArgumentException if kind is in the failure range
     */
    static <T> Success<T> succeed(T value, Kind kind) {
        return new Success<>(value, null, kind);
    }

    /**
     * @throws IllegalArgumentException if kind is in the failure range
     */
    static <T> Success<T> succeed(T value, String message, Kind kind) {
        return new Success<>(value, message, kind);
    }

    /** Success that only carries a message, e.g. "Order cancelled". */
    static Success<Void> succeedWithMessage(String message) {
        return new Success<>(null, message, Kind.OK);
    }

    /**
     * @throws IllegalArgumentException if kind is in the failure range
     */
    static Success<Void> succeedWithMessage(String message, Kind kind) {
        return new Success<>(null, message, kind);
    }

    // ── Failure factories ──

    /** Failure with a title and a single plain error. */
    static <T> Failure<T> fail(String title, String error) {
        return fail(title, error, Kind.ERROR);
    }

    /**
     * @throws IllegalArgumentException if kind is in the success range
     */
    static <T> Failure<T> fail(String title, String error, Kind kind) {
        return new Failure<>(title, null, List.of(error), List.of(), null, kind);
    }

    /** Failure with an empty title and the given errors, stored verbatim. */
    static <T> Failure<T> fail(String... errors) {
        return fail(Arrays.asList(errors));
    }

    static <T> Failure<T> fail(Collection<String> errors) {
        return new Failure<>("", null, List.copyOf(errors), List.of(), null, Kind.ERROR);
    }

    /** Failure described by a title and an occurrence-specific detail instead of errors. */
    static <T> Failure<T> failWithDetail(String title, String detail) {
        return failWithDetail(title, detail, Kind.ERROR);
    }

    /**
     * @throws IllegalArgumentException if kind is in the success range
     */
    static <T> Failure<T> failWithDetail(String title, String detail, Kind kind) {
        return new Failure<>(title, detail, List.of(), List.of(), null, kind);
    }

    /** Validation failure; the kind is always {@link Kind#INVALID}. */
    static <T> Failure<T> fail(ValidationError... validationErrors) {
        return failValidation("", validationErrors);
    }

    /** Titled validation failure; the kind is always {@link Kind#INVALID}. */
    static <T> Failure<T> failValidation(String title, ValidationError... validationErrors) {
        return new Failure<>(
                title, null, List.of(), List.of(validationErrors), null, Kind.INVALID);
    }

    /** Validation failure; the kind is always {@link Kind#INVALID}. */
    static <T> Failure<T> failValidation(Collection<ValidationError> validationErrors) {
        return new Failure<>(
                "", null, List.of(), List.copyOf(validationErrors), null, Kind.INVALID);
    }
}
