package com.resultado.result;

/**
 * Category of an operation outcome.
 *
 * <p>The constants are split by {@link #ERROR} into a success range ({@code OK} through {@code
 * ACCEPTED}) and a failure range ({@code ERROR} onwards). The split is what {@link Success} and
 * {@link Failure} check when a kind is assigned, so new constants are only ever appended at the
 * end.
 */
public enum Kind {

    // ---- Success range ----
    OK,
    CREATED,
    NO_CONTENT,
    ACCEPTED,

    // ---- Failure range ----
    ERROR,
    CRITICAL,
    UNAVAILABLE,
    INVALID,
    UNPROCESSABLE,
    FORBIDDEN,
    UNAUTHORIZED,
    CONFLICT,
    NOT_FOUND,
    FAILED_DEPENDENCY;

    /** True for the kinds a {@link Success} may carry. */
    public boolean isSuccess() {
        return ordinal() < ERROR.ordinal();
    }

    /** True for the kinds a {@link Failure} may carry. */
    public boolean isFailure() {
        return !isSuccess();
    }
}
