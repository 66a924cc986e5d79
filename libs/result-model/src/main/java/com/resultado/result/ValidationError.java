package com.resultado.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One field-level validation problem.
 *
 * <p>Absent {@code pointer}, {@code severity} and {@code code} are left out of the JSON form
 * rather than written as {@code null}.
 *
 * @param detail what is wrong, e.g. "Balance must not be negative". Required.
 * @param pointer JSON Pointer to the offending member, e.g. {@code /balances/0/amount}. Usually
 *     produced by the pointer resolver; may be {@code null}.
 * @param severity severity flags; may be empty or {@code null}
 * @param code domain-specific identifier, e.g. "BAL-001"; may be {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(
        String detail, String pointer, Set<ValidationSeverity> severity, String code) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException if detail is null
     */
    @JsonCreator
    public ValidationError {
        if (detail == null) {
            throw new IllegalArgumentException("detail cannot be null");
        }
        if (severity != null) {
            severity = copyOf(severity);
        }
    }

    /** Creates an error with no pointer and the default {@link ValidationSeverity#ERROR}. */
    public ValidationError(String detail) {
        this(detail, null);
    }

    /** Creates an error for the given pointer with the default {@link ValidationSeverity#ERROR}. */
    public ValidationError(String detail, String pointer) {
        this(detail, pointer, EnumSet.of(ValidationSeverity.ERROR), null);
    }

    /** Creates an error with explicit severity flags and no code. */
    public ValidationError(String detail, String pointer, Set<ValidationSeverity> severity) {
        this(detail, pointer, severity, null);
    }

    public static ValidationError of(String detail) {
        return new ValidationError(detail);
    }

    /** Creates an error pointing at {@code pointer}. */
    public static ValidationError at(String pointer, String detail) {
        return new ValidationError(detail, pointer);
    }

    public ValidationError withPointer(String pointer) {
        return new ValidationError(detail, pointer, severity, code);
    }

    /** Returns a copy carrying exactly the given flags (none clears them). */
    public ValidationError withSeverity(ValidationSeverity... flags) {
        EnumSet<ValidationSeverity> set = EnumSet.noneOf(ValidationSeverity.class);
        Collections.addAll(set, flags);
        return new ValidationError(detail, pointer, set, code);
    }

    public ValidationError withCode(String code) {
        return new ValidationError(detail, pointer, severity, code);
    }

    /** True when the severity flags contain {@code flag}. */
    public boolean hasSeverity(ValidationSeverity flag) {
        return severity != null && severity.contains(flag);
    }

    private static Set<ValidationSeverity> copyOf(Collection<ValidationSeverity> flags) {
        EnumSet<ValidationSeverity> set = EnumSet.noneOf(ValidationSeverity.class);
        set.addAll(flags);
        return Collections.unmodifiableSet(set);
    }
}
