package com.resultado.result;

/**
 * Severity flags of a {@link ValidationError}.
 *
 * <p>Flags are combined through an {@link java.util.EnumSet}; an error may carry any number of
 * them, e.g. {@code EnumSet.of(ERROR, CRITICAL)}.
 */
public enum ValidationSeverity {
    ERROR,
    CRITICAL,
    WARNING,
    INFO
}
