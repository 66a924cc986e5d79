package com.resultado.web;

import com.resultado.result.ValidationError;

/**
 * Entry of the {@code errors} extension of a problem report.
 *
 * @param pointer JSON Pointer to the offending field; may be {@code null}
 * @param detail what is wrong with it
 */
public record FieldProblem(String pointer, String detail) {

    public static FieldProblem from(ValidationError error) {
        return new FieldProblem(error.pointer(), error.detail());
    }
}
