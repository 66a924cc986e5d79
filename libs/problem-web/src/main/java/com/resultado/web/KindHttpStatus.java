package com.resultado.web;

import com.resultado.result.Kind;
import java.util.Objects;
import org.springframework.http.HttpStatus;

/** HTTP status for each {@link Kind}. */
public final class KindHttpStatus {

    private KindHttpStatus() {
        // utility class
    }

    public static HttpStatus of(Kind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return switch (kind) {
            case OK -> HttpStatus.OK;
            case CREATED -> HttpStatus.CREATED;
            case NO_CONTENT -> HttpStatus.NO_CONTENT;
            case ACCEPTED -> HttpStatus.ACCEPTED;
            case ERROR, CRITICAL -> HttpStatus.INTERNAL_SERVER_ERROR;
            case UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INVALID -> HttpStatus.BAD_REQUEST;
            case UNPROCESSABLE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case CONFLICT -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILED_DEPENDENCY -> HttpStatus.FAILED_DEPENDENCY;
        };
    }

    /** Numeric status code for {@code kind}. */
    public static int code(Kind kind) {
        return of(kind).value();
    }
}
