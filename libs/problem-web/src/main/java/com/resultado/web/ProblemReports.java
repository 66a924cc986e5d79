package com.resultado.web;

import com.resultado.result.Failure;
import com.resultado.result.Result;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ProblemDetail;

/**
 * Turns a failed {@link Result} into an RFC 9457 {@link ProblemDetail}.
 *
 * <pre>
 * {
 *   "type": "https://developer.mozilla.org/en-US/docs/Web/HTTP/Reference/Status/400",
 *   "title": "Invalid order",
 *   "status": 400,
 *   "detail": "quantity must be positive",
 *   "errors": [ { "pointer": "/lines/0/quantity", "detail": "quantity must be positive" } ],
 *   "traceId": "4bf92f35"
 * }
 * </pre>
 *
 * <p>Each member comes from the {@link ProblemOverrides} when set there, otherwise from the
 * failure: title from the title, detail from the detail or else the first plain error, status from
 * the kind, and type from the configured base plus the kind's status. The {@code errors} extension
 * is written only when the failure has validation errors.
 */
public class ProblemReports {

    private static final Logger log = LoggerFactory.getLogger(ProblemReports.class);

    /** Extension member holding the validation errors. */
    public static final String ERRORS_EXTENSION = "errors";

    /** Extension member holding the failure's trace id. */
    public static final String TRACE_ID_EXTENSION = "traceId";

    private final ProblemReportProperties properties;

    public ProblemReports() {
        this(ProblemReportProperties.defaults());
    }

    public ProblemReports(ProblemReportProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public ProblemDetail toProblemDetail(Result<?> result) {
        return toProblemDetail(result, ProblemOverrides.none());
    }

    /**
     * @throws IllegalArgumentException if {@code result} is not a {@link Failure}, or if the
     *     overrides carry an {@code errors} extension while the failure has validation errors
     */
    public ProblemDetail toProblemDetail(Result<?> result, ProblemOverrides overrides) {
        Objects.requireNonNull(result, "result must not be null");
        ProblemOverrides effective = overrides == null ? ProblemOverrides.none() : overrides;
        if (!(result instanceof Failure<?> failure)) {
            throw new IllegalArgumentException("result must be a Failure.");
        }

        boolean hasValidationErrors = !failure.validationErrors().isEmpty();
        if (hasValidationErrors && effective.extensions().containsKey(ERRORS_EXTENSION)) {
            throw new IllegalArgumentException(
                    "An extension named '" + ERRORS_EXTENSION + "' cannot be combined with validation errors.");
        }

        int mappedStatus = KindHttpStatus.code(failure.kind());
        ProblemDetail problem =
                ProblemDetail.forStatus(effective.status() != null ? effective.status() : mappedStatus);
        problem.setTitle(effective.title() != null ? effective.title() : failure.title());
        problem.setDetail(effective.detail() != null ? effective.detail() : defaultDetail(failure));
        problem.setType(
                effective.type() != null
                        ? effective.type()
                        : URI.create(properties.typeBase() + "/" + mappedStatus));
        if (effective.instance() != null) {
            problem.setInstance(effective.instance());
        }

        for (Map.Entry<String, Object> extension : effective.extensions().entrySet()) {
            problem.setProperty(extension.getKey(), extension.getValue());
        }
        if (hasValidationErrors) {
            List<FieldProblem> errors =
                    failure.validationErrors().stream().map(FieldProblem::from).toList();
            problem.setProperty(ERRORS_EXTENSION, errors);
        }
        if (failure.traceId() != null
                && properties.includeTraceId()
                && !effective.extensions().containsKey(TRACE_ID_EXTENSION)) {
            problem.setProperty(TRACE_ID_EXTENSION, failure.traceId());
        }

        log.debug(
                "Mapped {} failure '{}' to problem status {}",
                failure.kind(),
                failure.title(),
                problem.getStatus());
        return problem;
    }

    private static String defaultDetail(Failure<?> failure) {
        if (failure.detail() != null) {
            return failure.detail();
        }
        List<String> errors = failure.errors();
        return errors.isEmpty() ? null : errors.get(0);
    }
}
