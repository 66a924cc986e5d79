package com.resultado.web;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for problem reports, bound from the {@code resultado.problem.*} prefix:
 *
 * <pre>
 * resultado:
 *   problem:
 *     type-base: https://errors.example.com/status
 *     include-trace-id: false
 * </pre>
 *
 * @param typeBase link prefix for the default {@code type}; the status code is appended after a
 *     {@code /}. Defaults to the MDN HTTP status reference.
 * @param includeTraceId whether a failure's trace id is written as the {@code traceId} extension
 *     (default true)
 */
@ConfigurationProperties(prefix = "resultado.problem")
public record ProblemReportProperties(String typeBase, Boolean includeTraceId) {

    public static final String DEFAULT_TYPE_BASE =
            "https://developer.mozilla.org/en-US/docs/Web/HTTP/Reference/Status";

    public ProblemReportProperties {
        if (typeBase == null || typeBase.isBlank()) {
            typeBase = DEFAULT_TYPE_BASE;
        }
        while (typeBase.endsWith("/")) {
            typeBase = typeBase.substring(0, typeBase.length() - 1);
        }
        if (includeTraceId == null) {
            includeTraceId = Boolean.TRUE;
        }
    }

    public static ProblemReportProperties defaults() {
        return new ProblemReportProperties(null, null);
    }
}
