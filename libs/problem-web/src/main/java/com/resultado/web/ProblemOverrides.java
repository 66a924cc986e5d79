package com.resultado.web;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values that replace what {@link ProblemReports} would derive from a failure. Every {@code null}
 * field means "derive it".
 *
 * @param detail replaces the failure detail
 * @param instance URI of this occurrence; never derived
 * @param status replaces the status mapped from the kind
 * @param title replaces the failure title
 * @param type replaces the status documentation link
 * @param extensions extra members written into the report; values may be {@code null}
 */
public record ProblemOverrides(
        String detail,
        URI instance,
        Integer status,
        String title,
        URI type,
        Map<String, Object> extensions) {

    private static final ProblemOverrides NONE = new ProblemOverrides(null, null, null, null, null, null);

    public ProblemOverrides {
        extensions =
                extensions == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static ProblemOverrides none() {
        return NONE;
    }

    public ProblemOverrides withDetail(String detail) {
        return new ProblemOverrides(detail, instance, status, title, type, extensions);
    }

    public ProblemOverrides withInstance(URI instance) {
        return new ProblemOverrides(detail, instance, status, title, type, extensions);
    }

    public ProblemOverrides withStatus(Integer status) {
        return new ProblemOverrides(detail, instance, status, title, type, extensions);
    }

    public ProblemOverrides withTitle(String title) {
        return new ProblemOverrides(detail, instance, status, title, type, extensions);
    }

    public ProblemOverrides withType(URI type) {
        return new ProblemOverrides(detail, instance, status, title, type, extensions);
    }

    public ProblemOverrides withExtensions(Map<String, Object> extensions) {
        return new ProblemOverrides(detail, instance, status, title, type, extensions);
    }

    /** Adds or replaces a single extension member. */
    public ProblemOverrides withExtension(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(extensions);
        copy.put(name, value);
        return new ProblemOverrides(detail, instance, status, title, type, copy);
    }
}
