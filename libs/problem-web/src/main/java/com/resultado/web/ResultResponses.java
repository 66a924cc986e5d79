package com.resultado.web;

import com.resultado.result.Kind;
import com.resultado.result.Result;
import java.util.Objects;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

/**
 * Builds controller responses from results.
 *
 * <pre>{@code
 * @PostMapping("/orders")
 * public ResponseEntity<Object> create(@RequestBody OrderRequest request) {
 *     return responses.toResponseEntity(orders.place(request));
 * }
 * }</pre>
 */
public class ResultResponses {

    private final ProblemReports problemReports;

    public ResultResponses(ProblemReports problemReports) {
        this.problemReports = Objects.requireNonNull(problemReports, "problemReports must not be null");
    }

    /**
     * Success: the kind's status with the value as body. A success without a value carries its
     * message instead, and {@link Kind#NO_CONTENT} never has a body. Failure: the problem report as
     * {@code application/problem+json}.
     */
    public ResponseEntity<Object> toResponseEntity(Result<?> result) {
        Objects.requireNonNull(result, "result must not be null");
        return result.<ResponseEntity<Object>>match(
                success -> {
                    ResponseEntity.BodyBuilder builder =
                            ResponseEntity.status(KindHttpStatus.of(success.kind()));
                    if (success.kind() == Kind.NO_CONTENT) {
                        return builder.build();
                    }
                    if (success.value() != null) {
                        return builder.body(success.value());
                    }
                    if (success.message() != null) {
                        return builder.body(success.message());
                    }
                    return builder.build();
                },
                failure -> {
                    ProblemDetail problem = problemReports.toProblemDetail(failure);
                    return ResponseEntity.status(problem.getStatus())
                            .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                            .body(problem);
                });
    }
}
