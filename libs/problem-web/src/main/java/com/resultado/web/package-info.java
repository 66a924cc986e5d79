/**
 * HTTP boundary for results: status mapping, RFC 9457 problem reports and response entities.
 *
 * <p>Spring Boot applications get {@link com.resultado.web.ProblemReports} and {@link
 * com.resultado.web.ResultResponses} beans from {@link
 * com.resultado.web.ProblemReportAutoConfiguration}.
 */
package com.resultado.web;
