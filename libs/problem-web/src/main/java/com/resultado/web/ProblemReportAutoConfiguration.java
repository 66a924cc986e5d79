package com.resultado.web;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.ProblemDetail;

/** Registers {@link ProblemReports} and {@link ResultResponses} unless the application has its own. */
@AutoConfiguration
@ConditionalOnClass(ProblemDetail.class)
@EnableConfigurationProperties(ProblemReportProperties.class)
public class ProblemReportAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ProblemReports problemReports(ProblemReportProperties properties) {
        return new ProblemReports(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResultResponses resultResponses(ProblemReports problemReports) {
        return new ResultResponses(problemReports);
    }
}
