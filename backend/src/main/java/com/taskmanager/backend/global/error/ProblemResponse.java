package com.taskmanager.backend.global.error;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.taskmanager.backend.global.web.RequestIdFilter;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * Error body shared by the exception handler and the authentication entry point.
 * {@code requestId} repeats the {@code X-Request-Id} of the failed request so a client can quote it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    static final String TYPE_PREFIX = "urn:problem:taskmanager:";

    public static ProblemResponse from(ProblemException ex, String instance) {
        return of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                TYPE_PREFIX + safeCode.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-"),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode,
                MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)
        );
    }
}
