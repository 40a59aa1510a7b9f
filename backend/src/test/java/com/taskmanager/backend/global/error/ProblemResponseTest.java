package com.taskmanager.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.taskmanager.backend.global.web.RequestIdFilter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void problemExceptionMapsToBodyWithCurrentRequestId() {
        MDC.put(RequestIdFilter.REQUEST_ID_MDC_KEY, "trace-7");
        ProblemException ex = new ProblemException(HttpStatus.BAD_REQUEST, "NOT_ENOUGH_PERMISSIONS", "Not enough permissions");

        ProblemResponse body = ProblemResponse.from(ex, "/tasks/5");

        assertThat(body.status()).isEqualTo(400);
        assertThat(body.title()).isEqualTo("Bad Request");
        assertThat(body.detail()).isEqualTo("Not enough permissions");
        assertThat(body.code()).isEqualTo("NOT_ENOUGH_PERMISSIONS");
        assertThat(body.type()).isEqualTo("urn:problem:taskmanager:not-enough-permissions");
        assertThat(body.instance()).isEqualTo("/tasks/5");
        assertThat(body.requestId()).isEqualTo("trace-7");
    }

    @Test
    void missingCodeAndDetailFallBackToStatus() {
        ProblemResponse body = ProblemResponse.of(HttpStatus.NOT_FOUND, null, " ", "/nowhere");

        assertThat(body.code()).isEqualTo("NOT_FOUND");
        assertThat(body.detail()).isEqualTo("Not Found");
        assertThat(body.requestId()).isNull();
    }
}
