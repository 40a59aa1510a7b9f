package com.taskmanager.backend.global.common.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * Shared UTC clock and the audit timestamp provider derived from it.
 */
@Configuration
public class TimeConfig {

    public static final String AUDIT_DATE_TIME_PROVIDER = "auditDateTimeProvider";

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean(AUDIT_DATE_TIME_PROVIDER)
    public DateTimeProvider auditDateTimeProvider(Clock clock) {
        return () -> Optional.of(OffsetDateTime.now(clock));
    }
}
