package com.taskmanager.backend.global.config;

import com.taskmanager.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "com.taskmanager.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = TimeConfig.AUDIT_DATE_TIME_PROVIDER)
public class JpaConfig {
}
