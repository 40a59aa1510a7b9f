package com.taskmanager.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType
) {
    public static final String DEFAULT_TOKEN_TYPE = "bearer";

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, DEFAULT_TOKEN_TYPE);
    }
}
