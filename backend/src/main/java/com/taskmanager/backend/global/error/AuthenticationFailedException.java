package com.taskmanager.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * 401 failure that must be answered with a {@code WWW-Authenticate: Bearer} challenge.
 * Used for wrong credentials and for any token that cannot be resolved to a user.
 */
public class AuthenticationFailedException extends ProblemException {

    public static final String CODE = "INVALID_CREDENTIALS";
    public static final String BEARER_CHALLENGE = "Bearer";

    public AuthenticationFailedException(String detail) {
        super(HttpStatus.UNAUTHORIZED, CODE, detail);
    }

    public AuthenticationFailedException(String detail, Throwable cause) {
        super(HttpStatus.UNAUTHORIZED, CODE, detail, cause);
    }
}
