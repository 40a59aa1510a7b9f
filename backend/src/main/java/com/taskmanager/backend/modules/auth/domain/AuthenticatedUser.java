package com.taskmanager.backend.modules.auth.domain;

/**
 * Identity resolved from a bearer token for the duration of one request.
 */
public record AuthenticatedUser(Long id, String email) {

    public static AuthenticatedUser from(AppUser user) {
        return new AuthenticatedUser(user.getId(), user.getEmail());
    }
}
