package com.taskmanager.backend.modules.auth.presentation.dto;

import com.taskmanager.backend.modules.auth.domain.AppUser;

public record UserResponse(Long id, String email) {

    public static UserResponse from(AppUser user) {
        return new UserResponse(user.getId(), user.getEmail());
    }
}
