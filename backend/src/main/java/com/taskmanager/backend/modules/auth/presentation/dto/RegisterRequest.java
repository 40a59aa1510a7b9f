package com.taskmanager.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be a valid address") @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(max = 72, message = "password must be at most 72 characters") String password
) {

    @Override
    public String toString() {
        return "RegisterRequest[email=" + email + "]";
    }
}
