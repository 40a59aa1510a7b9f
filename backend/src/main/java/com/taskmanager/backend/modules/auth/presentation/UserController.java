package com.taskmanager.backend.modules.auth.presentation;

import com.taskmanager.backend.modules.auth.application.AuthService;
import com.taskmanager.backend.modules.auth.domain.AuthenticatedUser;
import com.taskmanager.backend.modules.auth.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Users")
public class UserController {

    private final AuthService authService;

    public UserController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping({"/users/me", "/users/me/"})
    public ResponseEntity<UserResponse> currentUser(@AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(authService.loadProfile(principal));
    }
}
