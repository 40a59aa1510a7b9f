package com.taskmanager.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import com.taskmanager.backend.global.error.AuthenticationFailedException;
import com.taskmanager.backend.global.error.ProblemException;
import com.taskmanager.backend.modules.auth.application.AuthService;
import com.taskmanager.backend.modules.auth.application.JwtTokenService;
import com.taskmanager.backend.modules.auth.application.PasswordHasher;
import com.taskmanager.backend.modules.auth.domain.AppUser;
import com.taskmanager.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taskmanager.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskmanager.backend.modules.auth.presentation.dto.RegisterRequest;
import com.taskmanager.backend.modules.auth.presentation.dto.TokenResponse;
import com.taskmanager.backend.modules.auth.presentation.dto.UserResponse;
import com.taskmanager.backend.support.MutableClock;
import com.taskmanager.backend.support.TaskFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private AppUserRepository appUserRepository;

    private PasswordHasher passwordHasher;
    private JwtTokenService jwtTokenService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider("auth-service-test-secret-0123456789abcdef!"),
                1_800_000L,
                new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        authService = new AuthService(appUserRepository, passwordHasher, jwtTokenService);
    }

    @Test
    void registerStoresHashNotPlaintext() {
        when(appUserRepository.existsByEmail("alice@x.com")).thenReturn(false);
        when(appUserRepository.saveAndFlush(any(AppUser.class))).thenAnswer(invocation -> {
            AppUser user = invocation.getArgument(0);
            ReflectionTestUtils.setField(user, "id", 1L);
            return user;
        });

        UserResponse response = authService.register(new RegisterRequest("alice@x.com", "pw1"));

        ArgumentCaptor<AppUser> captor = ArgumentCaptor.forClass(AppUser.class);
        verify(appUserRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getPasswordHash()).isNotEqualTo("pw1");
        assertThat(passwordHasher.verify("pw1", captor.getValue().getPasswordHash())).isTrue();
        assertThat(response).isEqualTo(new UserResponse(1L, "alice@x.com"));
    }

    @Test
    void duplicateEmailIsRejected() {
        when(appUserRepository.existsByEmail("alice@x.com")).thenReturn(true);

        ProblemException ex = catchThrowableOfType(
                () -> authService.register(new RegisterRequest("alice@x.com", "pw1")), ProblemException.class);

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getDetailMessage()).isEqualTo("Email already registered");
        verify(appUserRepository, never()).saveAndFlush(any());
    }

    @Test
    void concurrentRegistrationLosingUniqueIndexIsReportedAsDuplicate() {
        when(appUserRepository.existsByEmail("alice@x.com")).thenReturn(false);
        when(appUserRepository.saveAndFlush(any(AppUser.class)))
                .thenThrow(new DataIntegrityViolationException("uq_app_user_email"));

        ProblemException ex = catchThrowableOfType(
                () -> authService.register(new RegisterRequest("alice@x.com", "pw1")), ProblemException.class);

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getDetailMessage()).isEqualTo("Email already registered");
    }

    @Test
    void loginIssuesBearerTokenForEmail() {
        AppUser alice = TaskFixtures.user(1L, "alice@x.com", passwordHasher.hash("pw1"));
        when(appUserRepository.findByEmail("alice@x.com")).thenReturn(Optional.of(alice));

        TokenResponse response = authService.login("alice@x.com", "pw1");

        assertThat(response.tokenType()).isEqualTo("bearer");
        assertThat(jwtTokenService.validate(response.accessToken())).isEqualTo("alice@x.com");
    }

    @Test
    void wrongPasswordAndUnknownEmailFailIdentically() {
        AppUser alice = TaskFixtures.user(1L, "alice@x.com", passwordHasher.hash("pw1"));
        when(appUserRepository.findByEmail("alice@x.com")).thenReturn(Optional.of(alice));
        when(appUserRepository.findByEmail("nobody@x.com")).thenReturn(Optional.empty());

        AuthenticationFailedException wrongPassword = catchThrowableOfType(
                () -> authService.login("alice@x.com", "wrong"), AuthenticationFailedException.class);
        AuthenticationFailedException unknownEmail = catchThrowableOfType(
                () -> authService.login("nobody@x.com", "pw1"), AuthenticationFailedException.class);

        assertThat(wrongPassword.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(wrongPassword.getDetailMessage()).isEqualTo("Incorrect username or password");
        assertThat(unknownEmail.getDetailMessage()).isEqualTo(wrongPassword.getDetailMessage());
        assertThat(unknownEmail.getCode()).isEqualTo(wrongPassword.getCode());
    }

    @Test
    void corruptedStoredHashFailsAsBadCredentials() {
        AppUser alice = TaskFixtures.user(1L, "alice@x.com", "corrupted");
        when(appUserRepository.findByEmail("alice@x.com")).thenReturn(Optional.of(alice));

        AuthenticationFailedException ex = catchThrowableOfType(
                () -> authService.login("alice@x.com", "pw1"), AuthenticationFailedException.class);

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }
}
