package com.taskmanager.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.anyString;

import java.time.Instant;
import java.util.Optional;

import com.taskmanager.backend.global.error.AuthenticationFailedException;
import com.taskmanager.backend.modules.auth.application.IdentityResolver;
import com.taskmanager.backend.modules.auth.application.JwtTokenService;
import com.taskmanager.backend.modules.auth.domain.AuthenticatedUser;
import com.taskmanager.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taskmanager.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskmanager.backend.support.MutableClock;
import com.taskmanager.backend.support.TaskFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    @Mock
    private AppUserRepository appUserRepository;

    private JwtTokenService tokenService;
    private IdentityResolver identityResolver;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        tokenService = new JwtTokenService(
                new JwtTokenProvider("identity-resolver-test-secret-0123456789abcdef"), 1_800_000L, clock);
        identityResolver = new IdentityResolver(tokenService, appUserRepository);
    }

    @Test
    void resolvesTokenToRegisteredUser() {
        when(appUserRepository.findByEmail("alice@x.com"))
                .thenReturn(Optional.of(TaskFixtures.user(7L, "alice@x.com", "hash")));

        AuthenticatedUser user = identityResolver.resolve(tokenService.issue("alice@x.com").token());

        assertThat(user).isEqualTo(new AuthenticatedUser(7L, "alice@x.com"));
    }

    @Test
    void invalidTokenFailsWithoutTouchingStorage() {
        AuthenticationFailedException ex = catchThrowableOfType(
                () -> identityResolver.resolve("garbage"), AuthenticationFailedException.class);

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        verify(appUserRepository, never()).findByEmail(anyString());
    }

    @Test
    void deletedUserIsIndistinguishableFromBadToken() {
        when(appUserRepository.findByEmail("ghost@x.com")).thenReturn(Optional.empty());

        AuthenticationFailedException missingUser = catchThrowableOfType(
                () -> identityResolver.resolve(tokenService.issue("ghost@x.com").token()),
                AuthenticationFailedException.class);
        AuthenticationFailedException badToken = catchThrowableOfType(
                () -> identityResolver.resolve("garbage"), AuthenticationFailedException.class);

        assertThat(missingUser.getStatusCode()).isEqualTo(badToken.getStatusCode());
        assertThat(missingUser.getCode()).isEqualTo(badToken.getCode());
        assertThat(missingUser.getDetailMessage()).isEqualTo(badToken.getDetailMessage());
    }
}
