package com.taskmanager.backend.modules.auth.application;

import java.util.Optional;

import com.taskmanager.backend.global.error.AuthenticationFailedException;
import com.taskmanager.backend.global.error.ProblemException;
import com.taskmanager.backend.modules.auth.domain.AppUser;
import com.taskmanager.backend.modules.auth.domain.AuthenticatedUser;
import com.taskmanager.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskmanager.backend.modules.auth.presentation.dto.RegisterRequest;
import com.taskmanager.backend.modules.auth.presentation.dto.TokenResponse;
import com.taskmanager.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    static final String EMAIL_ALREADY_REGISTERED = "EMAIL_ALREADY_REGISTERED";
    static final String INCORRECT_CREDENTIALS = "Incorrect username or password";

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenService jwtTokenService;
    private final String timingDecoyHash;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordHasher passwordHasher,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordHasher = passwordHasher;
        this.jwtTokenService = jwtTokenService;
        this.timingDecoyHash = passwordHasher.hash("timing-decoy-password");
    }

    public UserResponse register(RegisterRequest request) {
        if (appUserRepository.existsByEmail(request.email())) {
            throw duplicateEmail(null);
        }
        AppUser user = new AppUser();
        user.setEmail(request.email());
        user.setPasswordHash(passwordHasher.hash(request.password()));
        try {
            AppUser saved = appUserRepository.saveAndFlush(user);
            log.info("Registered user id={}", saved.getId());
            return UserResponse.from(saved);
        } catch (DataIntegrityViolationException ex) {
            // concurrent registration lost the race on the unique index
            throw duplicateEmail(ex);
        }
    }

    @Transactional(readOnly = true)
    public TokenResponse login(String email, String password) {
        Optional<AppUser> user = email == null ? Optional.empty() : appUserRepository.findByEmail(email);
        if (user.isEmpty()) {
            passwordHasher.verify(password, timingDecoyHash);
            log.info("Failed login attempt for unknown account");
            throw new AuthenticationFailedException(INCORRECT_CREDENTIALS);
        }
        if (!passwordHasher.verify(password, user.get().getPasswordHash())) {
            log.info("Failed login attempt for user id={}", user.get().getId());
            throw new AuthenticationFailedException(INCORRECT_CREDENTIALS);
        }
        JwtTokenService.IssuedToken token = jwtTokenService.issue(user.get().getEmail());
        return TokenResponse.bearer(token.token());
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(AuthenticatedUser principal) {
        return appUserRepository.findById(principal.id())
                .map(UserResponse::from)
                .orElseThrow(() -> new AuthenticationFailedException(IdentityResolver.COULD_NOT_VALIDATE));
    }

    private ProblemException duplicateEmail(Throwable cause) {
        return new ProblemException(HttpStatus.BAD_REQUEST, EMAIL_ALREADY_REGISTERED, "Email already registered", cause);
    }
}
