package com.taskmanager.backend.modules.auth.application;

import com.taskmanager.backend.global.error.AuthenticationFailedException;
import com.taskmanager.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.taskmanager.backend.modules.auth.domain.AuthenticatedUser;
import com.taskmanager.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a bearer token into the user it was issued for.
 * A bad token and a token for a user that no longer exists fail identically.
 */
@Service
public class IdentityResolver {

    static final String COULD_NOT_VALIDATE = "Could not validate credentials";

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final JwtTokenService jwtTokenService;
    private final AppUserRepository appUserRepository;

    public IdentityResolver(JwtTokenService jwtTokenService, AppUserRepository appUserRepository) {
        this.jwtTokenService = jwtTokenService;
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public AuthenticatedUser resolve(String bearerToken) {
        String email;
        try {
            email = jwtTokenService.validate(bearerToken);
        } catch (InvalidTokenException ex) {
            log.debug("Rejected access token: {}", ex.getMessage());
            throw new AuthenticationFailedException(COULD_NOT_VALIDATE, ex);
        }
        return appUserRepository.findByEmail(email)
                .map(AuthenticatedUser::from)
                .orElseThrow(() -> {
                    log.debug("Access token subject has no matching account");
                    return new AuthenticationFailedException(COULD_NOT_VALIDATE);
                });
    }
}
