package com.taskmanager.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import com.taskmanager.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and validates HS256-signed access tokens whose subject is the user email.
 * Tokens are self-contained and are never revoked; expiry is their only end of life.
 */
@Service
public class JwtTokenService {

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:1800000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        if (accessTokenTtlMillis <= 0) {
            throw new IllegalArgumentException("jwt.expiration must be positive");
        }
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = Duration.ofMillis(accessTokenTtlMillis);
        this.clock = clock;
    }

    public IssuedToken issue(String subject) {
        return issue(subject, accessTokenTtl);
    }

    public IssuedToken issue(String subject, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("Token subject must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Token ttl must be positive");
        }
        Instant now = clock.instant();
        Instant expiresAt = roundUpToSecond(now.plus(ttl));

        String token = Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
        return new IssuedToken(token, expiresAt);
    }

    /**
     * Returns the subject of a token whose signature and expiry both check out.
     *
     * @throws InvalidTokenException for any token that cannot be fully trusted
     */
    public String validate(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Missing access token", null);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
        if (claims.getExpiration() == null) {
            throw new InvalidTokenException("Access token has no expiry", null);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("Access token has no subject", null);
        }
        return subject;
    }

    // exp carries whole seconds; rounding down would end the token before its ttl
    private static Instant roundUpToSecond(Instant instant) {
        Instant truncated = instant.truncatedTo(ChronoUnit.SECONDS);
        return truncated.equals(instant) ? instant : truncated.plusSeconds(1);
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public record IssuedToken(String token, Instant expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
