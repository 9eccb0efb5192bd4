package com.example.tradestore.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Verifies HMAC-signed bearer tokens and reads the caller's roles from the {@code roles} claim.
 */
@Slf4j
@Component
public class JwtTokenVerifier {

    public static final String ROLES_CLAIM = "roles";

    private final SecretKey signingKey;

    public JwtTokenVerifier(@Value("${jwt.secret}") String secret) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Claims of a valid, unexpired token; empty for anything else.
     */
    public Optional<Claims> verify(String token) {
        try {
            return Optional.of(Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload());
        } catch (ExpiredJwtException e) {
            log.warn("JWT token has expired: {}", e.getMessage());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public static List<String> roles(Claims claims) {
        Object roles = claims.get(ROLES_CLAIM);
        if (roles instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).collect(Collectors.toList());
        }
        if (roles instanceof String value && !value.isBlank()) {
            return List.of(value.split("\\s*,\\s*"));
        }
        return List.of();
    }
}
