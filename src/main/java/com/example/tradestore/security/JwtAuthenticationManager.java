package com.example.tradestore.security;

import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Authenticates bearer tokens. Every verified caller gets ROLE_SERVICE plus one
 * {@code ROLE_<name>} authority per entry of the roles claim.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationManager implements ReactiveAuthenticationManager {

    private final JwtTokenVerifier jwtTokenVerifier;

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        return Mono.justOrEmpty(authentication)
                .cast(JwtAuthenticationToken.class)
                .flatMap(auth -> Mono.justOrEmpty(jwtTokenVerifier.verify((String) auth.getCredentials())))
                .switchIfEmpty(Mono.error(new BadCredentialsException("Invalid or expired JWT token")))
                .map(this::toAuthentication);
    }

    private Authentication toAuthentication(Claims claims) {
        List<String> roles = JwtTokenVerifier.roles(claims);
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_SERVICE"));
        roles.forEach(role -> authorities.add(new SimpleGrantedAuthority("ROLE_" + role)));

        log.debug("Authenticated {} with roles {}", claims.getSubject(), roles);
        return new JwtAuthenticationToken(claims.getSubject(), roles, authorities);
    }
}
