package com.example.tradestore.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;

import java.util.Collection;
import java.util.List;

/**
 * Bearer token before verification, or the verified caller and its roles afterwards.
 */
public class JwtAuthenticationToken extends AbstractAuthenticationToken {

    private final String token;
    private final String subject;
    private final List<String> roles;

    public JwtAuthenticationToken(String token) {
        super(null);
        this.token = token;
        this.subject = null;
        this.roles = List.of();
        setAuthenticated(false);
    }

    public JwtAuthenticationToken(String subject, List<String> roles, Collection<? extends GrantedAuthority> authorities) {
        super(authorities);
        this.token = null;
        this.subject = subject;
        this.roles = List.copyOf(roles);
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return token;
    }

    @Override
    public Object getPrincipal() {
        return subject != null ? subject : token;
    }

    public List<String> getRoles() {
        return roles;
    }
}
