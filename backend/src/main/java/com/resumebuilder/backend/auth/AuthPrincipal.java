package com.resumebuilder.backend.auth;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.Collection;
import java.util.List;

/**
 * Authenticated caller. {@code id} is the JWT subject and scopes every resume and version lookup.
 */
public record AuthPrincipal(String id, String email, Collection<? extends GrantedAuthority> authorities) {

    public static final String DEFAULT_ROLE = "ROLE_USER";

    public static AuthPrincipal of(String id, String email, String role) {
        return new AuthPrincipal(id, email, List.of(new SimpleGrantedAuthority(role != null ? role : DEFAULT_ROLE)));
    }
}
