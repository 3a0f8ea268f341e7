package com.codeops.gatekeeper.security;

import org.springframework.security.core.GrantedAuthority;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The authenticated principal of one request and the authorities granted to it.
 * Created only after a token passes every check and owned by that request alone.
 *
 * @param principal   the token subject
 * @param authorities the granted authorities, possibly empty
 */
public record AuthenticationContext(String principal, Set<GrantedAuthority> authorities) {

    public AuthenticationContext {
        Objects.requireNonNull(principal, "principal");
        authorities = Set.copyOf(authorities);
    }

    public boolean hasAuthority(String authority) {
        return authorities.stream().anyMatch(granted -> granted.getAuthority().equals(authority));
    }

    /** Authority names in natural order. */
    public Set<String> authorityNames() {
        return authorities.stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
