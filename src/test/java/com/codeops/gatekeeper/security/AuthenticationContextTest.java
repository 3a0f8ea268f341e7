package com.codeops.gatekeeper.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthenticationContextTest {

    @Test
    void authoritiesAreCopied() {
        Set<GrantedAuthority> authorities = new HashSet<>();
        authorities.add(new SimpleGrantedAuthority("reports:read"));
        AuthenticationContext context = new AuthenticationContext("alice", authorities);

        authorities.add(new SimpleGrantedAuthority("reports:write"));

        assertThat(context.authorityNames()).containsExactly("reports:read");
        assertThat(context.hasAuthority("reports:read")).isTrue();
        assertThat(context.hasAuthority("reports:write")).isFalse();
    }

    @Test
    void principalIsRequired() {
        assertThatThrownBy(() -> new AuthenticationContext(null, Set.of()))
                .isInstanceOf(NullPointerException.class);
    }
}
