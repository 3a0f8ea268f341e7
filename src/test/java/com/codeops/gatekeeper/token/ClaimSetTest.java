package com.codeops.gatekeeper.token;

import com.codeops.gatekeeper.exception.MalformedTokenException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ClaimSet covering typed claim access, registered-name aliases and type checks.
 */
class ClaimSetTest {

    @Test
    void readsDescriptiveClaimNames() {
        ClaimSet claims = ClaimSet.of(Map.of(
                "subject", "alice",
                "expiresAt", 1_700_003_600L,
                "issuedAt", 1_700_000_000,
                "notBefore", 1_700_000_000,
                "issuer", "codeops-server",
                "audience", "codeops-gatekeeper"));

        assertThat(claims.subject()).contains("alice");
        assertThat(claims.expiresAt()).contains(Instant.ofEpochSecond(1_700_003_600L));
        assertThat(claims.issuedAt()).contains(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(claims.notBefore()).contains(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(claims.issuer()).contains("codeops-server");
        assertThat(claims.audience()).containsExactly("codeops-gatekeeper");
    }

    @Test
    void readsRegisteredClaimNamesAsAliases() {
        ClaimSet claims = ClaimSet.of(Map.of(
                "sub", "bob",
                "exp", 1_700_003_600L,
                "iat", 1_700_000_000,
                "nbf", 1_700_000_100,
                "iss", "issuer-a",
                "aud", List.of("svc-a", "svc-b")));

        assertThat(claims.subject()).contains("bob");
        assertThat(claims.expiresAt()).contains(Instant.ofEpochSecond(1_700_003_600L));
        assertThat(claims.issuedAt()).contains(Instant.ofEpochSecond(1_700_000_000L));
        assertThat(claims.notBefore()).contains(Instant.ofEpochSecond(1_700_000_100L));
        assertThat(claims.issuer()).contains("issuer-a");
        assertThat(claims.audience()).containsExactly("svc-a", "svc-b");
    }

    @Test
    void descriptiveNameWinsOverAlias() {
        ClaimSet claims = ClaimSet.of(Map.of("subject", "alice", "sub", "mallory"));

        assertThat(claims.subject()).contains("alice");
    }

    @Test
    void absentClaimsAreEmpty() {
        ClaimSet claims = ClaimSet.of(Map.of());

        assertThat(claims.subject()).isEmpty();
        assertThat(claims.expiresAt()).isEmpty();
        assertThat(claims.audience()).isEmpty();
        assertThat(claims.authorities()).isEmpty();
        assertThat(claims.roles()).isEmpty();
    }

    @Test
    void authoritiesAcceptArrayOrSpaceDelimitedString() {
        ClaimSet fromArray = ClaimSet.of(Map.of("authorities", List.of("reports:read", "reports:write")));
        ClaimSet fromString = ClaimSet.of(Map.of("authorities", "  reports:read   reports:write "));

        assertThat(fromArray.authorities()).containsExactly("reports:read", "reports:write");
        assertThat(fromString.authorities()).containsExactly("reports:read", "reports:write");
    }

    @Test
    void fractionalTimestampsKeepMilliseconds() {
        ClaimSet claims = ClaimSet.of(Map.of("expiresAt", 1_700_000_000.25));

        assertThat(claims.expiresAt()).contains(Instant.ofEpochMilli(1_700_000_000_250L));
    }

    @Test
    void rejectsNonStringSubject() {
        assertThatThrownBy(() -> ClaimSet.of(Map.of("subject", 42)))
                .isInstanceOf(MalformedTokenException.class)
                .hasMessageContaining("subject");
    }

    @Test
    void rejectsNonNumericTimestamps() {
        assertThatThrownBy(() -> ClaimSet.of(Map.of("exp", "2030-01-01")))
                .isInstanceOf(MalformedTokenException.class)
                .hasMessageContaining("expiresAt");
        assertThatThrownBy(() -> ClaimSet.of(Map.of("notBefore", true)))
                .isInstanceOf(MalformedTokenException.class);
    }

    @Test
    void rejectsTimestampsOutOfRange() {
        assertThatThrownBy(() -> ClaimSet.of(Map.of("expiresAt", Long.MAX_VALUE)))
                .isInstanceOf(MalformedTokenException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void rejectsHugeFractionalTimestamps() {
        assertThatThrownBy(() -> ClaimSet.of(Map.of("expiresAt", 1.0E300)))
                .isInstanceOf(MalformedTokenException.class)
                .hasMessageContaining("out of range");
        assertThatThrownBy(() -> ClaimSet.of(Map.of("notBefore", -1.0E300)))
                .isInstanceOf(MalformedTokenException.class);
    }

    @Test
    void fractionalTimestampsBelowOneMillisecondAreTruncated() {
        ClaimSet claims = ClaimSet.of(Map.of("issuedAt", 1_700_000_000.0005));

        assertThat(claims.issuedAt()).contains(Instant.ofEpochMilli(1_700_000_000_000L));
    }

    @Test
    void rejectsNonStringAuthorities() {
        assertThatThrownBy(() -> ClaimSet.of(Map.of("roles", List.of("ADMIN", 7))))
                .isInstanceOf(MalformedTokenException.class)
                .hasMessageContaining("roles");
        assertThatThrownBy(() -> ClaimSet.of(Map.of("authorities", Map.of("a", "b"))))
                .isInstanceOf(MalformedTokenException.class);
    }

    @Test
    void builderWritesEpochSecondsAndRemovesNullClaims() {
        ClaimSet claims = ClaimSet.builder()
                .subject("alice")
                .expiresAt(Instant.ofEpochSecond(1_700_000_000L))
                .claim("tenant", "acme")
                .claim("tenant", null)
                .roles("ADMIN")
                .build();

        assertThat(claims.asMap())
                .containsEntry("subject", "alice")
                .containsEntry("expiresAt", 1_700_000_000L)
                .doesNotContainKey("tenant");
        assertThat(claims.roles()).containsExactly("ADMIN");
    }

    @Test
    void claimMapIsImmutableCopy() {
        Map<String, Object> source = new HashMap<>();
        source.put("subject", "alice");
        ClaimSet claims = ClaimSet.of(source);

        source.put("subject", "mallory");

        assertThat(claims.asMap()).containsEntry("subject", "alice");
        assertThatThrownBy(() -> claims.asMap().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }
}
