package com.platform.scaffold.security;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BearerCredentialArgumentResolverTest {

    @Test
    void extractsBearerToken() {
        assertEquals(Optional.of("abc123"), BearerCredentialArgumentResolver.extractToken("Bearer abc123"));
        assertEquals(Optional.of("abc123"), BearerCredentialArgumentResolver.extractToken("bearer abc123"));
        assertEquals(Optional.of("abc123"), BearerCredentialArgumentResolver.extractToken("  Bearer   abc123 "));
    }

    @Test
    void malformedHeadersCarryNoCredential() {
        assertTrue(BearerCredentialArgumentResolver.extractToken(null).isEmpty());
        assertTrue(BearerCredentialArgumentResolver.extractToken("").isEmpty());
        assertTrue(BearerCredentialArgumentResolver.extractToken("InvalidFormat").isEmpty());
        assertTrue(BearerCredentialArgumentResolver.extractToken("Bearer ").isEmpty());
        assertTrue(BearerCredentialArgumentResolver.extractToken("Basic dXNlcjpwYXNz").isEmpty());
    }
}
