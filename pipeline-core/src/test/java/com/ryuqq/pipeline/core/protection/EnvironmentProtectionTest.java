package com.ryuqq.pipeline.core.protection;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentProtectionTest {

    private final EnvironmentProtection protection = EnvironmentProtection.of(
        List.of("production", "prod-*"),
        List.of("main", "release/*")
    );

    @Test
    void isProtected_ExactAndWildcard() {
        assertTrue(protection.isProtected("production"));
        assertTrue(protection.isProtected("prod-eu"));
        assertFalse(protection.isProtected("staging"));
        assertFalse(protection.isProtected(null));
    }

    @Test
    void isAllowed_ProtectedEnvironment_OnlyFromProtectedRef() {
        assertTrue(protection.isAllowed("production", "main"));
        assertTrue(protection.isAllowed("prod-eu", "release/2024.1"));
        assertFalse(protection.isAllowed("production", "feature/login"));
        assertFalse(protection.isAllowed("production", "main-backup"));
    }

    @Test
    void isAllowed_UnprotectedEnvironment_AnyRef() {
        assertTrue(protection.isAllowed("review/feature-x", "feature/x"));
        assertTrue(protection.isAllowed(null, "feature/x"));
    }

    @Test
    void wildcard_RegexCharactersAreLiteral() {
        EnvironmentProtection dotted = EnvironmentProtection.of(List.of("prod.eu"), List.of());

        assertTrue(dotted.isProtected("prod.eu"));
        assertFalse(dotted.isProtected("prodxeu"));
    }

    @Test
    void none_ProtectsNothing() {
        assertFalse(EnvironmentProtection.NONE.isProtected("production"));
        assertTrue(EnvironmentProtection.NONE.isAllowed("production", "anything"));
    }
}
