// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CredentialCacheEntry}.
 */
public class CredentialCacheEntryTest {

    private final CredentialCacheEntry entry = new CredentialCacheEntry(
        new FakeTokenCredential("cred"), "cred", Duration.ofMinutes(2), Clock.systemUTC());

    @Test
    @DisplayName("getKeyForScopes should sort multiple scopes and join them with spaces")
    public void getKeyForScopes_SortsMultipleScopes() {
        assertEquals("a b c", CredentialCacheEntry.getKeyForScopes(Arrays.asList("c", "a", "b")));
    }

    @Test
    @DisplayName("getKeyForScopes should use a single scope unchanged")
    public void getKeyForScopes_UsesSingleScopeUnchanged() {
        assertEquals("https://x/.default", CredentialCacheEntry.getKeyForScopes(
            Collections.singletonList("https://x/.default")));
    }

    @Test
    @DisplayName("getKeyForScopes should return an empty key for no scopes")
    public void getKeyForScopes_ReturnsEmptyKeyForNoScopes() {
        assertEquals("", CredentialCacheEntry.getKeyForScopes(Collections.emptyList()));
    }

    @Test
    @DisplayName("getKeyForScopes should not reorder the caller's list")
    public void getKeyForScopes_DoesNotMutateInput() {
        // Arrange
        List<String> scopes = new ArrayList<>(Arrays.asList("b", "a"));

        // Act
        CredentialCacheEntry.getKeyForScopes(scopes);

        // Assert
        assertEquals(Arrays.asList("b", "a"), scopes);
    }

    @Test
    @DisplayName("getEntryFor should return the same entry for permutations of the same scopes")
    public void getEntryFor_SameEntryForPermutations() {
        // Act
        ScopesCacheEntry first = entry.getEntryFor(Arrays.asList("a", "b"));
        ScopesCacheEntry second = entry.getEntryFor(Arrays.asList("b", "a"));

        // Assert
        assertSame(first, second);
        assertEquals(Arrays.asList("a", "b"), first.getScopes());
    }

    @Test
    @DisplayName("getEntryFor should return different entries for different scopes")
    public void getEntryFor_DifferentEntriesForDifferentScopes() {
        assertNotSame(
            entry.getEntryFor(Collections.singletonList("a")),
            entry.getEntryFor(Arrays.asList("a", "b")));
    }

    @Test
    @DisplayName("getEntryFor should keep its own copy of the scopes")
    public void getEntryFor_CopiesScopes() {
        // Arrange
        List<String> scopes = new ArrayList<>(Collections.singletonList("a"));

        // Act
        ScopesCacheEntry scopesEntry = entry.getEntryFor(scopes);
        scopes.add("b");

        // Assert
        assertEquals(Collections.singletonList("a"), scopesEntry.getScopes());
        assertThrows(UnsupportedOperationException.class, () -> scopesEntry.getScopes().add("c"));
    }
}
