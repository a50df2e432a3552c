// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cache entry for one credential: initializes the credential once and holds one {@link ScopesCacheEntry} per
 * distinct set of scopes.
 */
final class CredentialCacheEntry {
    private static final Logger logger = Logger.getLogger(CredentialCacheEntry.class.getPackage().getName());

    private final CacheableTokenCredential credential;
    private final String cacheKey;
    private final Duration margin;
    private final Clock clock;

    private final ReentrantLock initLock = new ReentrantLock();
    private volatile boolean initialized;

    private final ConcurrentMap<String, ScopesCacheEntry> scopesCache = new ConcurrentHashMap<>();

    CredentialCacheEntry(CacheableTokenCredential credential, String cacheKey, Duration margin, Clock clock) {
        this.credential = credential;
        this.cacheKey = cacheKey;
        this.margin = margin;
        this.clock = clock;
    }

    String getAccessToken(List<String> scopes, Deadline deadline) throws TimeoutException {
        this.ensureInitialized(deadline);
        return this.getEntryFor(scopes).getAccessToken(deadline);
    }

    boolean isInitialized() {
        return this.initialized;
    }

    void ensureInitialized(Deadline deadline) throws TimeoutException {
        if (this.initialized) {
            return;
        }

        deadline.lock(this.initLock, "the initialization of credential '" + this.cacheKey + "'");
        try {
            if (!this.initialized) {
                try {
                    this.credential.init();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, String.format("Failed to initialize credential '%s'.", this.cacheKey), e);
                    throw new CredentialInitializationException(this.cacheKey, e);
                }

                this.initialized = true;
                logger.log(Level.INFO, "Initialized credential ''{0}''.", this.cacheKey);
            }
        } finally {
            this.initLock.unlock();
        }
    }

    ScopesCacheEntry getEntryFor(List<String> scopes) {
        String scopesKey = getKeyForScopes(scopes);

        ScopesCacheEntry entry = this.scopesCache.get(scopesKey);
        if (entry == null) {
            entry = this.scopesCache.computeIfAbsent(scopesKey, key -> {
                logger.fine(() -> String.format(
                        "Creating token cache entry for credential '%s' and scopes '%s'.", this.cacheKey, key));
                return new ScopesCacheEntry(this.credential, this.cacheKey, key, scopes, this.margin, this.clock);
            });
        }

        return entry;
    }

    /**
     * Builds the scope store key: scopes sorted and joined with single spaces, so that the order in which scopes
     * are requested does not matter.
     */
    static String getKeyForScopes(List<String> scopes) {
        if (scopes.size() > 1) {
            List<String> sorted = new ArrayList<>(scopes);
            Collections.sort(sorted);
            scopes = sorted;
        }

        return String.join(" ", scopes);
    }
}
