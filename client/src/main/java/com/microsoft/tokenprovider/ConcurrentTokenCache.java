// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import com.microsoft.tokenprovider.utils.Helpers;

import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeoutException;

/**
 * Thread-safe {@link TokenCache} that coalesces concurrent token refreshes.
 * <p>
 * Tokens are cached per credential cache key and per set of scopes. A cached token is served until it is within
 * the expiry margin of its expiration time. When a new token is needed, exactly one caller acquires it while the
 * other callers for the same credential and scopes wait for that acquisition and reuse its result. A failed
 * acquisition is reported only to the caller that performed it; waiting callers then retry on their own.
 * <p>
 * Entries are never evicted, so a cache instance retains one entry for every credential and scope set it has
 * been asked for.
 */
public final class ConcurrentTokenCache implements TokenCache {
    /**
     * The default time before a token's expiration at which the cache stops serving it.
     */
    public static final Duration DEFAULT_EXPIRY_MARGIN = Duration.ofMinutes(2);

    private final ConcurrentMap<String, CredentialCacheEntry> cache = new ConcurrentHashMap<>();
    private final Duration margin;
    private final Clock clock;

    /**
     * Creates a new cache that refreshes tokens {@link #DEFAULT_EXPIRY_MARGIN} before they expire.
     */
    public ConcurrentTokenCache() {
        this(DEFAULT_EXPIRY_MARGIN);
    }

    /**
     * Creates a new cache that refreshes tokens {@code margin} before they expire.
     *
     * @param margin the time before expiration at which a cached token is no longer served
     */
    public ConcurrentTokenCache(Duration margin) {
        this(margin, Clock.systemUTC());
    }

    ConcurrentTokenCache(Duration margin, Clock clock) {
        Helpers.throwIfArgumentNull(margin, "margin");
        if (margin.isNegative()) {
            throw new IllegalArgumentException("The argument 'margin' must not be negative.");
        }
        this.margin = margin;
        this.clock = Helpers.throwIfArgumentNull(clock, "clock");
    }

    @Override
    public String getAccessToken(CacheableTokenCredential credential, List<String> scopes, @Nullable Duration timeout)
            throws TimeoutException {
        Helpers.throwIfArgumentNull(credential, "credential");
        Helpers.throwIfArgumentContainsNull(scopes, "scopes");

        Deadline deadline = Deadline.after(timeout);
        return this.getEntryFor(credential).getAccessToken(scopes, deadline);
    }

    /**
     * Gets the time before expiration at which a cached token is no longer served.
     *
     * @return the expiry margin
     */
    public Duration getExpiryMargin() {
        return this.margin;
    }

    CredentialCacheEntry getEntryFor(CacheableTokenCredential credential) {
        String cacheKey = credential.getCacheKey();
        if (cacheKey == null) {
            throw new IllegalArgumentException("The credential returned a null cache key.");
        }

        CredentialCacheEntry entry = this.cache.get(cacheKey);
        if (entry == null) {
            entry = this.cache.computeIfAbsent(
                    cacheKey,
                    key -> new CredentialCacheEntry(credential, key, this.margin, this.clock));
        }

        return entry;
    }
}
