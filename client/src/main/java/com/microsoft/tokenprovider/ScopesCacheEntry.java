// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenRequestContext;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cached token for one credential and one set of scopes.
 * <p>
 * At most one caller refreshes the token at a time. The refresh runs outside {@link #lock}; other callers wait
 * on {@link #refreshed} and re-evaluate the entry each time they are woken.
 */
final class ScopesCacheEntry {
    private static final Logger logger = Logger.getLogger(ScopesCacheEntry.class.getPackage().getName());

    private final CacheableTokenCredential credential;
    private final String cacheKey;
    private final String scopesKey;
    private final List<String> scopes;
    private final Duration margin;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition refreshed = this.lock.newCondition();

    // Guarded by lock
    private boolean refreshing;
    private AccessToken accessToken;

    ScopesCacheEntry(
            CacheableTokenCredential credential,
            String cacheKey,
            String scopesKey,
            List<String> scopes,
            Duration margin,
            Clock clock) {
        this.credential = credential;
        this.cacheKey = cacheKey;
        this.scopesKey = scopesKey;
        this.scopes = Collections.unmodifiableList(new ArrayList<>(scopes));
        this.margin = margin;
        this.clock = clock;
    }

    List<String> getScopes() {
        return this.scopes;
    }

    String getAccessToken(Deadline deadline) throws TimeoutException {
        AccessToken token = null;

        deadline.lock(this.lock, "the token cache entry of " + this.describe());
        try {
            while (true) {
                if (this.isFresh(this.accessToken)) {
                    token = this.accessToken;
                    break;
                }

                if (!this.refreshing) {
                    this.refreshing = true;
                    break;
                }

                deadline.await(this.refreshed, "the token refresh of " + this.describe());
            }
        } finally {
            this.lock.unlock();
        }

        if (token == null) {
            token = this.refreshAccessToken(deadline);
        }

        return token.getToken();
    }

    private AccessToken refreshAccessToken(Deadline deadline) throws TimeoutException {
        AccessToken newToken = null;
        try {
            newToken = this.acquireAccessToken(deadline);
            return newToken;
        } finally {
            this.lock.lock();
            try {
                this.refreshing = false;
                if (newToken != null) {
                    this.accessToken = newToken;
                }
                this.refreshed.signalAll();
            } finally {
                this.lock.unlock();
            }
        }
    }

    private AccessToken acquireAccessToken(Deadline deadline) throws TimeoutException {
        logger.fine(() -> String.format("Acquiring a new access token for %s.", this.describe()));
        long startNanos = System.nanoTime();

        TokenRequestContext context = new TokenRequestContext().setScopes(new ArrayList<>(this.scopes));
        Mono<AccessToken> request;
        try {
            request = this.credential.getAccessToken(context);
        } catch (RuntimeException e) {
            throw this.refreshFailed(String.valueOf(e.getMessage()), e);
        }

        if (request == null) {
            throw this.refreshFailed("the credential returned no result", null);
        }

        // Credentials may block the subscribing thread, which would hold off the timeout until they return.
        if (!deadline.isInfinite()) {
            request = request.subscribeOn(Schedulers.boundedElastic()).timeout(deadline.remaining());
        }

        AccessToken token;
        try {
            token = request.block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                logger.log(Level.WARNING, "Timed out acquiring an access token for {0}.", this.describe());
                TimeoutException timeout = new TimeoutException(
                        "Timed out acquiring an access token for " + this.describe());
                timeout.initCause(cause);
                throw timeout;
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new TokenCacheException("Interrupted while acquiring an access token for " + this.describe(), cause);
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw this.refreshFailed(String.valueOf(cause.getMessage()), cause);
        }

        if (token == null) {
            throw this.refreshFailed("the credential completed without a token", null);
        }
        if (token.getToken() == null || token.getToken().isEmpty()) {
            throw this.refreshFailed("the credential returned an empty token", null);
        }
        if (token.getExpiresAt() == null) {
            throw this.refreshFailed("the credential returned a token without an expiration time", null);
        }

        OffsetDateTime expiresAt = token.getExpiresAt();
        logger.fine(() -> String.format(
                "Acquired a new access token for %s in %d ms; it expires at %s.",
                this.describe(),
                Duration.ofNanos(System.nanoTime() - startNanos).toMillis(),
                expiresAt));
        return token;
    }

    private boolean isFresh(AccessToken token) {
        return token != null && token.getExpiresAt().isAfter(OffsetDateTime.now(this.clock).plus(this.margin));
    }

    private TokenRefreshException refreshFailed(String reason, Throwable cause) {
        logger.log(Level.WARNING, String.format("Failed to acquire an access token for %s.", this.describe()), cause);
        return new TokenRefreshException(this.cacheKey, this.scopesKey, reason, cause);
    }

    private String describe() {
        return String.format("credential '%s' and scopes '%s'", this.cacheKey, this.scopesKey);
    }
}
