// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import com.microsoft.tokenprovider.utils.Helpers;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Provides access tokens for one credential and one set of scopes, backed by a shared {@link TokenCache}.
 * This is the object a data source holds to authenticate its requests.
 */
public final class AccessTokenProvider {
    private final TokenCache tokenCache;
    private final CacheableTokenCredential credential;
    private final List<String> scopes;
    private final Duration timeout;

    /**
     * Creates a new instance of the AccessTokenProvider.
     *
     * @param tokenCache The cache holding tokens, usually shared between providers.
     * @param credential The credential to use for obtaining tokens.
     * @param scopes The scopes to request tokens for.
     * @param timeout The maximum time to wait for a token, or null to wait indefinitely.
     */
    public AccessTokenProvider(
            TokenCache tokenCache,
            CacheableTokenCredential credential,
            List<String> scopes,
            @Nullable Duration timeout) {
        this.tokenCache = Helpers.throwIfArgumentNull(tokenCache, "tokenCache");
        this.credential = Helpers.throwIfArgumentNull(credential, "credential");
        this.scopes = Collections.unmodifiableList(
                new ArrayList<>(Helpers.throwIfArgumentContainsNull(scopes, "scopes")));
        this.timeout = timeout;
    }

    /**
     * Gets a valid access token, refreshing it if necessary.
     *
     * @return A valid access token.
     * @throws TimeoutException when no token could be obtained within the configured timeout
     */
    public String getAccessToken() throws TimeoutException {
        return this.tokenCache.getAccessToken(this.credential, this.scopes, this.timeout);
    }

    /**
     * Gets the scopes tokens are requested for.
     *
     * @return The scopes.
     */
    public List<String> getScopes() {
        return this.scopes;
    }

    /**
     * Gets the credential tokens are requested with.
     *
     * @return The credential.
     */
    public CacheableTokenCredential getCredential() {
        return this.credential;
    }
}
