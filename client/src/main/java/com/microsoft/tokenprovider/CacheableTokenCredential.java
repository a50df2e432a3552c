// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenRequestContext;
import reactor.core.publisher.Mono;

/**
 * A credential whose tokens can be cached by a {@link TokenCache}.
 * <p>
 * The cache calls {@link #init()} at most once successfully per cache key, and never calls
 * {@link #getAccessToken(TokenRequestContext)} while holding any of its internal locks.
 */
public interface CacheableTokenCredential {
    /**
     * Gets the key that identifies this credential's configuration. Credentials returning the same key share
     * cached tokens.
     *
     * @return a stable, non-null key
     */
    String getCacheKey();

    /**
     * Performs one-time setup of the credential. If this method throws, the cache will call it again on the next
     * token request.
     */
    void init();

    /**
     * Acquires a new access token for the scopes in {@code request}.
     *
     * @param request the token request context carrying the requested scopes
     * @return a {@code Mono} that emits the acquired token
     */
    Mono<AccessToken> getAccessToken(TokenRequestContext request);
}
