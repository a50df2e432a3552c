// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import javax.annotation.Nullable;

/**
 * Exception thrown to the caller whose token acquisition failed. Other callers waiting on the same refresh do not
 * see this exception; they retry the acquisition themselves.
 */
public class TokenRefreshException extends TokenCacheException {
    private final String cacheKey;
    private final String scopesKey;

    TokenRefreshException(String cacheKey, String scopesKey, String reason, @Nullable Throwable cause) {
        super(String.format("Failed to acquire an access token for credential '%s' and scopes '%s': %s",
                cacheKey, scopesKey, reason), cause);
        this.cacheKey = cacheKey;
        this.scopesKey = scopesKey;
    }

    /**
     * Gets the cache key of the credential used for the failed acquisition.
     *
     * @return the credential's cache key
     */
    public String getCacheKey() {
        return this.cacheKey;
    }

    /**
     * Gets the normalized, space-separated scopes of the failed acquisition.
     *
     * @return the scopes key
     */
    public String getScopesKey() {
        return this.scopesKey;
    }
}
