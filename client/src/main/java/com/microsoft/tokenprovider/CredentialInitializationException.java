// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

/**
 * Exception thrown when {@link CacheableTokenCredential#init()} fails. The next request for the same credential
 * retries the initialization.
 */
public class CredentialInitializationException extends TokenCacheException {
    private final String cacheKey;

    CredentialInitializationException(String cacheKey, Throwable cause) {
        super(String.format("Failed to initialize credential '%s': %s", cacheKey, cause.getMessage()), cause);
        this.cacheKey = cacheKey;
    }

    /**
     * Gets the cache key of the credential that failed to initialize.
     *
     * @return the credential's cache key
     */
    public String getCacheKey() {
        return this.cacheKey;
    }
}
