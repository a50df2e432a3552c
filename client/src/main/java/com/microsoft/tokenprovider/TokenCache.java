// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Cache of access tokens keyed by credential and scope set.
 */
public interface TokenCache {
    /**
     * Gets a valid access token for {@code credential} and {@code scopes}, acquiring a new one if no fresh token
     * is cached. The order of {@code scopes} does not matter.
     *
     * @param credential the credential to get a token for
     * @param scopes the requested scopes, possibly empty
     * @param timeout the maximum time to wait for a token, or {@code null} to wait indefinitely
     * @return the access token value
     * @throws TimeoutException when no token could be obtained within {@code timeout}
     * @throws CredentialInitializationException when the credential could not be initialized
     * @throws TokenRefreshException when acquiring a new token failed
     */
    String getAccessToken(CacheableTokenCredential credential, List<String> scopes, @Nullable Duration timeout)
            throws TimeoutException;
}
