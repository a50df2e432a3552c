// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.
package com.microsoft.tokenprovider;

/**
 * Base class for failures reported by a {@link TokenCache}.
 * <p>
 * Failures are never cached: the same request may be retried and may succeed.
 */
public class TokenCacheException extends RuntimeException {
    TokenCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
