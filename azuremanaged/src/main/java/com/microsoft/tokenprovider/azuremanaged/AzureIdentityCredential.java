// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.tokenprovider.azuremanaged;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import com.microsoft.tokenprovider.CacheableTokenCredential;
import com.microsoft.tokenprovider.utils.Helpers;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link CacheableTokenCredential} backed by an Azure Identity {@link TokenCredential}.
 * <p>
 * When created from a connection string, the Azure Identity credential is built by {@link #init()}, so that a
 * token cache builds it only once per distinct configuration.
 */
public final class AzureIdentityCredential implements CacheableTokenCredential {
    private static final Logger logger = Logger.getLogger(AzureIdentityCredential.class.getPackage().getName());

    private final String cacheKey;
    private final Supplier<TokenCredential> credentialFactory;
    private volatile TokenCredential tokenCredential;

    /**
     * Creates a credential wrapping an existing Azure Identity credential.
     *
     * @param cacheKey The key identifying the configuration of {@code tokenCredential}.
     * @param tokenCredential The credential that acquires the tokens.
     */
    public AzureIdentityCredential(String cacheKey, TokenCredential tokenCredential) {
        this(Helpers.throwIfArgumentNullOrWhiteSpace(cacheKey, "cacheKey"),
            supplierOf(Helpers.throwIfArgumentNull(tokenCredential, "tokenCredential")));
    }

    private AzureIdentityCredential(String cacheKey, Supplier<TokenCredential> credentialFactory) {
        this.cacheKey = cacheKey;
        this.credentialFactory = credentialFactory;
    }

    private static Supplier<TokenCredential> supplierOf(TokenCredential tokenCredential) {
        return () -> tokenCredential;
    }

    /**
     * Creates a credential from a connection string.
     *
     * @param connectionString The connection string to parse.
     * @return A new AzureIdentityCredential.
     * @throws IllegalArgumentException If the connection string is invalid.
     */
    public static AzureIdentityCredential fromConnectionString(String connectionString) {
        return fromConnectionString(new AzureCredentialConnectionString(connectionString));
    }

    /**
     * Creates a credential from a parsed connection string.
     *
     * @param connectionString The parsed connection string.
     * @return A new AzureIdentityCredential.
     */
    public static AzureIdentityCredential fromConnectionString(AzureCredentialConnectionString connectionString) {
        Objects.requireNonNull(connectionString, "connectionString must not be null");
        return new AzureIdentityCredential(getCacheKey(connectionString), connectionString::createTokenCredential);
    }

    @Override
    public String getCacheKey() {
        return this.cacheKey;
    }

    @Override
    public void init() {
        TokenCredential credential = this.credentialFactory.get();
        if (credential == null) {
            throw new IllegalStateException("The configured authentication type does not provide access tokens.");
        }

        this.tokenCredential = credential;
        logger.log(Level.FINE, "Created {0} for credential ''{1}''.",
            new Object[] { credential.getClass().getSimpleName(), this.cacheKey });
    }

    @Override
    public Mono<AccessToken> getAccessToken(TokenRequestContext request) {
        TokenCredential credential = this.tokenCredential;
        if (credential == null) {
            return Mono.error(new IllegalStateException(
                "The credential '" + this.cacheKey + "' has not been initialized."));
        }

        return credential.getToken(request);
    }

    /**
     * Builds the cache key of a connection string's credential configuration. Only the properties that affect
     * which identity is used take part, and a client secret is represented by its SHA-256 digest.
     */
    static String getCacheKey(AzureCredentialConnectionString connectionString) {
        Map<String, String> parts = new TreeMap<>();
        putIfPresent(parts, AzureCredentialConnectionString.CLIENT_ID, connectionString.getClientId());
        putIfPresent(parts, AzureCredentialConnectionString.TENANT_ID, connectionString.getTenantId());
        putIfPresent(parts, AzureCredentialConnectionString.AUTHORITY_HOST, connectionString.getAuthorityHost());
        putIfPresent(parts, AzureCredentialConnectionString.TOKEN_FILE_PATH, connectionString.getTokenFilePath());

        List<String> tenants = connectionString.getAdditionallyAllowedTenants();
        if (tenants != null) {
            List<String> sortedTenants = new ArrayList<>();
            for (String tenant : tenants) {
                sortedTenants.add(tenant.trim());
            }
            Collections.sort(sortedTenants);
            parts.put(AzureCredentialConnectionString.ADDITIONALLY_ALLOWED_TENANTS, String.join(",", sortedTenants));
        }

        String secret = connectionString.getClientSecret();
        if (!Helpers.isNullOrEmpty(secret)) {
            parts.put(AzureCredentialConnectionString.CLIENT_SECRET, "sha256:" + sha256(secret));
        }

        StringBuilder key = new StringBuilder(
            AzureCredentialConnectionString.normalize(connectionString.getAuthentication()));
        for (Map.Entry<String, String> part : parts.entrySet()) {
            key.append(';').append(part.getKey()).append('=').append(part.getValue());
        }
        return key.toString();
    }

    private static void putIfPresent(Map<String, String> parts, String name, String value) {
        if (!Helpers.isNullOrEmpty(value)) {
            parts.put(name, value);
        }
    }

    private static String sha256(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder();
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to support SHA-256
            throw new IllegalStateException(e);
        }
    }
}
