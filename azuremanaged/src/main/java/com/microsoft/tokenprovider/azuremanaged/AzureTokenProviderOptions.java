// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.tokenprovider.azuremanaged;

import com.microsoft.tokenprovider.AccessTokenProvider;
import com.microsoft.tokenprovider.CacheableTokenCredential;
import com.microsoft.tokenprovider.ConcurrentTokenCache;
import com.microsoft.tokenprovider.TokenCache;
import com.microsoft.tokenprovider.utils.Helpers;
import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.TlsChannelCredentials;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Options for creating access token providers and authenticated gRPC channels for Azure services.
 */
public class AzureTokenProviderOptions {
    /**
     * The token cache used by options that do not set their own, shared by the whole process.
     */
    private static final TokenCache SHARED_TOKEN_CACHE = new ConcurrentTokenCache();

    private String endpointAddress = "";

    private CacheableTokenCredential credential;
    private List<String> scopes = Collections.singletonList("https://management.azure.com/.default");
    private boolean allowInsecureCredentials = false;
    private Duration tokenTimeout = Duration.ofSeconds(30);
    private TokenCache tokenCache = SHARED_TOKEN_CACHE;

    /**
     * Creates a new instance of AzureTokenProviderOptions.
     */
    public AzureTokenProviderOptions() {
    }

    /**
     * Creates a new instance of AzureTokenProviderOptions from a connection string.
     * 
     * @param connectionString The connection string to parse.
     * @return A new AzureTokenProviderOptions object.
     */
    public static AzureTokenProviderOptions fromConnectionString(String connectionString) {
        AzureCredentialConnectionString parsedConnectionString = new AzureCredentialConnectionString(connectionString);
        return fromConnectionString(parsedConnectionString);
    }

    /**
     * Creates a new instance of AzureTokenProviderOptions from a parsed connection string.
     * 
     * @param connectionString The parsed connection string.
     * @return A new AzureTokenProviderOptions object.
     */
    static AzureTokenProviderOptions fromConnectionString(AzureCredentialConnectionString connectionString) {
        AzureTokenProviderOptions options = new AzureTokenProviderOptions();
        if (connectionString.getEndpoint() != null) {
            options.setEndpointAddress(connectionString.getEndpoint());
        }
        if (!connectionString.isAnonymous()) {
            options.setCredential(AzureIdentityCredential.fromConnectionString(connectionString));
        }
        options.setAllowInsecureCredentials(options.getCredential() == null);
        return options;
    }

    /**
     * Gets the endpoint address.
     * 
     * @return The endpoint address.
     */
    public String getEndpointAddress() {
        return endpointAddress;
    }

    /**
     * Sets the endpoint address.
     * 
     * @param endpointAddress The endpoint address.
     * @return This options object.
     */
    public AzureTokenProviderOptions setEndpointAddress(String endpointAddress) {
        this.endpointAddress = endpointAddress;
        return this;
    }

    /**
     * Gets the credential used for authentication.
     * 
     * @return The credential.
     */
    public CacheableTokenCredential getCredential() {
        return credential;
    }

    /**
     * Sets the credential used for authentication.
     * 
     * @param credential The credential.
     * @return This options object.
     */
    public AzureTokenProviderOptions setCredential(CacheableTokenCredential credential) {
        this.credential = credential;
        return this;
    }

    /**
     * Gets the scopes tokens are requested for.
     *
     * @return The scopes.
     */
    public List<String> getScopes() {
        return scopes;
    }

    /**
     * Sets the scopes tokens are requested for.
     *
     * @param scopes The scopes.
     * @return This options object.
     */
    public AzureTokenProviderOptions setScopes(List<String> scopes) {
        this.scopes = Collections.unmodifiableList(
            new ArrayList<>(Helpers.throwIfArgumentContainsNull(scopes, "scopes")));
        return this;
    }

    /**
     * Sets the scopes to the default scope of a resource, {@code <resourceId>/.default}.
     *
     * @param resourceId The resource ID, for example {@code https://management.azure.com}.
     * @return This options object.
     */
    public AzureTokenProviderOptions setResourceId(String resourceId) {
        Helpers.throwIfArgumentNullOrWhiteSpace(resourceId, "resourceId");
        return setScopes(Collections.singletonList(resourceId + "/.default"));
    }

    /**
     * Gets whether insecure credentials are allowed.
     * 
     * @return True if insecure credentials are allowed.
     */
    public boolean isAllowInsecureCredentials() {
        return allowInsecureCredentials;
    }

    /**
     * Sets whether insecure credentials are allowed.
     * 
     * @param allowInsecureCredentials True to allow insecure credentials.
     * @return This options object.
     */
    public AzureTokenProviderOptions setAllowInsecureCredentials(boolean allowInsecureCredentials) {
        this.allowInsecureCredentials = allowInsecureCredentials;
        return this;
    }

    /**
     * Gets the maximum time to wait for an access token.
     * 
     * @return The token timeout, or null to wait indefinitely.
     */
    public Duration getTokenTimeout() {
        return tokenTimeout;
    }

    /**
     * Sets the maximum time to wait for an access token.
     * 
     * @param tokenTimeout The token timeout, or null to wait indefinitely.
     * @return This options object.
     */
    public AzureTokenProviderOptions setTokenTimeout(Duration tokenTimeout) {
        this.tokenTimeout = tokenTimeout;
        return this;
    }

    /**
     * Gets the token cache.
     *
     * @return The token cache.
     */
    public TokenCache getTokenCache() {
        return tokenCache;
    }

    /**
     * Sets the token cache. By default all options share one process-wide cache.
     *
     * @param tokenCache The token cache.
     * @return This options object.
     */
    public AzureTokenProviderOptions setTokenCache(TokenCache tokenCache) {
        this.tokenCache = Helpers.throwIfArgumentNull(tokenCache, "tokenCache");
        return this;
    }

    /**
     * Creates an access token provider using the configured options.
     *
     * @return A provider of tokens for the configured credential and scopes.
     * @throws IllegalStateException If no credential is configured.
     */
    public AccessTokenProvider createAccessTokenProvider() {
        if (credential == null) {
            throw new IllegalStateException("A credential must be configured to create an access token provider.");
        }
        return new AccessTokenProvider(tokenCache, credential, scopes, tokenTimeout);
    }

    /**
     * Creates a gRPC channel to the configured endpoint.
     * <p>
     * Calls on the channel carry a bearer token from {@link #createAccessTokenProvider()} when a credential is
     * configured, so all channels created from options that share a token cache also share its tokens.
     *
     * @return A gRPC channel that sends a bearer token with every call when a credential is configured.
     * @throws IllegalStateException If no endpoint address is configured.
     */
    public ManagedChannel createGrpcChannel() {
        if (endpointAddress == null || endpointAddress.isEmpty()) {
            throw new IllegalStateException("An endpoint address must be configured to create a gRPC channel.");
        }

        ChannelCredentials channelCredentials = this.allowInsecureCredentials
                ? InsecureChannelCredentials.create()
                : TlsChannelCredentials.create();

        ManagedChannelBuilder<?> builder = Grpc.newChannelBuilder(getAuthority(endpointAddress), channelCredentials);
        if (credential != null) {
            builder.intercept(new BearerTokenInterceptor(createAccessTokenProvider()));
        }
        return builder.build();
    }

    // "host[:port]" of an endpoint given with or without a scheme; https is assumed when none is given.
    static String getAuthority(String endpointAddress) {
        String endpoint = endpointAddress.contains("://") ? endpointAddress : "https://" + endpointAddress;

        URI uri;
        try {
            uri = new URI(endpoint);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid endpoint address: " + endpointAddress, e);
        }

        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Endpoint address has no host: " + endpointAddress);
        }
        return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
    }
}
