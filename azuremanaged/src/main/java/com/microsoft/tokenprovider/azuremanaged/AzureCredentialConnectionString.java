// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.tokenprovider.azuremanaged;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import com.azure.core.credential.TokenCredential;
import com.azure.identity.AzureCliCredentialBuilder;
import com.azure.identity.AzurePowerShellCredentialBuilder;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.identity.EnvironmentCredentialBuilder;
import com.azure.identity.IntelliJCredentialBuilder;
import com.azure.identity.ManagedIdentityCredentialBuilder;
import com.azure.identity.WorkloadIdentityCredentialBuilder;

/**
 * Represents the constituent parts of a connection string describing how to authenticate with Azure.
 */
public class AzureCredentialConnectionString {
    static final String AUTHENTICATION = "Authentication";
    static final String ENDPOINT = "Endpoint";
    static final String CLIENT_ID = "ClientID";
    static final String TENANT_ID = "TenantId";
    static final String CLIENT_SECRET = "ClientSecret";
    static final String AUTHORITY_HOST = "AuthorityHost";
    static final String TOKEN_FILE_PATH = "TokenFilePath";
    static final String ADDITIONALLY_ALLOWED_TENANTS = "AdditionallyAllowedTenants";

    private final Map<String, String> properties;

    /**
     * Initializes a new instance of the AzureCredentialConnectionString class.
     * 
     * @param connectionString A connection string such as {@code Authentication=ManagedIdentity;ClientID=...}.
     * @throws IllegalArgumentException If the connection string is invalid or missing required properties.
     */
    public AzureCredentialConnectionString(String connectionString) {
        if (connectionString == null || connectionString.trim().isEmpty()) {
            throw new IllegalArgumentException("connectionString must not be null or empty");
        }
        this.properties = parseConnectionString(connectionString);
        
        // Validate required properties
        String authType = this.getAuthentication();
        if (normalize(authType).equals("clientsecret")) {
            this.getRequiredValue(TENANT_ID);
            this.getRequiredValue(CLIENT_ID);
            this.getRequiredValue(CLIENT_SECRET);
        }
    }

    /**
     * Gets the authentication method specified in the connection string.
     * 
     * @return The authentication method.
     */
    public String getAuthentication() {
        return getRequiredValue(AUTHENTICATION);
    }

    /**
     * Gets whether the connection string selects no authentication at all.
     *
     * @return True if the authentication method is "None".
     */
    public boolean isAnonymous() {
        return normalize(getAuthentication()).equals("none");
    }

    /**
     * Gets the endpoint specified in the connection string.
     * 
     * @return The endpoint URL, or null if not specified.
     */
    public String getEndpoint() {
        return getValue(ENDPOINT);
    }

    /**
     * Gets the application, managed identity or workload identity client ID specified in the connection string.
     * 
     * @return The client ID, or null if not specified.
     */
    public String getClientId() {
        return getValue(CLIENT_ID);
    }

    /**
     * Gets the "TenantId" property, used by client secret and workload identity authentication.
     * 
     * @return The tenant ID, or null if not specified.
     */
    public String getTenantId() {
        return getValue(TENANT_ID);
    }

    /**
     * Gets the "ClientSecret" property, used by client secret authentication.
     *
     * @return The client secret, or null if not specified.
     */
    public String getClientSecret() {
        return getValue(CLIENT_SECRET);
    }

    /**
     * Gets the "AuthorityHost" property, the Microsoft Entra endpoint to authenticate against.
     *
     * @return The authority host, or null if not specified.
     */
    public String getAuthorityHost() {
        return getValue(AUTHORITY_HOST);
    }

    /**
     * Gets the "TokenFilePath" property, optionally used by Workload Identity.
     * 
     * @return The token file path, or null if not specified.
     */
    public String getTokenFilePath() {
        return getValue(TOKEN_FILE_PATH);
    }

    /**
     * Gets the "AdditionallyAllowedTenants" property, optionally used by Workload Identity.
     * Multiple values can be separated by a comma.
     * 
     * @return List of allowed tenants, or null if not specified.
     */
    public List<String> getAdditionallyAllowedTenants() {
        String value = getValue(ADDITIONALLY_ALLOWED_TENANTS);
        if (value == null || value.isEmpty()) {
            return null;
        }
        return Arrays.asList(value.split(","));
    }

    private String getValue(String name) {
        return properties.get(name);
    }

    private String getRequiredValue(String name) {
        String value = getValue(name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("The connection string must contain a " + name + " property");
        }
        return value;
    }

    private static Map<String, String> parseConnectionString(String connectionString) {
        Map<String, String> properties = new HashMap<>();
        
        String[] pairs = connectionString.split(";");
        for (String pair : pairs) {
            int equalsIndex = pair.indexOf('=');
            if (equalsIndex > 0) {
                String key = pair.substring(0, equalsIndex).trim();
                String value = pair.substring(equalsIndex + 1).trim();
                properties.put(key, value);
            }
        }
        
        return properties;
    }

    static String normalize(String authType) {
        return authType.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Creates a TokenCredential based on the authentication type specified in the connection string.
     * 
     * @return A TokenCredential instance based on the specified authentication type, or null if authentication type is "none".
     * @throws IllegalArgumentException If the connection string contains an unsupported authentication type.
     */
    public @Nullable TokenCredential createTokenCredential() {
        String authType = getAuthentication();
        
        // Parse the supported auth types in a case-insensitive way
        switch (normalize(authType)) {
            case "defaultazure":
                DefaultAzureCredentialBuilder defaultBuilder = new DefaultAzureCredentialBuilder();
                if (getClientId() != null && !getClientId().isEmpty()) {
                    defaultBuilder.managedIdentityClientId(getClientId());
                }
                if (getTenantId() != null && !getTenantId().isEmpty()) {
                    defaultBuilder.tenantId(getTenantId());
                }
                return defaultBuilder.build();
            case "managedidentity":
                return new ManagedIdentityCredentialBuilder().clientId(getClientId()).build();
            case "workloadidentity":
                WorkloadIdentityCredentialBuilder builder = new WorkloadIdentityCredentialBuilder();
                if (getClientId() != null && !getClientId().isEmpty()) {
                    builder.clientId(getClientId());
                }
                
                if (getTenantId() != null && !getTenantId().isEmpty()) {
                    builder.tenantId(getTenantId());
                }
                                
                if (getTokenFilePath() != null && !getTokenFilePath().isEmpty()) {
                    builder.tokenFilePath(getTokenFilePath());
                }

                if (getAdditionallyAllowedTenants() != null) {
                    for (String tenant : getAdditionallyAllowedTenants()) {
                        builder.additionallyAllowedTenants(tenant);
                    }
                }

                return builder.build();
            case "clientsecret":
                ClientSecretCredentialBuilder secretBuilder = new ClientSecretCredentialBuilder()
                    .tenantId(getTenantId())
                    .clientId(getClientId())
                    .clientSecret(getClientSecret());
                if (getAuthorityHost() != null && !getAuthorityHost().isEmpty()) {
                    secretBuilder.authorityHost(getAuthorityHost());
                }
                return secretBuilder.build();
            case "environment":
                return new EnvironmentCredentialBuilder().build();
            case "azurecli":
                return new AzureCliCredentialBuilder().build();
            case "azurepowershell":
                return new AzurePowerShellCredentialBuilder().build();
            case "intellij":
                return new IntelliJCredentialBuilder().build();
            case "none":
                return null;
            default:
                throw new IllegalArgumentException(
                    String.format("The connection string contains an unsupported authentication type '%s'.", authType));
        }
    }
}
