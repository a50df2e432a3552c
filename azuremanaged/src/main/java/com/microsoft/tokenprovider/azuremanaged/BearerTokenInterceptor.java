// Copyright (c) Microsoft Corporation. All rights reserved.
// Licensed under the MIT License.

package com.microsoft.tokenprovider.azuremanaged;

import com.microsoft.tokenprovider.AccessTokenProvider;
import com.microsoft.tokenprovider.TokenCacheException;
import com.microsoft.tokenprovider.utils.Helpers;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;

import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * gRPC interceptor that adds an {@code Authorization: Bearer} header to every call.
 */
public final class BearerTokenInterceptor implements ClientInterceptor {
    private static final Logger logger = Logger.getLogger(BearerTokenInterceptor.class.getPackage().getName());

    static final Metadata.Key<String> AUTHORIZATION_KEY =
        Metadata.Key.of("Authorization", Metadata.ASCII_STRING_MARSHALLER);

    private final AccessTokenProvider tokenProvider;

    /**
     * Creates a new interceptor.
     *
     * @param tokenProvider The provider of the tokens to send.
     */
    public BearerTokenInterceptor(AccessTokenProvider tokenProvider) {
        this.tokenProvider = Helpers.throwIfArgumentNull(tokenProvider, "tokenProvider");
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
            MethodDescriptor<ReqT, RespT> method,
            CallOptions callOptions,
            Channel next) {
        return new ForwardingClientCall.SimpleForwardingClientCall<ReqT, RespT>(
                next.newCall(method, callOptions)) {
            @Override
            public void start(ClientCall.Listener<RespT> responseListener, Metadata headers) {
                headers.put(AUTHORIZATION_KEY, "Bearer " + getToken(method.getFullMethodName()));
                super.start(responseListener, headers);
            }
        };
    }

    private String getToken(String methodName) {
        try {
            return this.tokenProvider.getAccessToken();
        } catch (TimeoutException e) {
            logger.log(Level.WARNING, "Timed out getting an access token for " + methodName, e);
            throw Status.DEADLINE_EXCEEDED
                .withDescription("Timed out getting an access token")
                .withCause(e)
                .asRuntimeException();
        } catch (TokenCacheException e) {
            logger.log(Level.WARNING, "Failed to get an access token for " + methodName, e);
            throw Status.UNAUTHENTICATED
                .withDescription(e.getMessage())
                .withCause(e)
                .asRuntimeException();
        }
    }
}
