package io.apiclient.auth;

import java.util.concurrent.CompletableFuture;

import io.apiclient.spec.AuthToken;

/**
 * Exchanges client credentials for an {@link AuthToken}.
 */
public interface AuthRepository {

    /**
     * Authenticates with a client id and secret.
     * <p>
     * The returned future fails with an {@link io.apiclient.spec.ApiClientException} when the
     * credentials are rejected, the endpoint cannot be reached or the response is not a token.
     *
     * @param clientId the client identifier
     * @param clientSecret the client secret
     * @return the token issued for these credentials
     */
    CompletableFuture<AuthToken> authenticate(String clientId, String clientSecret);
}
