package io.apiclient.auth;

import static io.apiclient.util.Assert.checkNotNullParam;

import java.util.concurrent.CompletableFuture;

import io.apiclient.spec.AuthToken;

/**
 * Entry point for logging in. Delegates to whichever {@link AuthRepository} it was given.
 */
public class AuthService {

    private final AuthRepository repository;

    public AuthService(AuthRepository repository) {
        this.repository = checkNotNullParam("repository", repository);
    }

    public CompletableFuture<AuthToken> login(String clientId, String clientSecret) {
        return repository.authenticate(clientId, clientSecret);
    }
}
