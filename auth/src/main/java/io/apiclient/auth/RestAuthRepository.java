package io.apiclient.auth;

import static io.apiclient.util.Assert.checkNotBlankParam;
import static io.apiclient.util.Assert.checkNotNullParam;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import io.apiclient.client.http.ApiClient;
import io.apiclient.client.http.NameValuePair;
import io.apiclient.spec.AuthToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AuthRepository} that posts the credentials as a form to an authentication endpoint.
 * <p>
 * The request carries no extra headers. Whatever {@link ApiClient} is used, the future it returns
 * is handed back as is, so failures reach the caller unchanged.
 */
public class RestAuthRepository implements AuthRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestAuthRepository.class);

    public static final String CLIENT_ID = "client_id";
    public static final String CLIENT_SECRET = "client_secret";

    private final ApiClient apiClient;
    private final String authPath;

    /**
     * @param apiClient the client used to reach the authentication endpoint, normally without token
     * @param authPath the path of the authentication endpoint, relative to the client's base URL
     */
    public RestAuthRepository(ApiClient apiClient, String authPath) {
        this.apiClient = checkNotNullParam("apiClient", apiClient);
        this.authPath = checkNotBlankParam("authPath", authPath);
    }

    /**
     * Creates a repository with its own {@link ApiClient} on the default transport.
     *
     * @param baseUrl the backend base URL
     * @param authPath the path of the authentication endpoint
     */
    public RestAuthRepository(String baseUrl, String authPath) {
        this(new ApiClient(baseUrl), authPath);
    }

    public String getAuthPath() {
        return authPath;
    }

    @Override
    public CompletableFuture<AuthToken> authenticate(String clientId, String clientSecret) {
        checkNotNullParam(CLIENT_ID, clientId);
        checkNotNullParam(CLIENT_SECRET, clientSecret);

        List<NameValuePair> form = List.of(
                NameValuePair.of(CLIENT_ID, clientId),
                NameValuePair.of(CLIENT_SECRET, clientSecret));

        LOGGER.debug("Authenticating client {} against {}", clientId, authPath);
        CompletableFuture<AuthToken> token = apiClient.postForm(authPath, form, AuthToken.class);
        token.whenComplete((result, failure) -> {
            if (failure != null) {
                LOGGER.debug("Authentication of client {} failed: {}", clientId, failure.getMessage());
            }
        });
        return token;
    }
}
