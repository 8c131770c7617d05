package io.apiclient.auth;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.apiclient.client.http.ApiClient;
import io.apiclient.spec.ApiClientException;
import io.apiclient.spec.ApiRequestException;
import io.apiclient.spec.AuthToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RestAuthRepositoryTest {

    private static final String TOKEN_RESPONSE = """
            {
              "access_token": "abc123",
              "token_type": "Bearer",
              "expires_in": 3600,
              "refresh_token": "refresh",
              "scope": "read write"
            }""";

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private String baseUrl() {
        return "http://localhost:" + server.port();
    }

    @Test
    public void testAuthenticateReturnsAllTokenFields() throws Exception {
        givenThat(post(urlEqualTo("/auth/login"))
                .withHeader("Content-Type", equalTo("application/x-www-form-urlencoded"))
                .withRequestBody(equalTo("client_id=my_id&client_secret=my_secret"))
                .willReturn(okJson(TOKEN_RESPONSE)));

        AuthRepository repository = new RestAuthRepository(baseUrl(), "/auth/login");

        AuthToken token = repository.authenticate("my_id", "my_secret").get(10, TimeUnit.SECONDS);

        assertEquals(new AuthToken("abc123", "Bearer", 3600L, "refresh", "read write"), token);
        verify(postRequestedFor(urlEqualTo("/auth/login"))
                .withoutHeader("Authorization"));
    }

    @Test
    public void testAuthenticateWithoutOptionalFields() throws Exception {
        givenThat(post(urlEqualTo("/oauth/token"))
                .willReturn(okJson("{\"access_token\":\"abc123\",\"token_type\":\"Bearer\"}")));

        AuthRepository repository = new RestAuthRepository(new ApiClient(baseUrl() + "/"), "oauth/token");

        AuthToken token = repository.authenticate("my_id", "my_secret").get(10, TimeUnit.SECONDS);

        assertEquals("abc123", token.accessToken());
        assertNull(token.expiresIn());
        assertNull(token.refreshToken());
        assertNull(token.scope());
    }

    @Test
    public void testRejectedCredentialsFailWithStatusAndBody() {
        givenThat(post(urlEqualTo("/auth/login"))
                .withRequestBody(containing("client_id=bad"))
                .willReturn(aResponse()
                        .withStatus(401)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"error\":\"invalid_client\"}")));

        AuthRepository repository = new RestAuthRepository(baseUrl(), "/auth/login");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> repository.authenticate("bad", "wrong").get(10, TimeUnit.SECONDS));
        ApiRequestException failure = assertInstanceOf(ApiRequestException.class, e.getCause());
        assertEquals(ApiClientException.Kind.REQUEST_FAILED, failure.kind());
        assertEquals(401, failure.getStatusCode());
        assertEquals("{\"error\":\"invalid_client\"}", failure.getBody());
    }

    @Test
    public void testResponseWithoutAccessTokenIsADecodeFailure() {
        givenThat(post(urlEqualTo("/auth/login"))
                .willReturn(okJson("{\"token_type\":\"Bearer\"}")));

        AuthRepository repository = new RestAuthRepository(baseUrl(), "/auth/login");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> repository.authenticate("my_id", "my_secret").get(10, TimeUnit.SECONDS));
        ApiClientException failure = assertInstanceOf(ApiClientException.class, e.getCause());
        assertEquals(ApiClientException.Kind.DECODE, failure.kind());
    }

    @Test
    public void testJsonNullResponseIsADecodeFailure() {
        givenThat(post(urlEqualTo("/oauth/token"))
                .willReturn(okJson("null")));

        AuthService authService = new AuthService(new RestAuthRepository(baseUrl(), "/oauth/token"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> authService.login("my_id", "my_secret").get(10, TimeUnit.SECONDS));
        ApiClientException failure = assertInstanceOf(ApiClientException.class, e.getCause());
        assertEquals(ApiClientException.Kind.DECODE, failure.kind());
    }

    @Test
    public void testWronglyTypedTokenFieldsAreADecodeFailure() {
        givenThat(post(urlEqualTo("/oauth/token"))
                .willReturn(okJson("{\"access_token\":123,\"token_type\":true,\"expires_in\":3600.9}")));

        AuthRepository repository = new RestAuthRepository(baseUrl(), "/oauth/token");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> repository.authenticate("my_id", "my_secret").get(10, TimeUnit.SECONDS));
        assertEquals(ApiClientException.Kind.DECODE,
                assertInstanceOf(ApiClientException.class, e.getCause()).kind());
    }

    @Test
    public void testCredentialsAreFormEncoded() throws Exception {
        givenThat(post(urlEqualTo("/auth/login"))
                .willReturn(okJson(TOKEN_RESPONSE)));

        new RestAuthRepository(baseUrl(), "/auth/login")
                .authenticate("my id", "s3cr&t=")
                .get(10, TimeUnit.SECONDS);

        verify(postRequestedFor(urlEqualTo("/auth/login"))
                .withRequestBody(equalTo("client_id=my+id&client_secret=s3cr%26t%3D")));
    }

    @Test
    public void testNullArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RestAuthRepository((ApiClient) null, "/auth"));
        assertThrows(IllegalArgumentException.class, () -> new RestAuthRepository(baseUrl(), null));
        assertThrows(IllegalArgumentException.class, () -> new RestAuthRepository(baseUrl(), " "));

        RestAuthRepository repository = new RestAuthRepository(baseUrl(), "/auth/login");
        assertEquals("/auth/login", repository.getAuthPath());
        assertThrows(IllegalArgumentException.class, () -> repository.authenticate(null, "secret"));
        assertThrows(IllegalArgumentException.class, () -> repository.authenticate("id", null));
    }
}
