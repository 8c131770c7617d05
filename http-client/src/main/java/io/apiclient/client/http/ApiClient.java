package io.apiclient.client.http;

import static io.apiclient.client.http.HttpClient.APPLICATION_FORM_URLENCODED;
import static io.apiclient.client.http.HttpClient.APPLICATION_JSON;
import static io.apiclient.client.http.HttpClient.AUTHORIZATION;
import static io.apiclient.client.http.HttpClient.CONTENT_TYPE;
import static io.apiclient.util.Assert.checkNotNullParam;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.apiclient.spec.ApiClientException;
import io.apiclient.spec.ApiDecodeException;
import io.apiclient.spec.ApiRequestException;
import io.apiclient.spec.ApiTransportException;
import io.apiclient.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for a JSON/form based REST backend.
 * <p>
 * Every operation resolves its path against the base URL, sends the request through the
 * configured {@link HttpClient} transport and decodes the JSON response into the requested type.
 * Headers are applied in a fixed order: {@code Authorization: Bearer <token>} when a token is
 * configured, then {@code Content-Type} for requests with a body, then the caller's extra headers.
 * Extra headers are appended and never replace the Authorization header.
 *
 * <h2>Failures</h2>
 * Operations never throw for network, status or decoding problems; the returned future completes
 * exceptionally with an {@link ApiClientException}:
 * <ul>
 *   <li>{@link ApiTransportException} - no response could be obtained</li>
 *   <li>{@link ApiRequestException} - the response status was not 2xx</li>
 *   <li>{@link ApiDecodeException} - the response body did not match the requested type</li>
 * </ul>
 * A request body that cannot be written as JSON fails the future with
 * {@link IllegalArgumentException}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ApiClient client = new ApiClient("https://api.example.com").withToken(token.accessToken());
 *
 * Item item = client.getJson("/items/42", Item.class).get();
 * Item created = client.postJson("/items", new NewItem("two"), Item.class,
 *         List.of(NameValuePair.of("X-Trace", "abc123"))).get();
 * }</pre>
 *
 * Instances are immutable and may be shared between threads; each call builds its own request.
 */
public class ApiClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiClient.class);

    static final String BEARER_PREFIX = "Bearer ";

    private final HttpClient httpClient;
    private final @Nullable String token;

    /**
     * Creates a client using the default JDK transport. The base URL is not validated: an invalid
     * URL surfaces as an {@link ApiTransportException} on first use.
     *
     * @param baseUrl the base URL, with or without trailing slash
     */
    public ApiClient(String baseUrl) {
        this(baseUrl, HttpClientBuilder.DEFAULT_FACTORY);
    }

    /**
     * Creates a client whose transport is created by the given builder.
     *
     * @param baseUrl the base URL, with or without trailing slash
     * @param httpClientBuilder the transport factory
     */
    public ApiClient(String baseUrl, HttpClientBuilder httpClientBuilder) {
        this(checkNotNullParam("httpClientBuilder", httpClientBuilder)
                .create(checkNotNullParam("baseUrl", baseUrl)), null);
    }

    /**
     * Creates a client on top of an existing transport.
     *
     * @param httpClient the transport
     */
    public ApiClient(HttpClient httpClient) {
        this(checkNotNullParam("httpClient", httpClient), null);
    }

    private ApiClient(HttpClient httpClient, @Nullable String token) {
        this.httpClient = httpClient;
        this.token = token;
    }

    /**
     * Returns a client that sends {@code Authorization: Bearer <token>} on every request. The new
     * client shares this client's transport; this client is left unchanged.
     *
     * @param token the bearer token
     * @return a client configured with the token
     */
    public ApiClient withToken(String token) {
        checkNotNullParam("token", token);
        return new ApiClient(httpClient, token);
    }

    public String getBaseUrl() {
        return httpClient.getBaseUrl();
    }

    public boolean hasToken() {
        return token != null;
    }

    // GET

    public <T> CompletableFuture<T> getJson(String path, Class<T> responseType) {
        return getJson(path, responseType, null);
    }

    public <T> CompletableFuture<T> getJson(String path, Class<T> responseType,
                                            @Nullable List<NameValuePair> extraHeaders) {
        return getJson(path, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> getJson(String path, TypeReference<T> responseType,
                                            @Nullable List<NameValuePair> extraHeaders) {
        return getJson(path, javaType(responseType), extraHeaders);
    }

    private <T> CompletableFuture<T> getJson(String path, JavaType responseType,
                                             @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return exchange("GET", path, httpClient.get(path), null, responseType, extraHeaders);
    }

    // POST / PUT with a JSON body

    public <T> CompletableFuture<T> postJson(String path, Object body, Class<T> responseType) {
        return postJson(path, body, responseType, null);
    }

    public <T> CompletableFuture<T> postJson(String path, Object body, Class<T> responseType,
                                             @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendJson("POST", path, httpClient.post(path), body, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> postJson(String path, Object body, TypeReference<T> responseType,
                                             @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendJson("POST", path, httpClient.post(path), body, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> putJson(String path, Object body, Class<T> responseType) {
        return putJson(path, body, responseType, null);
    }

    public <T> CompletableFuture<T> putJson(String path, Object body, Class<T> responseType,
                                            @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendJson("PUT", path, httpClient.put(path), body, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> putJson(String path, Object body, TypeReference<T> responseType,
                                            @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendJson("PUT", path, httpClient.put(path), body, javaType(responseType), extraHeaders);
    }

    // POST / PUT with a form body

    public <T> CompletableFuture<T> postForm(String path, List<NameValuePair> fields, Class<T> responseType) {
        return postForm(path, fields, responseType, null);
    }

    public <T> CompletableFuture<T> postForm(String path, List<NameValuePair> fields, Class<T> responseType,
                                             @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendForm("POST", path, httpClient.post(path), fields, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> postForm(String path, List<NameValuePair> fields, TypeReference<T> responseType,
                                             @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendForm("POST", path, httpClient.post(path), fields, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> putForm(String path, List<NameValuePair> fields, Class<T> responseType) {
        return putForm(path, fields, responseType, null);
    }

    public <T> CompletableFuture<T> putForm(String path, List<NameValuePair> fields, Class<T> responseType,
                                            @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendForm("PUT", path, httpClient.put(path), fields, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> putForm(String path, List<NameValuePair> fields, TypeReference<T> responseType,
                                            @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return sendForm("PUT", path, httpClient.put(path), fields, javaType(responseType), extraHeaders);
    }

    // DELETE

    public <T> CompletableFuture<T> deleteJson(String path, Class<T> responseType) {
        return deleteJson(path, responseType, null);
    }

    public <T> CompletableFuture<T> deleteJson(String path, Class<T> responseType,
                                               @Nullable List<NameValuePair> extraHeaders) {
        return deleteJson(path, javaType(responseType), extraHeaders);
    }

    public <T> CompletableFuture<T> deleteJson(String path, TypeReference<T> responseType,
                                               @Nullable List<NameValuePair> extraHeaders) {
        return deleteJson(path, javaType(responseType), extraHeaders);
    }

    private <T> CompletableFuture<T> deleteJson(String path, JavaType responseType,
                                                @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("path", path);
        return exchange("DELETE", path, httpClient.delete(path), null, responseType, extraHeaders);
    }

    private <T> CompletableFuture<T> sendJson(String method, String path, HttpClient.BodyRequestBuilder<?> builder,
                                              Object body, JavaType responseType,
                                              @Nullable List<NameValuePair> extraHeaders) {
        checkNotNullParam("body", body);
        String payload;
        try {
            payload = Utils.marshalToString(body);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException("Could not serialize request body for " + method + " " + path, e));
        }
        builder.body(payload);
        return exchange(method, path, builder, APPLICATION_JSON, responseType, extraHeaders);
    }

    private <T> CompletableFuture<T> sendForm(String method, String path, HttpClient.BodyRequestBuilder<?> builder,
                                              List<NameValuePair> fields, JavaType responseType,
                                              @Nullable List<NameValuePair> extraHeaders) {
        builder.body(FormEncoder.encode(fields));
        return exchange(method, path, builder, APPLICATION_FORM_URLENCODED, responseType, extraHeaders);
    }

    private <T> CompletableFuture<T> exchange(String method, String path, HttpClient.RequestBuilder<?> builder,
                                              @Nullable String contentType, JavaType responseType,
                                              @Nullable List<NameValuePair> extraHeaders) {
        if (token != null) {
            builder.addHeader(AUTHORIZATION, BEARER_PREFIX + token);
        }
        if (contentType != null) {
            builder.addHeader(CONTENT_TYPE, contentType);
        }
        builder.addHeaders(extraHeaders);

        final String url = HttpUrls.join(getBaseUrl(), path);
        LOGGER.debug("{} {}", method, url);

        CompletableFuture<HttpResponse> sent;
        try {
            sent = builder.send();
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }

        return sent
                .handle((response, failure) -> failure != null
                        ? CompletableFuture.<T>failedFuture(transportFailure(method, url, failure))
                        : this.<T>decode(method, url, response, responseType))
                .thenCompose(Function.identity());
    }

    private <T> CompletableFuture<T> decode(String method, String url, HttpResponse response, JavaType responseType) {
        if (!response.success()) {
            LOGGER.debug("{} {} failed with status {}", method, url, response.statusCode());
            return CompletableFuture.failedFuture(new ApiRequestException(
                    "Request failed: " + method + " " + url + " status[" + response.statusCode() + "]",
                    response.statusCode(), response.body()));
        }

        if (responseType.hasRawClass(Void.class)) {
            return CompletableFuture.completedFuture(null);
        }

        String body = response.body();
        try {
            T value = Utils.unmarshalFrom(body, responseType);
            if (value == null) {
                LOGGER.debug("{} {} returned a JSON null body, expected {}", method, url, responseType);
                return CompletableFuture.failedFuture(new ApiDecodeException(
                        "Response of " + method + " " + url + " is null, expected " + responseType, body));
            }
            return CompletableFuture.completedFuture(value);
        } catch (JsonProcessingException e) {
            LOGGER.debug("{} {} returned a body that could not be decoded as {}: {}",
                    method, url, responseType, e.getOriginalMessage());
            return CompletableFuture.failedFuture(new ApiDecodeException(
                    "Could not decode response of " + method + " " + url + " as " + responseType, body, e));
        }
    }

    private static ApiTransportException transportFailure(String method, String url, Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        LOGGER.debug("{} {} could not be sent: {}", method, url, cause.toString());
        return new ApiTransportException("Failed to send " + method + " " + url + ": " + cause, cause);
    }

    private static JavaType javaType(Class<?> type) {
        checkNotNullParam("responseType", type);
        return Utils.OBJECT_MAPPER.getTypeFactory().constructType(type);
    }

    private static JavaType javaType(TypeReference<?> type) {
        checkNotNullParam("responseType", type);
        return Utils.OBJECT_MAPPER.getTypeFactory().constructType(type);
    }
}
