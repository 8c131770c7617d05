package io.apiclient.client.http;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * The HTTP transport used by {@link ApiClient}.
 * <p>
 * A transport resolves request paths against its base URL, sends the request and hands back the
 * response whatever its status code: classifying responses is left to the caller. The returned
 * future fails only when no response could be obtained (invalid URL, connection failure,
 * timeout).
 */
public interface HttpClient {

    /** HTTP Authorization header name. */
    String AUTHORIZATION = "Authorization";
    /** HTTP Content-Type header name. */
    String CONTENT_TYPE = "Content-Type";
    /** JSON content type value. */
    String APPLICATION_JSON = "application/json";
    /** Form content type value. */
    String APPLICATION_FORM_URLENCODED = "application/x-www-form-urlencoded";

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    /**
     * Returns the base URL request paths are resolved against.
     *
     * @return the base URL, without trailing slash
     */
    String getBaseUrl();

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    PutRequestBuilder put(String path);

    DeleteRequestBuilder delete(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        /**
         * Appends a header. Headers are sent in the order they were added and a name may be
         * added more than once.
         *
         * @param name the header name
         * @param value the header value
         * @return this builder for chaining
         */
        T addHeader(String name, String value);

        T addHeaders(@Nullable List<NameValuePair> headers);
    }

    interface BodyRequestBuilder<T extends BodyRequestBuilder<T>> extends RequestBuilder<T> {
        T body(String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends BodyRequestBuilder<PostRequestBuilder> {

    }

    interface PutRequestBuilder extends BodyRequestBuilder<PutRequestBuilder> {

    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {

    }
}
