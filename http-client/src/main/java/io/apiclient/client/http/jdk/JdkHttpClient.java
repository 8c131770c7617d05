package io.apiclient.client.http.jdk;

import io.apiclient.client.http.HttpClient;
import io.apiclient.client.http.HttpResponse;
import io.apiclient.client.http.HttpUrls;
import io.apiclient.client.http.NameValuePair;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;
    private final @Nullable Duration requestTimeout;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .build(), null);
    }

    JdkHttpClient(String baseUrl, java.net.http.HttpClient httpClient, @Nullable Duration requestTimeout) {
        this.httpClient = httpClient;
        this.baseUrl = HttpUrls.normalizeBaseUrl(baseUrl);
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new JdkPutRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new JdkDeleteBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final List<NameValuePair> headers = new ArrayList<>();

        public JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.add(NameValuePair.of(name, value));
            return self();
        }

        @Override
        public T addHeaders(@Nullable List<NameValuePair> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (NameValuePair header : headers) {
                    addHeader(header.name(), header.value());
                }
            }
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(HttpUrls.join(baseUrl, path)));
            if (requestTimeout != null) {
                builder.timeout(requestTimeout);
            }
            for (NameValuePair header : headers) {
                builder.header(header.name(), header.value());
            }
            return builder;
        }

        protected abstract HttpRequest buildRequest(HttpRequest.Builder builder);

        @Override
        public CompletableFuture<HttpResponse> send() {
            final HttpRequest request;
            try {
                request = buildRequest(createRequestBuilder());
            } catch (IllegalArgumentException e) {
                // invalid URI or restricted header name
                return CompletableFuture.failedFuture(e);
            }
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenApply(JdkHttpResponse::new);
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        public JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        protected HttpRequest buildRequest(HttpRequest.Builder builder) {
            return builder.GET().build();
        }
    }

    private class JdkDeleteBuilder extends JdkRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        public JdkDeleteBuilder(String path) {
            super(path);
        }

        @Override
        protected HttpRequest buildRequest(HttpRequest.Builder builder) {
            return builder.DELETE().build();
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        String body = "";

        public JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(String body) {
            this.body = body;
            return this;
        }

        @Override
        protected HttpRequest buildRequest(HttpRequest.Builder builder) {
            return builder.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build();
        }
    }

    private class JdkPutRequestBuilder extends JdkRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {
        String body = "";

        public JdkPutRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PutRequestBuilder body(String body) {
            this.body = body;
            return this;
        }

        @Override
        protected HttpRequest buildRequest(HttpRequest.Builder builder) {
            return builder.PUT(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)).build();
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<String> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public String body() {
            String body = response.body();
            return body == null ? "" : body;
        }
    }
}
