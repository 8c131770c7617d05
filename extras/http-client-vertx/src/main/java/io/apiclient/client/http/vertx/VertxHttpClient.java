package io.apiclient.client.http.vertx;

import io.apiclient.client.http.HttpClient;
import io.apiclient.client.http.HttpResponse;
import io.apiclient.client.http.HttpUrls;
import io.apiclient.client.http.NameValuePair;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

public class VertxHttpClient implements HttpClient {

    private final io.vertx.core.http.HttpClient client;
    private final String baseUrl;

    VertxHttpClient(String baseUrl, Vertx vertx, HttpClientOptions options) {
        this.baseUrl = HttpUrls.normalizeBaseUrl(baseUrl);
        this.client = vertx.createHttpClient(options);
    }

    @Override
    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new VertxGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new VertxPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new VertxPutRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new VertxDeleteRequestBuilder(path);
    }

    private abstract class VertxRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        private final HttpMethod method;
        protected final List<NameValuePair> headers = new ArrayList<>();

        public VertxRequestBuilder(String path, HttpMethod method) {
            this.path = path;
            this.method = method;
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

        protected @Nullable String body() {
            return null;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            final RequestOptions options;
            try {
                // absolute URI also decides between plain and TLS connections
                options = new RequestOptions()
                        .setMethod(method)
                        .setAbsoluteURI(HttpUrls.join(baseUrl, path));
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }

            String body = body();
            return client.request(options)
                    .compose(request -> {
                        for (NameValuePair header : headers) {
                            request.headers().add(header.name(), header.value());
                        }
                        return body != null ? request.send(body) : request.send();
                    })
                    .compose(VertxHttpClient::readResponse)
                    .toCompletionStage()
                    .toCompletableFuture();
        }
    }

    private static Future<HttpResponse> readResponse(HttpClientResponse response) {
        int statusCode = response.statusCode();
        return response.body()
                .map(buffer -> new VertxHttpResponse(statusCode, buffer.toString(StandardCharsets.UTF_8)));
    }

    private class VertxGetRequestBuilder extends VertxRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        public VertxGetRequestBuilder(String path) {
            super(path, HttpMethod.GET);
        }
    }

    private class VertxDeleteRequestBuilder extends VertxRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        public VertxDeleteRequestBuilder(String path) {
            super(path, HttpMethod.DELETE);
        }
    }

    private class VertxPostRequestBuilder extends VertxRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        String body = "";

        public VertxPostRequestBuilder(String path) {
            super(path, HttpMethod.POST);
        }

        @Override
        public PostRequestBuilder body(String body) {
            this.body = body;
            return this;
        }

        @Override
        protected String body() {
            return body;
        }
    }

    private class VertxPutRequestBuilder extends VertxRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {
        String body = "";

        public VertxPutRequestBuilder(String path) {
            super(path, HttpMethod.PUT);
        }

        @Override
        public PutRequestBuilder body(String body) {
            this.body = body;
            return this;
        }

        @Override
        protected String body() {
            return body;
        }
    }

    private record VertxHttpResponse(int statusCode, String body) implements HttpResponse {
    }
}
