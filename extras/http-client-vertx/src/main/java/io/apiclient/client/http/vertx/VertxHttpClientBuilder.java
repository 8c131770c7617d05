package io.apiclient.client.http.vertx;

import io.apiclient.client.http.HttpClient;
import io.apiclient.client.http.HttpClientBuilder;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;

import org.jspecify.annotations.Nullable;

import static io.apiclient.util.Assert.checkNotNullParam;

/**
 * Creates {@link HttpClient} transports on top of a Vert.x HTTP client.
 * <p>
 * When no {@link Vertx} instance is supplied a new one is created for every transport, and it is
 * never closed. Applications that already run Vert.x should pass their own instance.
 */
public class VertxHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxHttpClientBuilder vertx(Vertx vertx) {
        this.vertx = checkNotNullParam("vertx", vertx);
        return this;
    }

    public VertxHttpClientBuilder options(HttpClientOptions options) {
        this.options = checkNotNullParam("options", options);
        return this;
    }

    @Override
    public HttpClient create(String baseUrl) {
        checkNotNullParam("baseUrl", baseUrl);
        return new VertxHttpClient(baseUrl,
                vertx != null ? vertx : Vertx.vertx(),
                options != null ? new HttpClientOptions(options) : new HttpClientOptions());
    }
}
