package io.apiclient.client.http.jdk;

import java.time.Duration;

import io.apiclient.client.http.HttpClient;
import io.apiclient.client.http.HttpClientBuilder;
import io.apiclient.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Creates transports backed by the JDK {@link java.net.http.HttpClient}.
 * <p>
 * Timeouts are transport settings: a request that exceeds them fails with
 * {@link java.net.http.HttpTimeoutException}.
 */
public class JdkHttpClientBuilder implements HttpClientBuilder {

    private java.net.http.HttpClient.Version version = java.net.http.HttpClient.Version.HTTP_1_1;
    private @Nullable Duration connectTimeout;
    private @Nullable Duration requestTimeout;

    public JdkHttpClientBuilder version(java.net.http.HttpClient.Version version) {
        Assert.checkNotNullParam("version", version);
        this.version = version;
        return this;
    }

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        Assert.checkNotNullParam("connectTimeout", connectTimeout);
        this.connectTimeout = connectTimeout;
        return this;
    }

    public JdkHttpClientBuilder requestTimeout(Duration requestTimeout) {
        Assert.checkNotNullParam("requestTimeout", requestTimeout);
        this.requestTimeout = requestTimeout;
        return this;
    }

    @Override
    public HttpClient create(String baseUrl) {
        Assert.checkNotNullParam("baseUrl", baseUrl);
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(version)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        return new JdkHttpClient(baseUrl, builder.build(), requestTimeout);
    }
}
