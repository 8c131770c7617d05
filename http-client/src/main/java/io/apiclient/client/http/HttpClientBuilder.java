package io.apiclient.client.http;

import io.apiclient.client.http.jdk.JdkHttpClientBuilder;

public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    /**
     * Creates a transport for the given base URL. The URL is not validated here; an invalid
     * URL makes every request sent through the returned client fail.
     *
     * @param baseUrl the base URL all request paths are resolved against
     * @return the transport
     */
    HttpClient create(String baseUrl);
}
