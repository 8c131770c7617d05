package io.apiclient.client.http;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Returns the full response body decoded as UTF-8.
     *
     * @return the body, empty but never null
     */
    String body();
}
