package io.apiclient.client.http;

/**
 * Base URL normalization and path joining shared by the transports.
 * <p>
 * No validation happens here: a malformed base URL only fails once a transport tries to use it.
 */
public final class HttpUrls {

    private HttpUrls() {
    }

    /**
     * Strips any trailing slash from the base URL.
     *
     * @param baseUrl the base URL, possibly ending with {@code /}
     * @return the base URL without trailing slash
     */
    public static String normalizeBaseUrl(String baseUrl) {
        int end = baseUrl.length();
        while (end > 0 && baseUrl.charAt(end - 1) == '/') {
            end--;
        }
        return baseUrl.substring(0, end);
    }

    /**
     * Joins a base URL and a request path with exactly one separating slash.
     *
     * @param baseUrl the base URL, with or without trailing slash
     * @param path the request path, with or without leading slash
     * @return the joined URL
     */
    public static String join(String baseUrl, String path) {
        String base = normalizeBaseUrl(baseUrl);
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        if (start == path.length()) {
            return base;
        }
        return base + "/" + path.substring(start);
    }
}
