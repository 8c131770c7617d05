package io.apiclient.spring.autoconfigure.properties;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "api-client")
public class ApiClientProperties {

    /**
     * Whether to enable the API client auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Base URL of the backend. No client beans are created without it.
     */
    private String baseUrl;

    /**
     * Bearer token sent by the auto-configured ApiClient.
     */
    private String token;

    /**
     * Connect timeout of the default JDK transport.
     */
    private Duration connectTimeout;

    /**
     * Timeout of every request sent by the default JDK transport.
     */
    private Duration requestTimeout;

    private final Auth auth = new Auth();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Auth getAuth() {
        return auth;
    }

    public static class Auth {

        /**
         * Path of the client-credentials endpoint, relative to the base URL.
         */
        private String path = "/oauth/token";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
