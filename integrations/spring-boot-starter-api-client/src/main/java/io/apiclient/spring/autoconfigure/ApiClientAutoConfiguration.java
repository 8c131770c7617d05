package io.apiclient.spring.autoconfigure;

import io.apiclient.auth.AuthRepository;
import io.apiclient.auth.AuthService;
import io.apiclient.auth.RestAuthRepository;
import io.apiclient.client.http.ApiClient;
import io.apiclient.client.http.HttpClientBuilder;
import io.apiclient.client.http.jdk.JdkHttpClientBuilder;
import io.apiclient.spring.autoconfigure.properties.ApiClientProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
@ConditionalOnClass(ApiClient.class)
@EnableConfigurationProperties(ApiClientProperties.class)
@ConditionalOnProperty(prefix = "api-client", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ApiClientAutoConfiguration {

    /**
     * JDK transport using the configured timeouts. Define another {@link HttpClientBuilder} bean,
     * for instance a Vert.x one, to replace it.
     */
    @Bean
    @ConditionalOnMissingBean
    public HttpClientBuilder apiHttpClientBuilder(ApiClientProperties properties) {
        JdkHttpClientBuilder builder = new JdkHttpClientBuilder();
        if (properties.getConnectTimeout() != null) {
            builder.connectTimeout(properties.getConnectTimeout());
        }
        if (properties.getRequestTimeout() != null) {
            builder.requestTimeout(properties.getRequestTimeout());
        }
        return builder;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "api-client", name = "base-url")
    public ApiClient apiClient(ApiClientProperties properties, HttpClientBuilder httpClientBuilder) {
        ApiClient client = new ApiClient(properties.getBaseUrl(), httpClientBuilder);
        if (StringUtils.hasText(properties.getToken())) {
            return client.withToken(properties.getToken());
        }
        return client;
    }

    /**
     * The authentication endpoint is called without token, so the repository gets its own
     * untokened client on the same transport.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "api-client", name = "base-url")
    public AuthRepository authRepository(ApiClientProperties properties, HttpClientBuilder httpClientBuilder) {
        return new RestAuthRepository(new ApiClient(properties.getBaseUrl(), httpClientBuilder),
                properties.getAuth().getPath());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "api-client", name = "base-url")
    public AuthService authService(AuthRepository authRepository) {
        return new AuthService(authRepository);
    }
}
