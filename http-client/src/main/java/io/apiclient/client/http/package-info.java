/**
 * HTTP client for JSON/form REST backends.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.apiclient.client.http.ApiClient} - typed JSON/form operations, bearer token and
 *       error classification</li>
 *   <li>{@link io.apiclient.client.http.HttpClient} - pluggable transport with a fluent request builder API</li>
 *   <li>{@link io.apiclient.client.http.HttpClientBuilder} - transport factory, the JDK transport by default</li>
 *   <li>{@link io.apiclient.client.http.FormEncoder} - {@code application/x-www-form-urlencoded} encoding</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ApiClient client = new ApiClient("http://localhost:8080/", new JdkHttpClientBuilder()
 *         .connectTimeout(Duration.ofSeconds(5)));
 *
 * Item item = client.getJson("/items/42", Item.class).get();
 * Map<String, Object> deleted = client.deleteJson("/items/42",
 *         new TypeReference<Map<String, Object>>() {}, null).get();
 * }</pre>
 *
 * @see io.apiclient.spec.ApiClientException
 */
@NullMarked
package io.apiclient.client.http;

import org.jspecify.annotations.NullMarked;
