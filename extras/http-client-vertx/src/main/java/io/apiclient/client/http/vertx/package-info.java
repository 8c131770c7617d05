/**
 * Vert.x backed implementation of the {@link io.apiclient.client.http.HttpClient} transport.
 */
@NullMarked
package io.apiclient.client.http.vertx;

import org.jspecify.annotations.NullMarked;
