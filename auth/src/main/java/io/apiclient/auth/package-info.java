/**
 * Client-credentials authentication.
 * <p>
 * {@link io.apiclient.auth.AuthService} is the call surface, {@link io.apiclient.auth.AuthRepository}
 * the seam that tests replace, and {@link io.apiclient.auth.RestAuthRepository} the implementation
 * talking to the backend through an {@link io.apiclient.client.http.ApiClient}.
 */
@NullMarked
package io.apiclient.auth;

import org.jspecify.annotations.NullMarked;
