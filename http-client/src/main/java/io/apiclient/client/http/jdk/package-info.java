@NullMarked
package io.apiclient.client.http.jdk;

import org.jspecify.annotations.NullMarked;
