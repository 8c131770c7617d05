package io.apiclient.client.http;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.StringJoiner;

import io.apiclient.util.Assert;

/**
 * Encodes fields as an {@code application/x-www-form-urlencoded} body.
 */
public final class FormEncoder {

    private FormEncoder() {
    }

    /**
     * Encodes the fields in list order as {@code name=value} pairs joined by {@code &}. Names and
     * values are percent-encoded using UTF-8, spaces become {@code +}.
     *
     * @param fields the form fields
     * @return the encoded body, empty if there are no fields
     */
    public static String encode(List<NameValuePair> fields) {
        Assert.checkNotNullParam("fields", fields);
        StringJoiner joiner = new StringJoiner("&");
        for (NameValuePair field : fields) {
            joiner.add(URLEncoder.encode(field.name(), StandardCharsets.UTF_8)
                    + "="
                    + URLEncoder.encode(field.value(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
