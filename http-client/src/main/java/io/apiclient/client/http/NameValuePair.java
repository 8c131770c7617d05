package io.apiclient.client.http;

import io.apiclient.util.Assert;

/**
 * An ordered name/value pair, used both for request headers and for form fields.
 *
 * @param name the header or field name
 * @param value the header or field value
 */
public record NameValuePair(String name, String value) {

    public NameValuePair {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("value", value);
    }

    public static NameValuePair of(String name, String value) {
        return new NameValuePair(name, value);
    }
}
