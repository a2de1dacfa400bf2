package org.shoji.client.rest;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Extra call options passed through to a {@link Session}: headers, query parameters and a
 * string body.
 *
 * <p>Header names are case-insensitive, so {@code content-type} and {@code Content-Type}
 * name the same header.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * RequestOptions options = new RequestOptions()
 *         .header("Accept-Language", "en")
 *         .param("limit", "10");
 * }</pre>
 */
@Getter
public class RequestOptions {

    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, String> params = new LinkedHashMap<>();
    private String body;

    /**
     * @return Fresh, empty options
     */
    public static RequestOptions none() {
        return new RequestOptions();
    }

    /**
     * @param body Request body
     * @return Fresh options carrying only the given body
     */
    public static RequestOptions withBody(String body) {
        return new RequestOptions().body(body);
    }

    public RequestOptions header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    /**
     * Sets a header only if the caller has not already supplied one with the same name.
     *
     * @param name  Header name
     * @param value Default value
     * @return This instance for method chaining
     */
    public RequestOptions headerIfAbsent(String name, String value) {
        headers.putIfAbsent(name, value);
        return this;
    }

    public RequestOptions param(String name, String value) {
        params.put(name, value);
        return this;
    }

    public RequestOptions body(String body) {
        this.body = body;
        return this;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, String> getParams() {
        return Collections.unmodifiableMap(params);
    }

    /**
     * Returns an independent copy, so that defaults can be applied without touching the
     * caller's instance.
     *
     * @return Copy of these options
     */
    public RequestOptions copy() {
        RequestOptions copy = new RequestOptions();
        copy.headers.putAll(headers);
        copy.params.putAll(params);
        copy.body = body;
        return copy;
    }
}
