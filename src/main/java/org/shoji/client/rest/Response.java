package org.shoji.client.rest;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A transport response: status, headers and the parsed payload.
 * <p>
 * Header names are matched case-insensitively. The payload is either a parsed JSON value
 * (a {@link org.shoji.client.model.Document} for Shoji documents) or absent, in which case
 * {@link #isParsed()} returns false and the response acts as the "could not be parsed" sentinel.
 * </p>
 */
@Getter
public class Response {

    private final int status;
    private final Map<String, String> headers;
    private final Object payload;
    private final boolean parsed;

    private Response(int status, Map<String, String> headers, Object payload, boolean parsed) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.status = status;
        this.headers = Collections.unmodifiableMap(copy);
        this.payload = payload;
        this.parsed = parsed;
    }

    /**
     * Creates a response whose body was parsed.
     *
     * @param status  HTTP status code
     * @param headers Response headers
     * @param payload Parsed body; may be null for a JSON {@code null}
     * @return Parsed response
     */
    public static Response parsed(int status, Map<String, String> headers, Object payload) {
        return new Response(status, headers, payload, true);
    }

    /**
     * Creates a response whose body could not be parsed as a document.
     *
     * @param status  HTTP status code
     * @param headers Response headers
     * @return Unparsed response
     */
    public static Response unparsed(int status, Map<String, String> headers) {
        return new Response(status, headers, null, false);
    }

    /**
     * Looks up a header by name, ignoring case.
     *
     * @param name Header name (e.g., "Location")
     * @return Header value, or null if absent
     */
    public String getHeader(String name) {
        return headers.get(name);
    }

    @Override
    public String toString() {
        return "Response{status=" + status + ", parsed=" + parsed + "}";
    }
}
