package org.shoji.client.rest.service;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Raw outcome of a successful HTTP exchange, before the body is decoded.
 */
@AllArgsConstructor
@Getter
public class HttpResult {

    private final int status;
    /** Response headers, first value per name */
    private final Map<String, String> headers;
    /** Content-Type of the body, or null */
    private final String contentType;
    /** Body as UTF-8 text, or null when the response had no entity */
    private final String body;

}
