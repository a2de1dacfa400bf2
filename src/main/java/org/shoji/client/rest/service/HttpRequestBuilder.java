package org.shoji.client.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPatch;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.shoji.client.exception.TransportException;
import org.shoji.client.rest.RequestOptions;
import org.shoji.client.rest.config.SessionSettings;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds HTTP requests for a session.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Create HTTP GET/POST/PATCH requests</li>
 *   <li>Append query parameters to the URL</li>
 *   <li>Attach the request body as UTF-8</li>
 *   <li>Configure request timeouts</li>
 *   <li>Add default headers, then the caller's headers</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * HttpRequestBuilder builder = new HttpRequestBuilder(settings);
 * HttpUriRequestBase request = builder.buildRequest(
 *     Method.PATCH,
 *     "https://api.example.com/datasets/",
 *     RequestOptions.withBody("{}"));
 * }</pre>
 */
public class HttpRequestBuilder {

    private final SessionSettings settings;

    public HttpRequestBuilder(SessionSettings settings) {
        this.settings = settings;
    }

    /**
     * Builds an HTTP request.
     *
     * @param method HTTP method (GET, POST or PATCH)
     * @param url Absolute resource URL
     * @param options Headers, query parameters and body
     * @return Fully configured HTTP request
     * @throws TransportException If the URL is malformed
     */
    public HttpUriRequestBase buildRequest(Method method, String url, RequestOptions options) {
        URI uri = buildUri(url, options.getParams());

        HttpUriRequestBase request;
        switch (method) {
            case POST:
                request = new HttpPost(uri);
                break;
            case PATCH:
                request = new HttpPatch(uri);
                break;
            case GET:
                request = new HttpGet(uri);
                break;
            default:
                throw new IllegalArgumentException("Unsupported method: " + method);
        }

        if (options.getBody() != null) {
            request.setEntity(new StringEntity(options.getBody(), StandardCharsets.UTF_8));
        }

        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(settings.getConnectionTimeout(), TimeUnit.SECONDS)
                .setResponseTimeout(settings.getResponseTimeout(), TimeUnit.SECONDS)
                .build());

        addHeaders(request, options);

        return request;
    }

    private URI buildUri(String url, Map<String, String> params) {
        try {
            URIBuilder builder = new URIBuilder(url);
            for (Map.Entry<String, String> param : params.entrySet()) {
                builder.addParameter(param.getKey(), param.getValue());
            }
            return builder.build();
        } catch (URISyntaxException e) {
            throw new TransportException("Malformed URL: " + url, e);
        }
    }

    /**
     * Adds the session's default headers, then the caller's, which win on conflict.
     *
     * @param request HTTP request to add headers to
     * @param options Caller options
     */
    private void addHeaders(HttpUriRequestBase request, RequestOptions options) {
        if (settings.getDefaultContentType() != null) {
            request.setHeader(HttpHeaders.ACCEPT, settings.getDefaultContentType());
        }
        if (settings.getUserAgent() != null) {
            request.setHeader(HttpHeaders.USER_AGENT, settings.getUserAgent());
        }
        for (Map.Entry<String, String> header : options.getHeaders().entrySet()) {
            request.setHeader(header.getKey(), header.getValue());
        }
    }
}
