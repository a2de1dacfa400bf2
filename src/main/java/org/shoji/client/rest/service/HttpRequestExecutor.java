package org.shoji.client.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.shoji.client.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Executes HTTP requests and handles responses for a session.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute HTTP requests (GET, POST, PATCH)</li>
 *   <li>Log request/response details for debugging</li>
 *   <li>Validate response status codes</li>
 *   <li>Extract status, headers and body</li>
 * </ul>
 *
 * <p><b>Success criteria:</b> HTTP status codes 200-299</p>
 */
public class HttpRequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private final CloseableHttpClient httpClient;

    /**
     * @param httpClient Client to send requests with; owned by the caller
     */
    public HttpRequestExecutor(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Executes an HTTP request.
     *
     * @param request Configured HTTP request to execute
     * @return Status, headers and body of the response
     * @throws IOException If request execution fails
     * @throws TransportException If the status code is not 2xx
     */
    public HttpResult executeRequest(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return httpClient.execute(request, response -> {
            int statusCode = response.getCode();

            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }

            HttpEntity entity = response.getEntity();
            String responseBody = null;
            String contentType = null;
            if (entity != null) {
                contentType = entity.getContentType();
                try (InputStream is = entity.getContent()) {
                    responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }
                if (logger.isDebugEnabled()) {
                    logger.debug("Response Body:");
                    logger.debug("{}", responseBody);
                }
            }

            if (!isSuccessfulResponse(statusCode)) {
                logger.warn("{} {} failed with status {}: {}",
                        request.getMethod(), request.getRequestUri(), statusCode, responseBody);
                throw TransportException.unsuccessful(
                        request.getMethod(), request.getRequestUri(), statusCode, responseBody);
            }

            return new HttpResult(statusCode, collectHeaders(response), contentType, responseBody);
        });
    }

    /**
     * Checks if HTTP status code indicates success (200-299).
     *
     * @param statusCode HTTP status code
     * @return true if successful, false otherwise
     */
    private boolean isSuccessfulResponse(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private Map<String, String> collectHeaders(HttpResponse response) {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Header header : response.getHeaders()) {
            headers.putIfAbsent(header.getName(), header.getValue());
        }
        return headers;
    }

    /**
     * Logs HTTP request details for debugging.
     *
     * @param request HTTP request to log
     */
    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());
        logger.debug("Headers:");
        for (Header header : request.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }

        if (request.getEntity() != null) {
            try {
                String requestBody = EntityUtils.toString(request.getEntity(), StandardCharsets.UTF_8);
                logger.debug("Request Body:");
                logger.debug("{}", requestBody);
                // the entity stream is consumed by reading it
                request.setEntity(new StringEntity(requestBody, StandardCharsets.UTF_8));
            } catch (Exception e) {
                logger.warn("Could not log request body: {}", e.getMessage());
            }
        } else {
            logger.debug("Request Body: <none>");
        }
    }

    /**
     * Logs HTTP response details for debugging.
     *
     * @param response HTTP response
     * @param statusCode HTTP status code
     */
    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        for (Header header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
