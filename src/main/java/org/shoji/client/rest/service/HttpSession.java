package org.shoji.client.rest.service;

import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.Method;
import org.shoji.client.exception.TransportException;
import org.shoji.client.model.Documents;
import org.shoji.client.rest.RequestOptions;
import org.shoji.client.rest.Response;
import org.shoji.client.rest.Session;
import org.shoji.client.rest.config.ClientConfiguration;
import org.shoji.client.rest.config.SessionSettings;
import org.shoji.client.rest.parser.ResponseParser;
import org.shoji.client.rest.parser.ResponseParserChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/**
 * {@link Session} over Apache HttpClient 5.
 *
 * <p>Response bodies are decoded by the {@link ResponseParserChain}; JSON objects tagged as
 * Shoji documents come back as {@link org.shoji.client.model.Document}s bound to this session.
 * A body that is empty, of an unsupported content type, or malformed yields an unparsed
 * {@link Response}.</p>
 *
 * <p>The session owns its HttpClient; documents only borrow the session. Close it when done.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * try (HttpSession session = HttpSession.fromConfiguration(new SystemPropertyConfiguration())) {
 *     Catalog datasets = (Catalog) session.get("https://api.example.com/datasets/").getPayload();
 *     Map<Object, AttributeTuple> byName = datasets.by("name");
 * }
 * }</pre>
 */
public class HttpSession implements Session, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpSession.class);

    private final CloseableHttpClient httpClient;
    private final HttpRequestBuilder requestBuilder;
    private final HttpRequestExecutor requestExecutor;
    private final ResponseParserChain parserChain;

    public HttpSession() {
        this(new SessionSettings());
    }

    public HttpSession(SessionSettings settings) {
        this(settings, ResponseParserChain.defaultChain());
    }

    public HttpSession(SessionSettings settings, ResponseParserChain parserChain) {
        this.httpClient = HttpClientBuilder.create().build();
        this.requestBuilder = new HttpRequestBuilder(settings);
        this.requestExecutor = new HttpRequestExecutor(httpClient);
        this.parserChain = parserChain;
    }

    public static HttpSession fromConfiguration(ClientConfiguration configuration) {
        return new HttpSession(SessionSettings.fromConfiguration(configuration));
    }

    @Override
    public Response get(String url, RequestOptions options) {
        return execute(Method.GET, url, options);
    }

    @Override
    public Response post(String url, RequestOptions options) {
        return execute(Method.POST, url, options);
    }

    @Override
    public Response patch(String url, RequestOptions options) {
        return execute(Method.PATCH, url, options);
    }

    private Response execute(Method method, String url, RequestOptions options) {
        HttpUriRequestBase request = requestBuilder.buildRequest(method, url, options);
        HttpResult result;
        try {
            result = requestExecutor.executeRequest(request);
        } catch (IOException e) {
            throw new TransportException(method + " " + url + " failed: " + e.getMessage(), e);
        }
        return toResponse(url, result);
    }

    /**
     * Decodes the body of a successful exchange.
     *
     * @param url Request URL, for logging
     * @param result Raw HTTP result
     * @return Parsed or unparsed response
     */
    Response toResponse(String url, HttpResult result) {
        if (StringUtils.isBlank(result.getBody())) {
            return Response.unparsed(result.getStatus(), result.getHeaders());
        }

        ResponseParser parser = parserChain.getParserForContentType(result.getContentType());
        if (parser == null) {
            logger.debug("No parser for content type {} from {}", result.getContentType(), url);
            return Response.unparsed(result.getStatus(), result.getHeaders());
        }

        try {
            Object decoded = parser.parse(result.getBody());
            return Response.parsed(result.getStatus(), result.getHeaders(), Documents.wrap(this, decoded));
        } catch (ResponseParser.ParseException e) {
            logger.warn("{} could not parse response from {}: {}", parser.getName(), url, e.getMessage());
            return Response.unparsed(result.getStatus(), result.getHeaders());
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
