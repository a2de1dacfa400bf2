package org.shoji.client.rest;

/**
 * Transport contract the document model relies on.
 * <p>
 * Every call blocks until a response is available. Implementations throw
 * {@link org.shoji.client.exception.TransportException} on network failure or an
 * unsuccessful status; documents and tuples hold a session by reference only and
 * never close it.
 * </p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * try (HttpSession session = new HttpSession(settings)) {
 *     Catalog datasets = (Catalog) session.get("https://api.example.com/datasets/").getPayload();
 * }
 * }</pre>
 */
public interface Session {

    /**
     * Issues a GET request.
     *
     * @param url     Absolute resource URL
     * @param options Extra headers, query parameters or body
     * @return Response with status, headers and parsed payload
     */
    Response get(String url, RequestOptions options);

    /**
     * Issues a POST request.
     *
     * @param url     Absolute resource URL
     * @param options Extra headers, query parameters or body
     * @return Response with status, headers and parsed payload
     */
    Response post(String url, RequestOptions options);

    /**
     * Issues a PATCH request.
     *
     * @param url     Absolute resource URL
     * @param options Extra headers, query parameters or body
     * @return Response with status, headers and parsed payload
     */
    Response patch(String url, RequestOptions options);

    default Response get(String url) {
        return get(url, RequestOptions.none());
    }

    default Response post(String url) {
        return post(url, RequestOptions.none());
    }

    default Response patch(String url) {
        return patch(url, RequestOptions.none());
    }
}
