package org.shoji.client.exception;

/**
 * Failure raised by a session while talking to the server: an I/O error, an unsuccessful
 * status code, or a response missing something the protocol requires.
 * <p>
 * The document model never translates these; they reach the caller unchanged.
 * </p>
 */
public class TransportException extends ShojiException {

    /** Status code of the failed response, or -1 if no response was received. */
    private final int status;
    /** Body of the failed response, or null if there was none. */
    private final String body;

    public TransportException(String message, int status) {
        this(message, status, null);
    }

    public TransportException(String message, int status, String body) {
        super(message);
        this.status = status;
        this.body = body;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.body = null;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    /**
     * Factory method for a response whose status code falls outside 200-299.
     *
     * @param method HTTP method of the request.
     * @param url    Request URL.
     * @param status Response status code.
     * @param body   Response body, or null.
     * @return A new TransportException carrying the status and body.
     */
    public static TransportException unsuccessful(String method, String url, int status, String body) {
        return new TransportException(
                method + " " + url + " failed, status code (" + status + ")", status, body);
    }
}
