package org.shoji.client.exception;

/**
 * Thrown when a response payload could not be parsed into a document.
 */
public class DocumentParseException extends ShojiException {

    /** HTTP status of the response that could not be parsed, or -1 when unknown. */
    private final int status;

    public DocumentParseException(String message, int status) {
        super(message);
        this.status = status;
    }

    public DocumentParseException(String message) {
        this(message, -1);
    }

    public int getStatus() {
        return status;
    }
}
