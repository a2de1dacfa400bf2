package org.shoji.client.exception;

/**
 * Base type for failures raised by the Shoji client.
 * <p>
 * All client exceptions are unchecked and surface at the call site that triggered them;
 * the client performs no retry and no partial recovery.
 * </p>
 */
public class ShojiException extends RuntimeException {

    /**
     * Constructs a new ShojiException with a message.
     *
     * @param message Human-readable error message.
     */
    public ShojiException(String message) {
        super(message);
    }

    /**
     * Constructs a new ShojiException with a message and cause.
     *
     * @param message Human-readable error message.
     * @param cause   The underlying failure.
     */
    public ShojiException(String message, Throwable cause) {
        super(message, cause);
    }
}
