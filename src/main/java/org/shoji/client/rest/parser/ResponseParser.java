package org.shoji.client.rest.parser;

/**
 * Interface for decoding HTTP response bodies of a given content type.
 *
 * <p>Implementations turn the raw body into a decoded JSON value (maps, lists and scalars);
 * wrapping Shoji objects into documents happens afterwards.</p>
 *
 * <p>Use {@link ResponseParserChain} to select the parser for a response.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ResponseParser parser = new JsonResponseParser();
 * if (parser.canHandle("application/json")) {
 *     Object decoded = parser.parse(httpResponse);
 * }
 * }</pre>
 */
public interface ResponseParser {

    /**
     * Checks if this parser can handle the given content type.
     *
     * @param contentType HTTP Content-Type header value (e.g., "application/json"); may be null
     * @return true if this parser supports the format
     */
    boolean canHandle(String contentType);

    /**
     * Decodes a response body.
     *
     * @param httpResponse raw HTTP response body as string
     * @return decoded value
     * @throws ParseException if the body is malformed
     */
    Object parse(String httpResponse) throws ParseException;

    /**
     * Returns parser priority for chain ordering.
     * Lower values are checked first.
     *
     * @return priority value (default: 50)
     */
    default int getPriority() {
        return 50;
    }

    /**
     * Returns a human-readable name for this parser.
     * Used for logging and debugging.
     *
     * @return parser name (e.g., "JsonResponseParser")
     */
    String getName();

    /**
     * Exception thrown when response parsing fails.
     */
    class ParseException extends Exception {
        public ParseException(String message) {
            super(message);
        }

        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
