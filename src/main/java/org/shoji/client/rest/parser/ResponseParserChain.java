package org.shoji.client.rest.parser;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the appropriate ResponseParser based on content type.
 *
 * <p>Parsers are checked in priority order (lower priority values first).
 * The first parser that can handle the content type is used.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ResponseParserChain chain = new ResponseParserChain()
 *         .addParser(new JsonResponseParser());
 *
 * ResponseParser parser = chain.getParserForContentType(contentType);
 * Object decoded = parser.parse(httpResponse);
 * }</pre>
 */
public class ResponseParserChain {

    private final List<ResponseParser> parsers = new ArrayList<>();

    /**
     * @return Chain holding the parsers a session uses out of the box
     */
    public static ResponseParserChain defaultChain() {
        return new ResponseParserChain().addParser(new JsonResponseParser());
    }

    /**
     * Adds a parser to the chain.
     * Parsers are automatically sorted by priority after adding.
     *
     * @param parser Parser to add
     * @return This chain instance for method chaining
     */
    public ResponseParserChain addParser(ResponseParser parser) {
        parsers.add(parser);
        parsers.sort(Comparator.comparingInt(ResponseParser::getPriority));
        return this;
    }

    /**
     * Gets the parser that would handle the given content type.
     *
     * @param contentType HTTP Content-Type header value
     * @return The parser that can handle this content type, or null if none found
     */
    public ResponseParser getParserForContentType(String contentType) {
        return parsers.stream()
                .filter(p -> p.canHandle(contentType))
                .findFirst()
                .orElse(null);
    }

    /**
     * Returns all registered parsers in priority order.
     *
     * @return Copy of the parser list
     */
    public List<ResponseParser> getParsers() {
        return new ArrayList<>(parsers);
    }
}
