package org.shoji.client.rest.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JsonResponseParserTest {

    private final JsonResponseParser parser = new JsonResponseParser();

    @Test
    @DisplayName("JSON content types are recognized, others are not")
    public void testCanHandle() {
        assertTrue(parser.canHandle("application/json"));
        assertTrue(parser.canHandle("Application/JSON; charset=utf-8"));
        assertTrue(parser.canHandle("text/json"));
        assertTrue(parser.canHandle("application/shoji+json"));
        assertFalse(parser.canHandle("text/csv"));
        assertFalse(parser.canHandle("text/html; charset=utf-8"));
        assertFalse(parser.canHandle(null));
    }

    @Test
    @DisplayName("Objects decode to ordered maps")
    public void testParseObject() throws Exception {
        Object decoded = parser.parse("{\"z\": 1, \"a\": {\"nested\": null}}");

        assertInstanceOf(Map.class, decoded);
        Map<?, ?> map = (Map<?, ?>) decoded;
        assertEquals("[z, a]", map.keySet().toString());
        assertTrue(((Map<?, ?>) map.get("a")).containsKey("nested"));
    }

    @Test
    @DisplayName("Empty and malformed bodies raise ParseException")
    public void testParseFailures() {
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse(""));
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse("{\"a\": "));
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse("not json"));
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse("{'a': 1}"));
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse("{a: 1}"));
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse("{\"a\": 1} trailing"));
        assertThrows(ResponseParser.ParseException.class, () -> parser.parse("<html>oops</html>"));
    }

    @Test
    @DisplayName("Surrounding whitespace is accepted")
    public void testParseLenientWhitespace() throws Exception {
        assertEquals(1, ((Map<?, ?>) parser.parse("  {\"a\": 1}\n")).get("a"));
    }

    @Test
    @DisplayName("Chain picks the first parser by priority that handles the type")
    public void testChain() throws Exception {
        ResponseParser csv = new ResponseParser() {
            @Override
            public boolean canHandle(String contentType) {
                return "text/csv".equals(contentType);
            }

            @Override
            public Object parse(String httpResponse) {
                return httpResponse.split(",");
            }

            @Override
            public int getPriority() {
                return 10;
            }

            @Override
            public String getName() {
                return "CsvParser";
            }
        };
        ResponseParserChain chain = ResponseParserChain.defaultChain().addParser(csv);

        assertSame(csv, chain.getParsers().get(0));
        assertSame(csv, chain.getParserForContentType("text/csv"));
        assertInstanceOf(JsonResponseParser.class, chain.getParserForContentType("application/json"));
        assertNull(chain.getParserForContentType("image/png"));
    }
}
