package org.shoji.client.rest.parser;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.spi.json.JsonSmartJsonProvider;
import net.minidev.json.JSONValue;
import net.minidev.json.parser.JSONParser;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Parses JSON format HTTP responses.
 *
 * <p>Handles content types:</p>
 * <ul>
 *   <li>application/json</li>
 *   <li>text/json</li>
 *   <li>any structured suffix type such as application/shoji+json</li>
 * </ul>
 *
 * <p>Objects decode to insertion-ordered maps, so members keep their wire order. Parsing
 * follows RFC 4627: unquoted or single-quoted strings and trailing data are rejected.</p>
 */
public class JsonResponseParser implements ResponseParser {

    private static final Configuration STRICT_ORDERED = Configuration.builder()
            .jsonProvider(new JsonSmartJsonProvider(JSONParser.MODE_RFC4627, JSONValue.defaultReader.DEFAULT_ORDERED))
            .build();

    @Override
    public boolean canHandle(String contentType) {
        if (contentType == null) {
            return false;
        }
        String mimeType = StringUtils.substringBefore(contentType, ";").trim().toLowerCase(Locale.ROOT);
        return mimeType.equals("application/json")
                || mimeType.equals("text/json")
                || mimeType.endsWith("+json");
    }

    @Override
    public Object parse(String httpResponse) throws ParseException {
        if (StringUtils.isBlank(httpResponse)) {
            throw new ParseException("Empty JSON response");
        }
        try {
            return JsonPath.using(STRICT_ORDERED).parse(httpResponse).json();
        } catch (InvalidJsonException e) {
            throw new ParseException("Failed to parse JSON response", e);
        }
    }

    @Override
    public int getPriority() {
        return 100;
    }

    @Override
    public String getName() {
        return "JsonResponseParser";
    }
}
