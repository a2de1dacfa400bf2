package org.shoji.client.tests;

import org.shoji.client.exception.DocumentParseException;
import org.shoji.client.model.AttributeTuple;
import org.shoji.client.model.Catalog;
import org.shoji.client.model.Entity;
import org.shoji.client.rest.RequestOptions;
import org.shoji.client.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tuples of a catalog index: attribute access, copies and fetching the described resource.
 */
public class AttributeTupleTest extends BaseTest {

    @Override
    protected String getTestResourceDirectory() {
        return "AttributeTupleTest";
    }

    @Test
    @DisplayName("Index entries become tuples bound to their URL")
    public void testIndexTuples() throws Exception {
        Catalog variables = loadDocument("/api/variables/", "variables-catalog.json");

        AttributeTuple age = variables.getTuple(url("/api/variables/age/"));

        assertNotNull(age);
        assertEquals(url("/api/variables/age/"), age.getEntityUrl());
        assertSame(session, age.getSession());
        assertEquals("Age", age.get("name"));
        assertFalse(age.containsKey("entityUrl"));
        assertEquals(2, variables.getIndex().size());
        assertEquals(0, requestCount(), "Tuples are never fetched eagerly");
    }

    @Test
    @DisplayName("Absent key is distinguishable from a key holding null")
    public void testAbsentVersusNull() throws Exception {
        Catalog variables = loadDocument("/api/variables/", "variables-catalog.json");
        AttributeTuple age = variables.getTuple(url("/api/variables/age/"));

        assertTrue(age.containsKey("alias"));
        assertNull(age.get("alias"));
        assertFalse(age.containsKey("description"));
    }

    @Test
    @DisplayName("copy() is independent of the original")
    public void testCopyIndependence() throws Exception {
        Catalog variables = loadDocument("/api/variables/", "variables-catalog.json");
        AttributeTuple income = variables.getTuple(url("/api/variables/income/"));

        AttributeTuple copy = income.copy();
        copy.put("x", 1);
        copy.remove("alias");

        assertFalse(income.containsKey("x"));
        assertEquals("inc", income.get("alias"));
        assertEquals(income.getEntityUrl(), copy.getEntityUrl());
        assertSame(income.getSession(), copy.getSession());
    }

    @Test
    @DisplayName("fetch() GETs the tuple URL and returns the entity")
    public void testFetch() throws Exception {
        Catalog variables = loadDocument("/api/variables/", "variables-catalog.json");
        setupStaticJsonResponse("/api/variables/age/", "age-entity.json");

        Object fetched = variables.getTuple(url("/api/variables/age/")).fetch();

        assertInstanceOf(Entity.class, fetched);
        assertEquals("Age in years", ((Entity) fetched).getBody().get("description"));
        getWireMockServer().verify(exactly(1), getRequestedFor(urlEqualTo("/api/variables/age/")));
    }

    @Test
    @DisplayName("fetch() passes extra options through")
    public void testFetchWithOptions() throws Exception {
        Catalog variables = loadDocument("/api/variables/", "variables-catalog.json");
        setupStaticJsonResponse(get(urlPathEqualTo("/api/variables/age/")), 200, "age-entity.json");

        variables.getTuple(url("/api/variables/age/"))
            .fetch(new RequestOptions().param("depth", "2").header("X-Request-Id", "abc"));

        getWireMockServer().verify(getRequestedFor(urlEqualTo("/api/variables/age/?depth=2"))
            .withHeader("X-Request-Id", equalTo("abc")));
    }

    @Test
    @DisplayName("fetch() of an unparseable response throws DocumentParseException")
    public void testFetchUnparseable() throws Exception {
        Catalog variables = loadDocument("/api/variables/", "variables-catalog.json");
        getWireMockServer().stubFor(get(urlEqualTo("/api/variables/income/"))
            .willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/html")
                .withBody("<html>maintenance</html>")));

        AttributeTuple income = variables.getTuple(url("/api/variables/income/"));

        DocumentParseException e = assertThrows(DocumentParseException.class, income::fetch);
        assertEquals(200, e.getStatus());
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "{'a': 1}", "{\"a\": 1} trailing", "<html>oops</html>"})
    @DisplayName("fetch() of malformed JSON throws DocumentParseException")
    public void testFetchMalformedJson(String body) throws Exception {
        Catalog variables = loadDocument("/api/variables/", "variables-catalog.json");
        getWireMockServer().stubFor(get(urlEqualTo("/api/variables/age/"))
            .willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody(body)));

        AttributeTuple age = variables.getTuple(url("/api/variables/age/"));

        assertThrows(DocumentParseException.class, age::fetch);
    }
}
