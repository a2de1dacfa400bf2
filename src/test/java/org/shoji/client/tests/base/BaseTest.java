package org.shoji.client.tests.base;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.MappingBuilder;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.shoji.client.rest.config.SessionSettings;
import org.shoji.client.rest.service.HttpSession;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Base test class running an {@link HttpSession} against a WireMock server.
 *
 * Responses are static JSON files under src/test/resources/shoji/&lt;directory&gt;/responses.
 * Every occurrence of http://localhost:8080 in a response file is rewritten to the
 * WireMock address, so links inside documents point back at the mock server.
 *
 * Tests verify:
 * 1. The client forms the expected HTTP requests (using verify() / findAll())
 * 2. The client decodes the static responses into the expected documents
 */
public abstract class BaseTest {

    protected static final String FIXTURE_HOST = "http://localhost:8080";

    protected static WireMockServer wireMockServer;
    protected HttpSession session;

    /**
     * Returns the test resource directory name (e.g., "DocumentResolutionTest")
     */
    protected abstract String getTestResourceDirectory();

    @BeforeEach
    public void setupWireMock() {
        if (wireMockServer == null) {
            wireMockServer = new WireMockServer(
                WireMockConfiguration.wireMockConfig().dynamicPort()
            );
            wireMockServer.start();
        }
        configureFor("localhost", wireMockServer.port());
        wireMockServer.resetAll();
        session = new HttpSession(getSessionSettings());
    }

    /**
     * Override this to customize the session under test.
     */
    protected SessionSettings getSessionSettings() {
        return new SessionSettings();
    }

    /**
     * @param path Path on the mock server (e.g., "/api/datasets/")
     * @return Absolute URL on the mock server
     */
    protected String url(String path) {
        return "http://localhost:" + wireMockServer.port() + path;
    }

    /**
     * Setup a static JSON response to GET requests on an endpoint
     * @param endpoint REST endpoint (e.g., "/api/datasets/")
     * @param responseFile JSON file name in test resources (e.g., "catalog.json")
     */
    protected void setupStaticJsonResponse(String endpoint, String responseFile) throws IOException {
        setupStaticJsonResponse(get(urlEqualTo(endpoint)), 200, responseFile);
    }

    protected void setupStaticJsonResponse(MappingBuilder mapping, int status, String responseFile) throws IOException {
        wireMockServer.stubFor(mapping
            .willReturn(aResponse()
                .withStatus(status)
                .withHeader("Content-Type", "application/json")
                .withBody(loadStaticResponse(responseFile))));
    }

    /**
     * Stubs a POST that creates a resource: 201 with a Location header and no body.
     */
    protected void setupCreatedResponse(String endpoint, String location) {
        wireMockServer.stubFor(post(urlEqualTo(endpoint))
            .willReturn(aResponse()
                .withStatus(201)
                .withHeader("Location", location)));
    }

    /**
     * Load static response file from test resources
     */
    protected String loadStaticResponse(String responseFile) throws IOException {
        Path responsePath = Paths.get("src", "test", "resources", "shoji",
            getTestResourceDirectory(), "responses", responseFile);

        if (!Files.exists(responsePath)) {
            throw new IOException("Static response file not found: " + responsePath.toAbsolutePath());
        }

        return Files.readString(responsePath).replace(FIXTURE_HOST, url(""));
    }

    /**
     * GETs a document from the mock server, then clears the request journal so that
     * assertions only see requests made afterwards.
     */
    @SuppressWarnings("unchecked")
    protected <T> T loadDocument(String endpoint, String responseFile) throws IOException {
        setupStaticJsonResponse(endpoint, responseFile);
        T document = (T) session.get(url(endpoint)).getPayload();
        wireMockServer.resetRequests();
        return document;
    }

    protected int requestCount() {
        return wireMockServer.getAllServeEvents().size();
    }

    @AfterEach
    public void tearDown() throws IOException {
        if (session != null) {
            session.close();
            session = null;
        }
    }

    @AfterAll
    public static void tearDownWiremock() {
        if (wireMockServer != null) {
            wireMockServer.stop();
            wireMockServer = null;
        }
    }

    protected WireMockServer getWireMockServer() {
        return wireMockServer;
    }
}
