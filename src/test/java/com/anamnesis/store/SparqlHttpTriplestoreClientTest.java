package com.anamnesis.store;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SparqlHttpTriplestoreClientTest {

    private static final String TRIPLE = "<http://a> <http://b> \"c\" .\n";

    private MockWebServer server;

    @BeforeEach
    void startServer() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void stopServer() throws Exception {
        server.shutdown();
    }

    @Test
    void shouldPostInsertDataIntoNamedGraph() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        SparqlHttpTriplestoreClient client = new SparqlHttpTriplestoreClient(Duration.ofSeconds(5), "http://example.org/g");

        client.insert(endpoint(), TRIPLE);

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        String update = formField(request.getBody().readUtf8(), "update");
        assertEquals("INSERT DATA {\nGRAPH <http://example.org/g> {\n" + TRIPLE + "}\n}", update);
    }

    @Test
    void shouldInsertIntoDefaultGraphWhenNoneConfigured() {
        SparqlHttpTriplestoreClient client = new SparqlHttpTriplestoreClient(Duration.ofSeconds(5), "");

        assertEquals("INSERT DATA {\n" + TRIPLE + "}", client.insertData(TRIPLE));
        assertEquals("INSERT DATA {\n<x> <y> <z> .\n}", client.insertData("<x> <y> <z> ."));
    }

    @Test
    void shouldReturnQueryBindingsAsRows() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/sparql-results+json")
                .setBody("""
                        {"head": {"vars": ["c", "risk"]},
                         "results": {"bindings": [
                           {"c": {"type": "uri", "value": "urn:c1"}, "risk": {"type": "literal", "value": "0.5"}},
                           {"c": {"type": "uri", "value": "urn:c2"}}
                         ]}}
                        """));
        SparqlHttpTriplestoreClient client = new SparqlHttpTriplestoreClient(Duration.ofSeconds(5), null);

        List<Map<String, String>> rows = client.query(endpoint(), "SELECT ?c ?risk WHERE { ?c ?p ?risk }");

        assertEquals(List.of(Map.of("c", "urn:c1", "risk", "0.5"), Map.of("c", "urn:c2")), rows);
        RecordedRequest request = server.takeRequest();
        assertEquals("application/sparql-results+json", request.getHeader("Accept"));
        assertEquals("SELECT ?c ?risk WHERE { ?c ?p ?risk }", formField(request.getBody().readUtf8(), "query"));
    }

    @Test
    void shouldReportRejectedUpdateWithStatus() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("virtuoso says no"));
        SparqlHttpTriplestoreClient client = new SparqlHttpTriplestoreClient(Duration.ofSeconds(5), null);

        StoreException error = assertThrows(StoreException.class, () -> client.insert(endpoint(), TRIPLE));

        assertEquals(500, error.status());
        assertTrue(error.getMessage().contains("virtuoso says no"));
    }

    @Test
    void shouldWrapUnreachableEndpoint() throws Exception {
        String unreachable = endpoint();
        server.shutdown();
        SparqlHttpTriplestoreClient client = new SparqlHttpTriplestoreClient(Duration.ofSeconds(2), null);

        StoreException error = assertThrows(StoreException.class, () -> client.insert(unreachable, TRIPLE));

        assertEquals(-1, error.status());
    }

    @Test
    void shouldRejectMalformedEndpoint() {
        SparqlHttpTriplestoreClient client = new SparqlHttpTriplestoreClient(Duration.ofSeconds(2), null);

        assertThrows(StoreException.class, () -> client.query("not a url", "ASK {}"));
    }

    private String endpoint() {
        return server.url("/sparql").toString();
    }

    private static String formField(String body, String name) {
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            if (pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        throw new AssertionError("form field " + name + " missing from " + body);
    }
}
