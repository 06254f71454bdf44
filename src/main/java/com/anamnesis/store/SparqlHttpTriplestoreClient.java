package com.anamnesis.store;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * SPARQL 1.1 protocol over HTTP: updates and queries are POSTed as form fields.
 */
public class SparqlHttpTriplestoreClient implements TriplestoreClient {
    private static final Logger log = LoggerFactory.getLogger(SparqlHttpTriplestoreClient.class);
    private static final String RESULTS_JSON = "application/sparql-results+json";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String graph;

    public SparqlHttpTriplestoreClient(Duration timeout, String graph) {
        this(new OkHttpClient.Builder().callTimeout(timeout).build(), graph);
    }

    public SparqlHttpTriplestoreClient(OkHttpClient httpClient, String graph) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.graph = graph == null || graph.isBlank() ? null : graph;
    }

    @Override
    public void insert(String endpoint, String ntriples) throws StoreException {
        Request request = post(endpoint, new FormBody.Builder().add("update", insertData(ntriples)).build(), null);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new StoreException("insert rejected by " + endpoint + ": HTTP " + response.code()
                        + " " + bodyOf(response), response.code());
            }
        } catch (IOException e) {
            throw new StoreException("insert to " + endpoint + " failed: " + e.getMessage(), e);
        }
        log.info("store.insert endpoint={} graph={} bytes={}", endpoint, graph == null ? "default" : graph, ntriples.length());
    }

    @Override
    public List<Map<String, String>> query(String endpoint, String sparql) throws StoreException {
        Request request = post(endpoint, new FormBody.Builder().add("query", sparql).build(), RESULTS_JSON);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new StoreException("query rejected by " + endpoint + ": HTTP " + response.code()
                        + " " + bodyOf(response), response.code());
            }
            return bindings(mapper.readTree(response.body().string()));
        } catch (IOException e) {
            throw new StoreException("query against " + endpoint + " failed: " + e.getMessage(), e);
        }
    }

    private static Request post(String endpoint, FormBody form, String accept) throws StoreException {
        try {
            Request.Builder builder = new Request.Builder().url(endpoint).post(form);
            if (accept != null) {
                builder.header("Accept", accept);
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new StoreException("invalid store endpoint " + endpoint, e);
        }
    }

    String insertData(String ntriples) {
        StringBuilder update = new StringBuilder("INSERT DATA {\n");
        if (graph != null) {
            update.append("GRAPH <").append(graph).append("> {\n");
        }
        update.append(ntriples);
        if (!ntriples.isEmpty() && !ntriples.endsWith("\n")) {
            update.append('\n');
        }
        if (graph != null) {
            update.append("}\n");
        }
        return update.append('}').toString();
    }

    private static List<Map<String, String>> bindings(JsonNode root) throws StoreException {
        JsonNode solutions = root.path("results").path("bindings");
        if (!solutions.isArray()) {
            throw new StoreException("query response has no results.bindings array", 200);
        }
        List<Map<String, String>> rows = new ArrayList<>();
        for (JsonNode solution : solutions) {
            Map<String, String> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = solution.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                row.put(field.getKey(), field.getValue().path("value").asText());
            }
            rows.add(row);
        }
        return rows;
    }

    private static String bodyOf(Response response) throws IOException {
        if (response.body() == null) {
            return "";
        }
        String body = response.body().string();
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
