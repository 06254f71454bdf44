package com.anamnesis.store;

import java.util.List;
import java.util.Map;

public interface TriplestoreClient {
    void insert(String endpoint, String ntriples) throws StoreException;

    /**
     * Runs a SELECT query and returns one map per solution, variable name to bound value.
     */
    List<Map<String, String>> query(String endpoint, String sparql) throws StoreException;
}
