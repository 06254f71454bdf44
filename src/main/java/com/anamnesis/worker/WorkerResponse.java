package com.anamnesis.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(long id, JsonNode result, WorkerError error) {

    public static WorkerResponse success(long id, JsonNode result) {
        return new WorkerResponse(id, result, null);
    }

    public static WorkerResponse failure(long id, WorkerError error) {
        return new WorkerResponse(id, null, error);
    }

    public boolean failed() {
        return error != null;
    }
}
