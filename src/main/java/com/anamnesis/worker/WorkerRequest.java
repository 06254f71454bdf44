package com.anamnesis.worker;

import com.anamnesis.model.Conversation;
import com.anamnesis.parser.FormatTag;
import com.anamnesis.reasoning.Inferences;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A call payload. Each variant is bound to one {@link WorkerAction}; the wire tag is the action tag,
 * so an envelope naming any other action fails to decode.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "action")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WorkerRequest.Ping.class, name = "ping"),
        @JsonSubTypes.Type(value = WorkerRequest.DetectFormat.class, name = "detect_format"),
        @JsonSubTypes.Type(value = WorkerRequest.Parse.class, name = "parse"),
        @JsonSubTypes.Type(value = WorkerRequest.Validate.class, name = "validate"),
        @JsonSubTypes.Type(value = WorkerRequest.Reason.class, name = "reason"),
        @JsonSubTypes.Type(value = WorkerRequest.GenerateRdf.class, name = "generate_rdf")
})
public interface WorkerRequest {

    WorkerAction action();

    record Ping(String token) implements WorkerRequest {
        @Override
        public WorkerAction action() {
            return WorkerAction.PING;
        }
    }

    record DetectFormat(String content) implements WorkerRequest {
        @Override
        public WorkerAction action() {
            return WorkerAction.DETECT_FORMAT;
        }
    }

    /**
     * A null format asks the worker to detect it.
     */
    record Parse(String content, FormatTag format) implements WorkerRequest {
        @Override
        public WorkerAction action() {
            return WorkerAction.PARSE;
        }
    }

    record Validate(Conversation conversation) implements WorkerRequest {
        @Override
        public WorkerAction action() {
            return WorkerAction.VALIDATE;
        }
    }

    record Reason(Conversation conversation) implements WorkerRequest {
        @Override
        public WorkerAction action() {
            return WorkerAction.REASON;
        }
    }

    record GenerateRdf(Conversation conversation, Inferences inferences) implements WorkerRequest {
        @Override
        public WorkerAction action() {
            return WorkerAction.GENERATE_RDF;
        }
    }
}
