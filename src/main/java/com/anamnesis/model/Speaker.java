package com.anamnesis.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Speaker.Human.class, name = "human"),
        @JsonSubTypes.Type(value = Speaker.Llm.class, name = "llm")
})
public interface Speaker {

    String label();

    record Human(String name) implements Speaker {
        public Human {
            name = name == null || name.isBlank() ? "user" : name;
        }

        @Override
        public String label() {
            return name;
        }
    }

    record Llm(String model, String provider) implements Speaker {
        public Llm {
            if (model == null || model.isBlank()) {
                throw new IllegalArgumentException("LLM speaker requires a model");
            }
        }

        @Override
        public String label() {
            return provider == null ? model : provider + "/" + model;
        }
    }
}
