package com.anamnesis.rdf;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import com.anamnesis.model.FragmentRef;
import com.anamnesis.model.LifecycleState;

public final class RdfVocabulary {
    public static final String BASE = "http://anamnesis.hyperpolymath.org/ns#";
    public static final String RDF = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDFS = "http://www.w3.org/2000/01/rdf-schema#";
    public static final String XSD = "http://www.w3.org/2001/XMLSchema#";

    public static final String TYPE = RDF + "type";
    public static final String LABEL = RDFS + "label";
    public static final String XSD_DATE_TIME = XSD + "dateTime";
    public static final String XSD_DOUBLE = XSD + "double";

    public static final String CONVERSATION = BASE + "Conversation";
    public static final String HUMAN_MESSAGE = BASE + "HumanMessage";
    public static final String LLM_MESSAGE = BASE + "LLMMessage";
    public static final String HUMAN = BASE + "Human";
    public static final String LLM = BASE + "LLM";
    public static final String ARTIFACT = BASE + "Artifact";
    public static final String CODE_ARTIFACT = BASE + "CodeArtifact";
    public static final String DOCUMENTATION_ARTIFACT = BASE + "DocumentationArtifact";
    public static final String CONFIGURATION_ARTIFACT = BASE + "ConfigurationArtifact";
    public static final String PROJECT = BASE + "Project";
    public static final String MEMBERSHIP = BASE + "Membership";
    public static final String UNCATEGORIZED = BASE + "Uncategorized";

    public static final String PART_OF = BASE + "partOf";
    public static final String DISCUSSES = BASE + "discusses";
    public static final String SPEAKER = BASE + "speaker";
    public static final String CONTENT = BASE + "content";
    public static final String TIMESTAMP = BASE + "timestamp";
    public static final String PLATFORM = BASE + "platform";
    public static final String MODEL_NAME = BASE + "modelName";
    public static final String PROVIDER = BASE + "provider";
    public static final String LANGUAGE = BASE + "language";
    public static final String ARTIFACT_NAME = BASE + "artifactName";
    public static final String ARTIFACT_CONTENT = BASE + "artifactContent";
    public static final String CREATED_IN = BASE + "createdIn";
    public static final String MODIFIED_IN = BASE + "modifiedIn";
    public static final String STATE = BASE + "state";
    public static final String REFERENCES = BASE + "references";
    public static final String BELONGS_TO = BASE + "belongsTo";
    public static final String HAS_MEMBERSHIP = BASE + "hasMembership";
    public static final String MEMBERSHIP_PROJECT = BASE + "project";
    public static final String MEMBERSHIP_STRENGTH = BASE + "membershipStrength";
    public static final String CONTAMINATION_RISK = BASE + "contaminationRisk";

    public static final String STATE_CREATED = BASE + "StateCreated";
    public static final String STATE_MODIFIED = BASE + "StateModified";
    public static final String STATE_REMOVED = BASE + "StateRemoved";
    public static final String STATE_EVALUATED = BASE + "StateEvaluated";

    private RdfVocabulary() {
    }

    public static String conversation(String conversationId) {
        return BASE + "conv/" + encode(conversationId);
    }

    public static String message(String conversationId, String messageId) {
        return conversation(conversationId) + "/msg/" + encode(messageId);
    }

    public static String artifact(String conversationId, String artifactId) {
        return conversation(conversationId) + "/artifact/" + encode(artifactId);
    }

    public static String fragment(FragmentRef ref) {
        return ref.kind() == FragmentRef.Kind.ARTIFACT
                ? artifact(ref.conversationId(), ref.id())
                : message(ref.conversationId(), ref.id());
    }

    public static String membership(String conversationId, String categoryId) {
        return conversation(conversationId) + "/membership/" + encode(categoryId);
    }

    public static String speaker(String name) {
        return BASE + "speaker/" + encode(name);
    }

    public static String project(String categoryId) {
        return BASE + "project/" + encode(categoryId);
    }

    public static String state(LifecycleState state) {
        return switch (state) {
            case CREATED -> STATE_CREATED;
            case MODIFIED -> STATE_MODIFIED;
            case REMOVED -> STATE_REMOVED;
            case EVALUATED -> STATE_EVALUATED;
        };
    }

    static String encode(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
