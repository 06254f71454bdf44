package com.anamnesis.rdf;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.FragmentRef;
import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.Message;
import com.anamnesis.model.Speaker;
import com.anamnesis.reasoning.Inferences;

/**
 * Maps a conversation and its inferences onto triples. Output order follows the conversation's own
 * order, so the same input always yields the same triples.
 */
public class RdfGenerator {

    public List<Triple> generate(Conversation conversation, Inferences inferences) throws RdfGenerationException {
        String conversationId = requireId(conversation.id(), "conversation id");
        if (inferences != null && inferences.conversationId() != null && !conversationId.equals(inferences.conversationId())) {
            throw new RdfGenerationException("inferences belong to conversation " + inferences.conversationId()
                    + ", not " + conversationId);
        }
        Inferences effective = inferences == null ? Inferences.empty(conversationId) : inferences;

        List<Triple> triples = new ArrayList<>();
        String conv = RdfVocabulary.conversation(conversationId);
        triples.add(new Triple(conv, RdfVocabulary.TYPE, RdfVocabulary.CONVERSATION));
        triples.add(new Triple(conv, RdfVocabulary.TIMESTAMP, dateTime(conversation.timestamp())));
        if (conversation.platform() != null) {
            triples.add(new Triple(conv, RdfVocabulary.PLATFORM, NTriples.literal(conversation.platform())));
        }
        String label = conversation.metadata().getOrDefault("name", conversation.metadata().get("title"));
        if (label != null) {
            triples.add(new Triple(conv, RdfVocabulary.LABEL, NTriples.literal(label)));
        }
        triples.add(new Triple(conv, RdfVocabulary.CONTAMINATION_RISK, decimal(effective.contaminationRisk())));

        Set<String> describedSpeakers = new HashSet<>();
        for (Message message : conversation.messages()) {
            addMessage(triples, conversationId, conv, message, describedSpeakers);
        }
        for (Artifact artifact : conversation.artifacts()) {
            addArtifact(triples, conversationId, conv, artifact, effective.artifactStates());
        }
        addMembership(triples, conversationId, conv, effective);
        return triples;
    }

    public String generateNTriples(Conversation conversation, Inferences inferences) throws RdfGenerationException {
        return NTriples.serialize(generate(conversation, inferences));
    }

    private void addMessage(List<Triple> triples, String conversationId, String conv, Message message, Set<String> describedSpeakers)
            throws RdfGenerationException {
        String uri = RdfVocabulary.message(conversationId, requireId(message.id(), "message id"));
        Speaker speaker = message.speaker();
        String speakerUri;
        if (speaker instanceof Speaker.Llm llm) {
            triples.add(new Triple(uri, RdfVocabulary.TYPE, RdfVocabulary.LLM_MESSAGE));
            speakerUri = RdfVocabulary.speaker(llm.model());
            if (describedSpeakers.add(speakerUri)) {
                triples.add(new Triple(speakerUri, RdfVocabulary.TYPE, RdfVocabulary.LLM));
                triples.add(new Triple(speakerUri, RdfVocabulary.MODEL_NAME, NTriples.literal(llm.model())));
                if (llm.provider() != null) {
                    triples.add(new Triple(speakerUri, RdfVocabulary.PROVIDER, NTriples.literal(llm.provider())));
                }
            }
        } else {
            triples.add(new Triple(uri, RdfVocabulary.TYPE, RdfVocabulary.HUMAN_MESSAGE));
            speakerUri = RdfVocabulary.speaker(speaker.label());
            if (describedSpeakers.add(speakerUri)) {
                triples.add(new Triple(speakerUri, RdfVocabulary.TYPE, RdfVocabulary.HUMAN));
            }
        }
        triples.add(new Triple(uri, RdfVocabulary.SPEAKER, speakerUri));
        triples.add(new Triple(uri, RdfVocabulary.PART_OF, conv));
        if (!message.content().isEmpty()) {
            triples.add(new Triple(uri, RdfVocabulary.CONTENT, NTriples.literal(message.content())));
        }
        triples.add(new Triple(uri, RdfVocabulary.TIMESTAMP, dateTime(message.timestamp())));
        for (FragmentRef reference : message.references()) {
            triples.add(new Triple(uri, RdfVocabulary.REFERENCES, RdfVocabulary.fragment(reference)));
        }
    }

    private void addArtifact(List<Triple> triples, String conversationId, String conv, Artifact artifact,
            Map<String, LifecycleState> inferredStates) throws RdfGenerationException {
        String uri = RdfVocabulary.artifact(conversationId, requireId(artifact.id(), "artifact id"));
        if (artifact.createdIn() == null || artifact.createdIn().isBlank()) {
            throw new RdfGenerationException("artifact " + artifact.id() + " has no created_in message");
        }
        switch (artifact.type().kind()) {
            case CODE -> {
                triples.add(new Triple(uri, RdfVocabulary.TYPE, RdfVocabulary.CODE_ARTIFACT));
                triples.add(new Triple(uri, RdfVocabulary.LANGUAGE, NTriples.literal(artifact.type().qualifier())));
            }
            case DOCUMENTATION -> triples.add(new Triple(uri, RdfVocabulary.TYPE, RdfVocabulary.DOCUMENTATION_ARTIFACT));
            case CONFIGURATION -> triples.add(new Triple(uri, RdfVocabulary.TYPE, RdfVocabulary.CONFIGURATION_ARTIFACT));
            default -> triples.add(new Triple(uri, RdfVocabulary.TYPE, RdfVocabulary.ARTIFACT));
        }
        if (artifact.name() != null) {
            triples.add(new Triple(uri, RdfVocabulary.ARTIFACT_NAME, NTriples.literal(artifact.name())));
        }
        if (!artifact.content().isEmpty()) {
            triples.add(new Triple(uri, RdfVocabulary.ARTIFACT_CONTENT, NTriples.literal(artifact.content())));
        }
        triples.add(new Triple(uri, RdfVocabulary.CREATED_IN, RdfVocabulary.message(conversationId, artifact.createdIn())));
        for (String messageId : artifact.modifiedIn()) {
            triples.add(new Triple(uri, RdfVocabulary.MODIFIED_IN, RdfVocabulary.message(conversationId, messageId)));
        }
        LifecycleState state = inferredStates.getOrDefault(artifact.id(), artifact.state());
        triples.add(new Triple(uri, RdfVocabulary.STATE, RdfVocabulary.state(state)));
        triples.add(new Triple(conv, RdfVocabulary.DISCUSSES, uri));
    }

    private void addMembership(List<Triple> triples, String conversationId, String conv, Inferences inferences) {
        if (inferences.membership().uncategorized()) {
            triples.add(new Triple(conv, RdfVocabulary.BELONGS_TO, RdfVocabulary.UNCATEGORIZED));
            return;
        }
        for (Map.Entry<String, Double> score : inferences.membership().scores().entrySet()) {
            String project = RdfVocabulary.project(score.getKey());
            String membership = RdfVocabulary.membership(conversationId, score.getKey());
            triples.add(new Triple(conv, RdfVocabulary.BELONGS_TO, project));
            triples.add(new Triple(project, RdfVocabulary.TYPE, RdfVocabulary.PROJECT));
            triples.add(new Triple(conv, RdfVocabulary.HAS_MEMBERSHIP, membership));
            triples.add(new Triple(membership, RdfVocabulary.TYPE, RdfVocabulary.MEMBERSHIP));
            triples.add(new Triple(membership, RdfVocabulary.MEMBERSHIP_PROJECT, project));
            triples.add(new Triple(membership, RdfVocabulary.MEMBERSHIP_STRENGTH, decimal(score.getValue())));
        }
    }

    private static String requireId(String id, String field) throws RdfGenerationException {
        if (id == null || id.isBlank()) {
            throw new RdfGenerationException("missing required field: " + field);
        }
        return id;
    }

    private static String dateTime(double epochSeconds) throws RdfGenerationException {
        if (!Double.isFinite(epochSeconds)) {
            throw new RdfGenerationException("timestamp " + epochSeconds + " is not a finite number of seconds");
        }
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000d);
        if (nanos >= 1_000_000_000L) {
            seconds++;
            nanos = 0;
        }
        try {
            String text = DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochSecond(seconds, nanos));
            return NTriples.typedLiteral(text, RdfVocabulary.XSD_DATE_TIME);
        } catch (DateTimeException e) {
            throw new RdfGenerationException("timestamp " + epochSeconds + " is outside the representable range", e);
        }
    }

    private static String decimal(double value) {
        return NTriples.typedLiteral(Double.toString(value), RdfVocabulary.XSD_DOUBLE);
    }
}
