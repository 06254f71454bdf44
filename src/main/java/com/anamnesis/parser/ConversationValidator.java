package com.anamnesis.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.LifecycleEvent;
import com.anamnesis.model.LifecycleHistory;
import com.anamnesis.model.Message;
import com.anamnesis.model.TransitionRules;

/**
 * Referential-integrity checks. Every violation is collected; nothing short-circuits.
 */
public class ConversationValidator {
    private final TransitionRules rules;

    public ConversationValidator() {
        this(TransitionRules.standard());
    }

    public ConversationValidator(TransitionRules rules) {
        this.rules = rules;
    }

    public List<ValidationError> validate(Conversation conversation) {
        List<ValidationError> errors = new ArrayList<>();
        String conversationId = conversation.id() == null ? "" : conversation.id();
        if (conversationId.isBlank()) {
            errors.add(new ValidationError(ValidationError.Code.EMPTY_CONVERSATION_ID, "conversation", "conversation id cannot be empty"));
        }
        if (conversation.timestamp() < 0) {
            errors.add(new ValidationError(ValidationError.Code.NEGATIVE_TIMESTAMP, "conversation " + conversationId,
                    "conversation timestamp cannot be negative"));
        }

        Set<String> messageIds = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (Message message : conversation.messages()) {
            if (!messageIds.add(message.id()) && reported.add(message.id())) {
                errors.add(new ValidationError(ValidationError.Code.DUPLICATE_MESSAGE_ID, "message " + message.id(),
                        "duplicate message id " + message.id()));
            }
            if (message.timestamp() < 0) {
                errors.add(new ValidationError(ValidationError.Code.NEGATIVE_TIMESTAMP, "message " + message.id(),
                        "message " + message.id() + " has negative timestamp"));
            }
        }

        for (Artifact artifact : conversation.artifacts()) {
            validateArtifact(conversation, artifact, messageIds, errors);
        }
        return errors;
    }

    private void validateArtifact(Conversation conversation, Artifact artifact, Set<String> messageIds, List<ValidationError> errors) {
        String subject = "artifact " + artifact.id();
        if (artifact.id() == null || artifact.id().isBlank()) {
            errors.add(new ValidationError(ValidationError.Code.EMPTY_ARTIFACT_ID, subject, "artifact id cannot be empty"));
        }
        if (artifact.createdIn() == null || !messageIds.contains(artifact.createdIn())) {
            errors.add(new ValidationError(ValidationError.Code.UNRESOLVED_REFERENCE, subject,
                    "created_in references unknown message " + artifact.createdIn()));
        }
        for (String messageId : artifact.modifiedIn()) {
            if (!messageIds.contains(messageId)) {
                errors.add(new ValidationError(ValidationError.Code.UNRESOLVED_REFERENCE, subject,
                        "modified_in references unknown message " + messageId));
            }
        }
        for (LifecycleEvent event : artifact.history()) {
            if (event.timestamp() < 0) {
                errors.add(new ValidationError(ValidationError.Code.NEGATIVE_TIMESTAMP, subject,
                        "lifecycle event " + event.state() + " has negative timestamp"));
            }
        }
        rules.firstIllegalTransition(LifecycleHistory.of(artifact, conversation))
                .ifPresent(transition -> errors.add(new ValidationError(ValidationError.Code.ILLEGAL_TRANSITION, subject,
                        "illegal lifecycle transition " + transition)));
    }
}
