package com.anamnesis.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public final class LifecycleHistory {
    private LifecycleHistory() {
    }

    /**
     * Events of an artifact. An explicit history wins; otherwise events are derived from the
     * timestamps of the messages that created and modified it, closed by its declared state.
     * References that do not resolve contribute no event.
     */
    public static List<LifecycleEvent> of(Artifact artifact, Conversation conversation) {
        if (!artifact.history().isEmpty()) {
            return chronological(artifact.history());
        }
        List<LifecycleEvent> events = new ArrayList<>();
        Optional<Message> origin = conversation.findMessage(artifact.createdIn());
        origin.ifPresent(message -> events.add(new LifecycleEvent(LifecycleState.CREATED, message.timestamp())));

        List<LifecycleEvent> modifications = new ArrayList<>();
        for (String messageId : artifact.modifiedIn()) {
            conversation.findMessage(messageId)
                    .ifPresent(message -> modifications.add(new LifecycleEvent(LifecycleState.MODIFIED, message.timestamp())));
        }
        events.addAll(chronological(modifications));

        if (events.isEmpty()) {
            return List.of();
        }
        LifecycleEvent last = events.get(events.size() - 1);
        if (last.state() != artifact.state()) {
            events.add(new LifecycleEvent(artifact.state(), last.timestamp()));
        }
        return List.copyOf(events);
    }

    /**
     * The state of an artifact whose export declares none: that of its last recorded event, otherwise
     * Modified when modifying messages are listed, otherwise Created.
     */
    public static LifecycleState impliedState(List<String> modifiedIn, List<LifecycleEvent> history) {
        if (history != null && !history.isEmpty()) {
            List<LifecycleEvent> ordered = chronological(history);
            return ordered.get(ordered.size() - 1).state();
        }
        return modifiedIn == null || modifiedIn.isEmpty() ? LifecycleState.CREATED : LifecycleState.MODIFIED;
    }

    /**
     * Stable sort by timestamp: events sharing a timestamp keep their recorded order.
     */
    public static List<LifecycleEvent> chronological(List<LifecycleEvent> events) {
        List<LifecycleEvent> sorted = new ArrayList<>(events);
        sorted.sort(Comparator.comparingDouble(LifecycleEvent::timestamp));
        return sorted;
    }
}
