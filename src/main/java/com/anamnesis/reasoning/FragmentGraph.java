package com.anamnesis.reasoning;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.FragmentRef;
import com.anamnesis.model.Message;

/**
 * Directed reference edges between message and artifact fragments. Closures are computed by an
 * iterative worklist over the adjacency index, so cycles terminate.
 */
public class FragmentGraph {
    private final List<ReferenceEdge> edges;
    private final Map<FragmentRef, Set<FragmentRef>> adjacency = new LinkedHashMap<>();

    public FragmentGraph(Collection<ReferenceEdge> edges) {
        this.edges = List.copyOf(new LinkedHashSet<>(edges));
        for (ReferenceEdge edge : this.edges) {
            adjacency.computeIfAbsent(edge.from(), key -> new LinkedHashSet<>()).add(edge.to());
        }
    }

    /**
     * Edges of the given conversations: message references, plus artifact to creating and modifying messages.
     */
    public static FragmentGraph of(Collection<Conversation> conversations) {
        List<ReferenceEdge> edges = new ArrayList<>();
        for (Conversation conversation : conversations) {
            for (Message message : conversation.messages()) {
                FragmentRef from = FragmentRef.message(conversation.id(), message.id());
                for (FragmentRef target : message.references()) {
                    edges.add(new ReferenceEdge(from, target));
                }
            }
            for (Artifact artifact : conversation.artifacts()) {
                FragmentRef from = FragmentRef.artifact(conversation.id(), artifact.id());
                if (artifact.createdIn() != null) {
                    edges.add(new ReferenceEdge(from, FragmentRef.message(conversation.id(), artifact.createdIn())));
                }
                for (String messageId : artifact.modifiedIn()) {
                    edges.add(new ReferenceEdge(from, FragmentRef.message(conversation.id(), messageId)));
                }
            }
        }
        return new FragmentGraph(edges);
    }

    public List<ReferenceEdge> edges() {
        return edges;
    }

    /**
     * Everything reachable from {@code start}. The start fragment is included only when a cycle leads back to it.
     */
    public Set<FragmentRef> linked(FragmentRef start) {
        Set<FragmentRef> reached = new LinkedHashSet<>();
        Deque<FragmentRef> worklist = new ArrayDeque<>(adjacency.getOrDefault(start, Set.of()));
        while (!worklist.isEmpty()) {
            FragmentRef next = worklist.removeFirst();
            if (reached.add(next)) {
                worklist.addAll(adjacency.getOrDefault(next, Set.of()));
            }
        }
        return reached;
    }

    public List<ReferenceEdge> crossConversationRefs() {
        return edges.stream().filter(ReferenceEdge::crossesConversations).toList();
    }
}
