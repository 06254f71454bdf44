package com.anamnesis.reasoning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.FragmentRef;
import com.anamnesis.model.LifecycleEvent;
import com.anamnesis.model.LifecycleHistory;
import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.LifecycleTransition;
import com.anamnesis.model.Message;
import com.anamnesis.model.ProjectMembership;
import com.anamnesis.model.TransitionRules;

public class ReasoningEngine {
    private static final Logger log = LoggerFactory.getLogger(ReasoningEngine.class);

    private final TransitionRules rules;

    public ReasoningEngine() {
        this(TransitionRules.standard());
    }

    public ReasoningEngine(TransitionRules rules) {
        this.rules = rules;
    }

    /**
     * Builds an engine from a configured transition table (state label to successor labels).
     * An empty table selects the standard rules.
     */
    public static ReasoningEngine fromConfig(Map<String, List<String>> transitions) throws ReasoningException {
        if (transitions == null || transitions.isEmpty()) {
            return new ReasoningEngine();
        }
        try {
            Map<LifecycleState, Set<LifecycleState>> table = new EnumMap<>(LifecycleState.class);
            for (Map.Entry<String, List<String>> entry : transitions.entrySet()) {
                Set<LifecycleState> successors = EnumSet.noneOf(LifecycleState.class);
                for (String label : entry.getValue() == null ? List.<String>of() : entry.getValue()) {
                    successors.add(LifecycleState.valueOf(label.trim().toUpperCase(Locale.ROOT)));
                }
                table.put(LifecycleState.valueOf(entry.getKey().trim().toUpperCase(Locale.ROOT)), successors);
            }
            return new ReasoningEngine(TransitionRules.of(table));
        } catch (IllegalArgumentException e) {
            throw new ReasoningException(ReasoningException.Kind.MALFORMED_RULE_SET,
                    "malformed lifecycle rule set: " + e.getMessage(), null, e);
        }
    }

    public Optional<LifecycleState> currentState(List<LifecycleEvent> events, double atTime) {
        LifecycleState current = null;
        for (LifecycleEvent event : LifecycleHistory.chronological(events)) {
            if (event.timestamp() > atTime) {
                break;
            }
            current = event.state();
        }
        return Optional.ofNullable(current);
    }

    public void validateLifecycle(List<LifecycleEvent> events) throws ReasoningException {
        validateLifecycle(events, null);
    }

    private void validateLifecycle(List<LifecycleEvent> events, String subject) throws ReasoningException {
        Optional<LifecycleTransition> illegal = rules.firstIllegalTransition(events);
        if (illegal.isPresent()) {
            throw ReasoningException.illegalTransition(illegal.get(), subject);
        }
    }

    public MembershipScores normalizeMembership(Map<String, Double> rawScores) {
        double total = 0.0;
        for (Map.Entry<String, Double> entry : rawScores.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException("raw membership score for " + entry.getKey() + " must be >= 0");
            }
            total += entry.getValue();
        }
        if (total == 0.0) {
            return MembershipScores.uncategorizedScores();
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : rawScores.entrySet()) {
            normalized.put(entry.getKey(), entry.getValue() / total);
        }
        return new MembershipScores(normalized, false);
    }

    /**
     * Raw fuzzy score per category: the membership weight, the heavier one when a category is listed twice.
     */
    public Map<String, Double> rawScores(Conversation conversation) {
        Map<String, Double> raw = new LinkedHashMap<>();
        for (ProjectMembership membership : conversation.memberships()) {
            raw.merge(membership.categoryId(), membership.type().weight(), Math::max);
        }
        return raw;
    }

    public boolean contaminates(Conversation a, Conversation b) {
        Optional<String> primaryA = a.primaryCategory();
        Optional<String> primaryB = b.primaryCategory();
        if (primaryA.isEmpty() || primaryB.isEmpty() || primaryA.get().equals(primaryB.get())) {
            return false;
        }
        Set<FragmentRef> shared = new HashSet<>(referencedArtifacts(a));
        shared.retainAll(referencedArtifacts(b));
        return !shared.isEmpty();
    }

    /**
     * Conversations reachable from {@code seed} through {@link #contaminates}, excluding the seed.
     */
    public Set<Conversation> contaminationSpread(Conversation seed, Collection<Conversation> corpus) {
        Map<String, Conversation> byId = new LinkedHashMap<>();
        byId.put(seed.id(), seed);
        for (Conversation conversation : corpus) {
            byId.putIfAbsent(conversation.id(), conversation);
        }
        List<Conversation> all = new ArrayList<>(byId.values());
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (int i = 0; i < all.size(); i++) {
            for (int j = i + 1; j < all.size(); j++) {
                Conversation a = all.get(i);
                Conversation b = all.get(j);
                if (contaminates(a, b)) {
                    edges.computeIfAbsent(a.id(), key -> new LinkedHashSet<>()).add(b.id());
                    edges.computeIfAbsent(b.id(), key -> new LinkedHashSet<>()).add(a.id());
                }
            }
        }

        Set<String> reached = new LinkedHashSet<>();
        reached.add(seed.id());
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String id : new ArrayList<>(reached)) {
                for (String neighbour : edges.getOrDefault(id, Set.of())) {
                    changed |= reached.add(neighbour);
                }
            }
        }
        reached.remove(seed.id());

        Set<Conversation> spread = new LinkedHashSet<>();
        for (String id : reached) {
            spread.add(byId.get(id));
        }
        return spread;
    }

    public double contaminationRisk(Conversation conversation) {
        Set<String> categories = rawScores(conversation).keySet();
        if (categories.isEmpty()) {
            return 0.0;
        }
        String primary = conversation.primaryCategory().orElse(null);
        long foreign = categories.stream().filter(category -> !category.equals(primary)).count();
        return (double) foreign / categories.size();
    }

    /**
     * The reasoning stage: checks every artifact lifecycle (fail fast) and derives the inferences RDF generation consumes.
     */
    public Inferences reason(Conversation conversation) throws ReasoningException {
        Map<String, LifecycleState> states = new LinkedHashMap<>();
        for (Artifact artifact : conversation.artifacts()) {
            List<LifecycleEvent> events = LifecycleHistory.of(artifact, conversation);
            validateLifecycle(events, "artifact " + artifact.id());
            states.put(artifact.id(), currentState(events, Double.POSITIVE_INFINITY).orElse(artifact.state()));
        }
        MembershipScores membership = normalizeMembership(rawScores(conversation));
        double risk = contaminationRisk(conversation);
        List<ReferenceEdge> crossRefs = FragmentGraph.of(List.of(conversation)).crossConversationRefs();
        log.debug("reasoning.done conversation={} artifacts={} uncategorized={} risk={} crossRefs={}",
                conversation.id(), states.size(), membership.uncategorized(), risk, crossRefs.size());
        return new Inferences(conversation.id(), states, membership, risk, crossRefs);
    }

    private static Set<FragmentRef> referencedArtifacts(Conversation conversation) {
        Set<FragmentRef> artifacts = new HashSet<>();
        for (Artifact artifact : conversation.artifacts()) {
            artifacts.add(FragmentRef.artifact(conversation.id(), artifact.id()));
        }
        for (Message message : conversation.messages()) {
            for (FragmentRef reference : message.references()) {
                if (reference.kind() == FragmentRef.Kind.ARTIFACT) {
                    artifacts.add(reference);
                }
            }
        }
        return artifacts;
    }
}
