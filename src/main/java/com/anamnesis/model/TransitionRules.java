package com.anamnesis.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Legal lifecycle transitions. Only consecutive pairs of a chronologically ordered event list are checked.
 */
public final class TransitionRules {
    private static final TransitionRules STANDARD = standardTable();

    private final Map<LifecycleState, Set<LifecycleState>> successors;

    private TransitionRules(Map<LifecycleState, Set<LifecycleState>> successors) {
        this.successors = successors;
    }

    public static TransitionRules standard() {
        return STANDARD;
    }

    /**
     * Builds a rule set from an explicit table.
     *
     * @throws IllegalArgumentException when a state is missing from the table or no state is terminal
     */
    public static TransitionRules of(Map<LifecycleState, Set<LifecycleState>> table) {
        EnumMap<LifecycleState, Set<LifecycleState>> copy = new EnumMap<>(LifecycleState.class);
        for (LifecycleState state : LifecycleState.values()) {
            Set<LifecycleState> next = table.get(state);
            if (next == null) {
                throw new IllegalArgumentException("transition table has no entry for " + state);
            }
            copy.put(state, Collections.unmodifiableSet(next.isEmpty() ? EnumSet.noneOf(LifecycleState.class) : EnumSet.copyOf(next)));
        }
        if (copy.values().stream().noneMatch(Set::isEmpty)) {
            throw new IllegalArgumentException("transition table has no terminal state");
        }
        return new TransitionRules(copy);
    }

    public boolean allows(LifecycleState from, LifecycleState to) {
        return successors.get(from).contains(to);
    }

    public Set<LifecycleState> successorsOf(LifecycleState state) {
        return successors.get(state);
    }

    public Optional<LifecycleTransition> firstIllegalTransition(List<LifecycleEvent> events) {
        List<LifecycleEvent> ordered = LifecycleHistory.chronological(events);
        for (int i = 1; i < ordered.size(); i++) {
            LifecycleState from = ordered.get(i - 1).state();
            LifecycleState to = ordered.get(i).state();
            if (!allows(from, to)) {
                return Optional.of(new LifecycleTransition(from, to));
            }
        }
        return Optional.empty();
    }

    private static TransitionRules standardTable() {
        EnumMap<LifecycleState, Set<LifecycleState>> table = new EnumMap<>(LifecycleState.class);
        for (LifecycleState state : LifecycleState.values()) {
            table.put(state, state.legalSuccessors());
        }
        return of(table);
    }
}
