package com.anamnesis.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransitionRulesTest {

    @Test
    void shouldAllowOnlyStandardSuccessors() {
        TransitionRules rules = TransitionRules.standard();

        assertTrue(rules.allows(LifecycleState.CREATED, LifecycleState.MODIFIED));
        assertTrue(rules.allows(LifecycleState.MODIFIED, LifecycleState.MODIFIED));
        assertTrue(rules.allows(LifecycleState.MODIFIED, LifecycleState.EVALUATED));
        assertTrue(rules.allows(LifecycleState.EVALUATED, LifecycleState.REMOVED));
        assertFalse(rules.allows(LifecycleState.REMOVED, LifecycleState.CREATED));
        assertFalse(rules.allows(LifecycleState.EVALUATED, LifecycleState.MODIFIED));
        assertTrue(rules.successorsOf(LifecycleState.REMOVED).isEmpty());
    }

    @Test
    void shouldReportFirstIllegalPairInTimestampOrder() {
        List<LifecycleEvent> events = List.of(
                new LifecycleEvent(LifecycleState.CREATED, 4000),
                new LifecycleEvent(LifecycleState.CREATED, 1000),
                new LifecycleEvent(LifecycleState.REMOVED, 3500),
                new LifecycleEvent(LifecycleState.MODIFIED, 2000));

        Optional<LifecycleTransition> illegal = TransitionRules.standard().firstIllegalTransition(events);

        assertEquals(Optional.of(new LifecycleTransition(LifecycleState.REMOVED, LifecycleState.CREATED)), illegal);
        assertEquals("REMOVED->CREATED", illegal.get().toString());
    }

    @Test
    void shouldAcceptEmptyAndSingleEventHistories() {
        assertTrue(TransitionRules.standard().firstIllegalTransition(List.of()).isEmpty());
        assertTrue(TransitionRules.standard()
                .firstIllegalTransition(List.of(new LifecycleEvent(LifecycleState.REMOVED, 5)))
                .isEmpty());
    }

    @Test
    void shouldRejectTableWithoutTerminalState() {
        Map<LifecycleState, Set<LifecycleState>> table = new EnumMap<>(LifecycleState.class);
        for (LifecycleState state : LifecycleState.values()) {
            table.put(state, EnumSet.allOf(LifecycleState.class));
        }

        assertThrows(IllegalArgumentException.class, () -> TransitionRules.of(table));
    }

    @Test
    void shouldRejectTableMissingAState() {
        Map<LifecycleState, Set<LifecycleState>> table = new EnumMap<>(LifecycleState.class);
        table.put(LifecycleState.CREATED, EnumSet.of(LifecycleState.REMOVED));
        table.put(LifecycleState.REMOVED, EnumSet.noneOf(LifecycleState.class));

        assertThrows(IllegalArgumentException.class, () -> TransitionRules.of(table));
    }
}
