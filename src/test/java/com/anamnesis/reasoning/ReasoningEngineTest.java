package com.anamnesis.reasoning;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.anamnesis.model.Artifact;
import com.anamnesis.model.ArtifactType;
import com.anamnesis.model.Conversation;
import com.anamnesis.model.FragmentRef;
import com.anamnesis.model.LifecycleEvent;
import com.anamnesis.model.LifecycleState;
import com.anamnesis.model.LifecycleTransition;
import com.anamnesis.model.MembershipType;
import com.anamnesis.model.Message;
import com.anamnesis.model.ProjectMembership;
import com.anamnesis.model.Speaker;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReasoningEngineTest {

    private static final Speaker USER = new Speaker.Human("user");

    private final ReasoningEngine engine = new ReasoningEngine();

    @Test
    void shouldResolveStateAtTimeAndRejectResurrection() {
        List<LifecycleEvent> events = List.of(
                new LifecycleEvent(LifecycleState.CREATED, 1000),
                new LifecycleEvent(LifecycleState.MODIFIED, 2000),
                new LifecycleEvent(LifecycleState.MODIFIED, 3000));

        assertEquals(Optional.of(LifecycleState.MODIFIED), engine.currentState(events, 2500));
        assertEquals(Optional.empty(), engine.currentState(events, 999));
        assertDoesNotThrow(() -> engine.validateLifecycle(events));

        List<LifecycleEvent> resurrected = new ArrayList<>(events);
        resurrected.add(new LifecycleEvent(LifecycleState.REMOVED, 3500));
        resurrected.add(new LifecycleEvent(LifecycleState.CREATED, 4000));

        ReasoningException error = assertThrows(ReasoningException.class, () -> engine.validateLifecycle(resurrected));
        assertEquals(ReasoningException.Kind.ILLEGAL_TRANSITION, error.kind());
        assertEquals(new LifecycleTransition(LifecycleState.REMOVED, LifecycleState.CREATED), error.transition());
    }

    @Test
    void shouldNormalizeMembershipScores() {
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("A", 1.0);
        raw.put("B", 0.6);

        MembershipScores scores = engine.normalizeMembership(raw);

        assertFalse(scores.uncategorized());
        assertEquals(0.625, scores.scoreOf("A"), 1e-9);
        assertEquals(0.375, scores.scoreOf("B"), 1e-9);
        assertEquals(1.0, scores.scores().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
    }

    @Test
    void shouldMarkAllZeroScoresUncategorizedAndRejectNegatives() {
        assertTrue(engine.normalizeMembership(Map.of()).uncategorized());
        assertTrue(engine.normalizeMembership(Map.of("A", 0.0)).uncategorized());
        assertThrows(IllegalArgumentException.class, () -> engine.normalizeMembership(Map.of("A", -0.1)));
    }

    @Test
    void shouldSpreadContaminationThroughSharedArtifactsAcrossProjects() {
        Conversation x = conversation("x", "p1", List.of(new Message("x1", USER, "", 1)),
                List.of(artifact("a", "x1"), artifact("private", "x1")));
        Conversation y = conversation("y", "p2",
                List.of(new Message("y1", USER, "", 1, List.of(FragmentRef.artifact("x", "a")))),
                List.of(artifact("b", "y1")));
        Conversation z = conversation("z", "p3",
                List.of(new Message("z1", USER, "", 1, List.of(FragmentRef.artifact("y", "b")))),
                List.of());
        Conversation sameProject = conversation("w", "p1",
                List.of(new Message("w1", USER, "", 1, List.of(FragmentRef.artifact("x", "private")))),
                List.of());
        Conversation unrelated = conversation("u", "p4", List.of(new Message("u1", USER, "", 1)), List.of());

        assertTrue(engine.contaminates(x, y));
        assertFalse(engine.contaminates(x, z));
        assertFalse(engine.contaminates(x, sameProject));

        Set<Conversation> spread = engine.contaminationSpread(x, List.of(x, y, z, sameProject, unrelated));

        assertEquals(Set.of(y, z), spread);
    }

    @Test
    void shouldReachSameProjectConversationThroughForeignOne() {
        Conversation x = conversation("x", "p1", List.of(new Message("x1", USER, "", 1)), List.of(artifact("a", "x1")));
        Conversation y = conversation("y", "p2",
                List.of(new Message("y1", USER, "", 1, List.of(FragmentRef.artifact("x", "a")))), List.of());
        Conversation sibling = conversation("w", "p1",
                List.of(new Message("w1", USER, "", 1, List.of(FragmentRef.artifact("x", "a")))), List.of());

        assertFalse(engine.contaminates(x, sibling));
        assertTrue(engine.contaminates(y, sibling));
        assertEquals(Set.of(y, sibling), engine.contaminationSpread(x, List.of(y, sibling)));
    }

    @Test
    void shouldScoreContaminationRiskAsShareOfForeignCategories() {
        Conversation conversation = new Conversation("c", null, 0, List.of(), List.of(), Map.of(), List.of(
                new ProjectMembership("main", MembershipType.PRIMARY),
                new ProjectMembership("side", MembershipType.SECONDARY),
                new ProjectMembership("far", MembershipType.TANGENTIAL)));

        assertEquals(2.0 / 3.0, engine.contaminationRisk(conversation), 1e-9);
        assertEquals(0.0, engine.contaminationRisk(new Conversation("d", null, 0, null, null, null, null)));
    }

    @Test
    void shouldReasonOverWholeConversation() throws Exception {
        Conversation conversation = new Conversation("c", null, 0,
                List.of(new Message("m1", USER, "", 10), new Message("m2", USER, "", 20,
                        List.of(FragmentRef.message("other", "o1")))),
                List.of(new Artifact("a1", null, ArtifactType.code("c"), "", "m1", List.of("m2"), LifecycleState.EVALUATED, List.of())),
                Map.of(),
                List.of(new ProjectMembership("main", MembershipType.PRIMARY), new ProjectMembership("side", MembershipType.SECONDARY)));

        Inferences inferences = engine.reason(conversation);

        assertEquals("c", inferences.conversationId());
        assertEquals(Map.of("a1", LifecycleState.EVALUATED), inferences.artifactStates());
        assertEquals(0.625, inferences.membership().scoreOf("main"), 1e-9);
        assertEquals(0.5, inferences.contaminationRisk(), 1e-9);
        assertEquals(1, inferences.crossConversationRefs().size());
    }

    @Test
    void shouldFailFastOnIllegalArtifactHistory() {
        Conversation conversation = new Conversation("c", null, 0,
                List.of(new Message("m1", USER, "", 10)),
                List.of(new Artifact("a1", null, null, "", "m1", List.of(), LifecycleState.CREATED, List.of(
                        new LifecycleEvent(LifecycleState.CREATED, 1),
                        new LifecycleEvent(LifecycleState.EVALUATED, 2)))),
                Map.of(), List.of());

        ReasoningException error = assertThrows(ReasoningException.class, () -> engine.reason(conversation));

        assertEquals(new LifecycleTransition(LifecycleState.CREATED, LifecycleState.EVALUATED), error.transition());
    }

    @Test
    void shouldBuildEngineFromConfiguredTable() throws Exception {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("created", List.of("evaluated", "removed"));
        table.put("modified", List.of());
        table.put("evaluated", List.of("removed"));
        table.put("removed", List.of());

        ReasoningEngine configured = ReasoningEngine.fromConfig(table);

        assertDoesNotThrow(() -> configured.validateLifecycle(List.of(
                new LifecycleEvent(LifecycleState.CREATED, 1),
                new LifecycleEvent(LifecycleState.EVALUATED, 2))));
        assertThrows(ReasoningException.class, () -> configured.validateLifecycle(List.of(
                new LifecycleEvent(LifecycleState.CREATED, 1),
                new LifecycleEvent(LifecycleState.MODIFIED, 2))));
    }

    @Test
    void shouldRejectMalformedRuleSet() {
        ReasoningException unknownState = assertThrows(ReasoningException.class,
                () -> ReasoningEngine.fromConfig(Map.of("created", List.of("archived"))));
        ReasoningException incomplete = assertThrows(ReasoningException.class,
                () -> ReasoningEngine.fromConfig(Map.of("created", List.of("removed"))));

        assertEquals(ReasoningException.Kind.MALFORMED_RULE_SET, unknownState.kind());
        assertEquals(ReasoningException.Kind.MALFORMED_RULE_SET, incomplete.kind());
    }

    private static Conversation conversation(String id, String project, List<Message> messages, List<Artifact> artifacts) {
        return new Conversation(id, null, 0, messages, artifacts, Map.of(),
                List.of(new ProjectMembership(project, MembershipType.PRIMARY)));
    }

    private static Artifact artifact(String id, String createdIn) {
        return new Artifact(id, null, ArtifactType.code("java"), "", createdIn, List.of(), LifecycleState.CREATED, List.of());
    }
}
