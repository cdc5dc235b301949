package com.contextbus.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PhaseTrackerTest {

    private PhaseGraph graph;
    private PhaseTracker tracker;

    @BeforeEach
    void setUp() {
        graph = new PhaseGraph(List.of(
            PhaseGraphTest.phase("foundation", 0),
            PhaseGraphTest.phase("investigation", 1, "foundation"),
            PhaseGraphTest.phase("synthesis", 2, "investigation")));
        tracker = new PhaseTracker("ses-1", graph);
    }

    @Test
    void startBeforeDependencyCompleted_isRefusedAndBlocked() {
        tracker.start("foundation");

        assertThrows(PhaseOrderViolationException.class, () -> tracker.start("investigation"));
        assertEquals(PhaseState.BLOCKED, tracker.state("investigation"));
        assertEquals(PhaseState.RUNNING, tracker.state("foundation"));
    }

    @Test
    void blockedPhase_startsOnceDependencyCompletes() {
        tracker.start("foundation");
        assertThrows(PhaseOrderViolationException.class, () -> tracker.start("investigation"));

        tracker.complete("foundation");
        tracker.start("investigation");

        assertEquals(PhaseState.RUNNING, tracker.state("investigation"));
    }

    @Test
    void completedPhase_cannotRestart() {
        tracker.start("foundation");
        tracker.complete("foundation");
        assertThrows(PhaseOrderViolationException.class, () -> tracker.start("foundation"));
    }

    @Test
    void completeRequiresRunning() {
        assertThrows(PhaseOrderViolationException.class, () -> tracker.complete("foundation"));
    }

    @Test
    void failedPhase_blocksDependents() {
        tracker.start("foundation");
        tracker.fail("foundation", "minimum evidence unmet");

        assertEquals(PhaseState.FAILED, tracker.state("foundation"));
        assertThrows(PhaseOrderViolationException.class, () -> tracker.start("investigation"));
    }

    @Test
    @DisplayName("Random start attempts never run a phase before its dependencies completed")
    void noPhaseRunsBeforeItsDependencies() {
        Random random = new Random(42);
        List<Phase> phases = graph.executionOrder();
        for (int round = 0; round < 50; round++) {
            PhaseTracker fresh = new PhaseTracker("ses-" + round, graph);
            for (int step = 0; step < 12; step++) {
                Phase candidate = phases.get(random.nextInt(phases.size()));
                try {
                    fresh.start(candidate.name());
                    for (String dependency : candidate.dependsOn()) {
                        assertEquals(PhaseState.COMPLETED, fresh.state(dependency));
                    }
                    fresh.complete(candidate.name());
                } catch (PhaseOrderViolationException expected) {
                    assertNotEquals(PhaseState.RUNNING, fresh.state(candidate.name()));
                }
            }
        }
    }

    @Test
    void transitionsAreRecorded() {
        tracker.start("foundation");
        tracker.complete("foundation");

        List<PhaseTracker.Transition> transitions = tracker.transitions();
        assertEquals(2, transitions.size());
        assertEquals(PhaseState.PENDING, transitions.get(0).from());
        assertEquals(PhaseState.COMPLETED, transitions.get(1).to());
    }
}
