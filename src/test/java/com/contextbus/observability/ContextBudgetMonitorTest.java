package com.contextbus.observability;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ContextBudgetMonitorTest {

    private List<OrchestrationEvent> alerts;
    private ContextBudgetMonitor monitor;

    @BeforeEach
    void setUp() {
        OrchestrationEventBus bus = new OrchestrationEventBus(Runnable::run);
        alerts = new CopyOnWriteArrayList<>();
        bus.subscribeAll(alerts::add);
        monitor = new ContextBudgetMonitor(1_000, 0.6, 0.8, 0.95, bus);
    }

    @Test
    void levelsFollowUtilization() {
        assertEquals(BudgetLevel.INFO, monitor.observe("ses-1", 100));
        assertEquals(BudgetLevel.WARNING, monitor.observe("ses-1", 600));
        assertEquals(BudgetLevel.CRITICAL, monitor.observe("ses-1", 850));
        assertEquals(BudgetLevel.EMERGENCY, monitor.observe("ses-1", 1_200));
        assertEquals(BudgetLevel.EMERGENCY, monitor.level("ses-1"));
    }

    @Test
    void eachLevelIsAlertedOncePerSession() {
        monitor.observe("ses-1", 700);
        monitor.observe("ses-1", 710);
        monitor.observe("ses-1", 720);
        monitor.observe("ses-2", 700);

        assertEquals(2, alerts.size());
        assertEquals("WARNING", alerts.get(0).data().get("level"));
        assertEquals("ses-2", alerts.get(1).sessionId());
    }

    @Test
    void unobservedSession_isInfo() {
        assertEquals(BudgetLevel.INFO, monitor.level("ses-none"));
    }

    @Test
    void ratiosMustIncrease() {
        assertThrows(IllegalArgumentException.class, () -> new ContextBudgetMonitor(1_000, 0.8, 0.6, 0.95, null));
        assertThrows(IllegalArgumentException.class, () -> new ContextBudgetMonitor(0, 0.6, 0.8, 0.95, null));
    }
}
