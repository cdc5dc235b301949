package com.contextbus.observability;

import com.contextbus.config.ContextBusProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches the character footprint of each published snapshot against the
 * configured budget. Read-only: it reports a level and logs each level at
 * most once per session, it never trims or blocks the context.
 */
@Component
public class ContextBudgetMonitor {

    private static final Logger log = LoggerFactory.getLogger(ContextBudgetMonitor.class);

    private final long maxCharacters;
    private final double warningRatio;
    private final double criticalRatio;
    private final double emergencyRatio;
    private final OrchestrationEventBus events;
    private final Map<String, BudgetLevel> levels = new ConcurrentHashMap<>();
    private final Map<String, Set<BudgetLevel>> alerted = new ConcurrentHashMap<>();

    @Autowired
    public ContextBudgetMonitor(ContextBusProperties properties, OrchestrationEventBus events) {
        this(properties.getBudget().getMaxCharacters(), properties.getBudget().getWarningRatio(),
            properties.getBudget().getCriticalRatio(), properties.getBudget().getEmergencyRatio(), events);
        events.subscribeAll(this::onEvent);
    }

    public ContextBudgetMonitor(long maxCharacters, double warningRatio, double criticalRatio,
                                double emergencyRatio, OrchestrationEventBus events) {
        if (maxCharacters <= 0) {
            throw new IllegalArgumentException("budget must be positive: " + maxCharacters);
        }
        if (!(warningRatio < criticalRatio && criticalRatio < emergencyRatio)) {
            throw new IllegalArgumentException("budget ratios must increase: "
                + warningRatio + ", " + criticalRatio + ", " + emergencyRatio);
        }
        this.maxCharacters = maxCharacters;
        this.warningRatio = warningRatio;
        this.criticalRatio = criticalRatio;
        this.emergencyRatio = emergencyRatio;
        this.events = events;
    }

    public BudgetLevel observe(String sessionId, long footprint) {
        double utilization = (double) footprint / maxCharacters;
        BudgetLevel level = levelOf(utilization);
        levels.put(sessionId, level);

        if (level != BudgetLevel.INFO
                && alerted.computeIfAbsent(sessionId, k -> EnumSet.noneOf(BudgetLevel.class)).add(level)) {
            log.warn("Context budget {} for session={}: {} of {} characters ({}%)", level, sessionId,
                footprint, maxCharacters, Math.round(utilization * 100));
            if (events != null) {
                events.publish(OrchestrationEvent.session(OrchestrationEvent.BUDGET_ALERT, sessionId,
                    Map.of("level", level.name(), "footprint", footprint, "max_characters", maxCharacters)));
            }
        }
        return level;
    }

    public BudgetLevel level(String sessionId) {
        return levels.getOrDefault(sessionId, BudgetLevel.INFO);
    }

    private BudgetLevel levelOf(double utilization) {
        if (utilization >= emergencyRatio) {
            return BudgetLevel.EMERGENCY;
        }
        if (utilization >= criticalRatio) {
            return BudgetLevel.CRITICAL;
        }
        if (utilization >= warningRatio) {
            return BudgetLevel.WARNING;
        }
        return BudgetLevel.INFO;
    }

    private void onEvent(OrchestrationEvent event) {
        if (OrchestrationEvent.CONTEXT_PUBLISHED.equals(event.eventType())
                && event.data().get("footprint") instanceof Number footprint) {
            observe(event.sessionId(), footprint.longValue());
        }
    }
}
