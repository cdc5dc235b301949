package com.contextbus.agent;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryTest {

    @Test
    void findsAdaptersByKind() {
        ScriptedAgent docs = new ScriptedAgent("docs", ctx -> AgentResult.failed("unused"));
        AgentRegistry registry = new AgentRegistry(List.of(docs, new ScriptedAgent("code", ctx -> null)));

        assertSame(docs, registry.require("docs"));
        assertEquals(Set.of("code", "docs"), registry.kinds());
        assertTrue(registry.find("environment").isEmpty());
    }

    @Test
    void unknownKind_isReported() {
        AgentRegistry registry = new AgentRegistry(List.of());
        UnknownAgentException ex = assertThrows(UnknownAgentException.class, () -> registry.require("ticket"));
        assertTrue(ex.getMessage().contains("ticket"));
    }

    @Test
    void duplicateKind_isRejected() {
        assertThrows(IllegalStateException.class, () -> new AgentRegistry(List.of(
            new ScriptedAgent("docs", ctx -> null),
            new ScriptedAgent("docs", ctx -> null))));
    }
}
