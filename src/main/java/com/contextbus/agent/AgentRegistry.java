package com.contextbus.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Agent adapters by kind, collected from the application context.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, AgentAdapter> adapters = new TreeMap<>();

    @Autowired
    public AgentRegistry(ObjectProvider<AgentAdapter> adapters) {
        this(adapters.orderedStream().toList());
    }

    public AgentRegistry(List<AgentAdapter> adapters) {
        for (AgentAdapter adapter : adapters) {
            AgentAdapter previous = this.adapters.putIfAbsent(adapter.agentKind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("agent kind '" + adapter.agentKind() + "' registered twice: "
                    + previous.getClass().getName() + ", " + adapter.getClass().getName());
            }
        }
        log.info("Registered agent kinds: {}", this.adapters.keySet());
    }

    public Optional<AgentAdapter> find(String agentKind) {
        return Optional.ofNullable(adapters.get(agentKind));
    }

    public AgentAdapter require(String agentKind) {
        return find(agentKind).orElseThrow(() -> new UnknownAgentException(agentKind));
    }

    public Set<String> kinds() {
        return adapters.keySet();
    }
}
