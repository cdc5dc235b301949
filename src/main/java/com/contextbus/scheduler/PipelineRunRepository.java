package com.contextbus.scheduler;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class PipelineRunRepository {

    private final ConcurrentHashMap<String, PipelineRun> runs = new ConcurrentHashMap<>();

    public void register(PipelineRun run) {
        runs.put(run.sessionId(), run);
    }

    public Optional<PipelineRun> find(String sessionId) {
        return Optional.ofNullable(runs.get(sessionId));
    }
}
