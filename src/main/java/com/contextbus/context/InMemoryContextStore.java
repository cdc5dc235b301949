package com.contextbus.context;

import com.contextbus.conflict.ConflictResolution;
import com.contextbus.conflict.ContextConflict;
import com.contextbus.conflict.ResolutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryContextStore implements ContextStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContextStore.class);

    private final ConcurrentHashMap<String, SessionContext> sessions = new ConcurrentHashMap<>();
    private final ContextMerger merger;

    public InMemoryContextStore(ContextMerger merger) {
        this.merger = merger;
    }

    @Override
    public ContextSnapshot open(String sessionId, List<ContextEntry> foundation) {
        TreeMap<String, ContextEntry> entries = new TreeMap<>();
        List<ContextMutation> mutations = new ArrayList<>();
        for (ContextEntry entry : foundation) {
            entries.put(entry.key(), entry);
            mutations.add(new ContextMutation(MutationKind.SEED, entry.key(), entry.sourceTask(), entry.value().render()));
        }
        ContextSnapshot versionZero = new ContextSnapshot(sessionId, 0, SemanticKeys.FOUNDATION_SOURCE,
            entries, mutations, Instant.now());

        SessionContext context = new SessionContext(versionZero);
        if (sessions.putIfAbsent(sessionId, context) != null) {
            throw new IllegalStateException("context already opened for session " + sessionId);
        }
        log.info("Opened context for session={} with {} foundation entries", sessionId, entries.size());
        return versionZero;
    }

    @Override
    public MergeResult merge(String sessionId, String phase, List<ContextEntry> contributions) {
        SessionContext context = require(sessionId);
        synchronized (context) {
            context.ensureOpen(sessionId);
            MergeResult result = merger.merge(context.working, phase, contributions);
            if (result.snapshot() != context.working) {
                context.append(result.snapshot());
            }
            for (ContextConflict conflict : result.conflicts()) {
                context.conflicts.put(conflict.conflictId(), conflict);
            }
            log.debug("Merged {} contribution(s) into session={} phase={} -> v{} ({} conflict(s))",
                contributions.size(), sessionId, phase, result.snapshot().version(), result.conflicts().size());
            return result;
        }
    }

    @Override
    public ContextSnapshot apply(String sessionId, String phase, ConflictResolution resolution) {
        SessionContext context = require(sessionId);
        synchronized (context) {
            context.ensureOpen(sessionId);
            ContextSnapshot next = context.working.next(phase, resolution.upserts(), resolution.removals(),
                List.of(resolution.mutation()));
            context.append(next);
            context.conflicts.put(resolution.conflict().conflictId(), resolution.conflict());
            return next;
        }
    }

    @Override
    public ContextSnapshot publish(String sessionId, String phase) {
        SessionContext context = require(sessionId);
        synchronized (context) {
            context.ensureOpen(sessionId);
            long pending = context.conflicts.values().stream()
                .filter(c -> c.resolution() == ResolutionStatus.PENDING)
                .count();
            if (pending > 0) {
                throw new IllegalStateException(pending + " pending conflict(s) block publishing phase " + phase);
            }
            context.published.put(phase, context.working);
            context.interim.clear();
            log.info("Published context v{} for session={} phase={}", context.working.version(), sessionId, phase);
            return context.working;
        }
    }

    @Override
    public Optional<ContextSnapshot> snapshot(String sessionId, String asOfPhase) {
        SessionContext context = sessions.get(sessionId);
        if (context == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(context.published.get(asOfPhase));
    }

    @Override
    public ContextSnapshot latest(String sessionId) {
        return require(sessionId).working;
    }

    @Override
    public List<ContextSnapshot> history(String sessionId) {
        SessionContext context = sessions.get(sessionId);
        return context == null ? List.of() : List.copyOf(context.versions);
    }

    @Override
    public List<ContextConflict> conflicts(String sessionId) {
        SessionContext context = sessions.get(sessionId);
        if (context == null) {
            return List.of();
        }
        synchronized (context) {
            return List.copyOf(context.conflicts.values());
        }
    }

    @Override
    public void postInterim(String sessionId, String taskId, List<ContextEntry> entries) {
        SessionContext context = require(sessionId);
        if (!context.closed) {
            context.interim.put(taskId, List.copyOf(entries));
        }
    }

    @Override
    public Map<String, List<ContextEntry>> pollInterim(String sessionId) {
        SessionContext context = sessions.get(sessionId);
        return context == null ? Map.of() : Map.copyOf(context.interim);
    }

    @Override
    public void close(String sessionId) {
        SessionContext context = sessions.get(sessionId);
        if (context != null) {
            synchronized (context) {
                context.closed = true;
                context.interim.clear();
            }
            log.info("Closed context for session={} at v{}", sessionId, context.working.version());
        }
    }

    @Override
    public boolean isOpen(String sessionId) {
        SessionContext context = sessions.get(sessionId);
        return context != null && !context.closed;
    }

    private SessionContext require(String sessionId) {
        SessionContext context = sessions.get(sessionId);
        if (context == null) {
            throw new IllegalArgumentException("no context opened for session " + sessionId);
        }
        return context;
    }

    private static final class SessionContext {
        private final CopyOnWriteArrayList<ContextSnapshot> versions = new CopyOnWriteArrayList<>();
        private final Map<String, ContextSnapshot> published = new ConcurrentHashMap<>();
        private final Map<String, ContextConflict> conflicts = new LinkedHashMap<>();
        private final Map<String, List<ContextEntry>> interim = new ConcurrentHashMap<>();
        private volatile ContextSnapshot working;
        private volatile boolean closed;

        private SessionContext(ContextSnapshot foundation) {
            this.working = foundation;
            this.versions.add(foundation);
            this.published.put(SemanticKeys.FOUNDATION_SOURCE, foundation);
        }

        private void append(ContextSnapshot snapshot) {
            versions.add(snapshot);
            working = snapshot;
        }

        private void ensureOpen(String sessionId) {
            if (closed) {
                throw new ClosedContextException(sessionId);
            }
        }
    }
}
