package com.contextbus.session;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class InMemoryLeaseStore implements LeaseStore {

    private final ConcurrentHashMap<String, LeaseRecord> leases = new ConcurrentHashMap<>();

    @Override
    public AcquireResult acquire(LeaseRecord candidate, Instant now) {
        AtomicReference<LeaseRecord> reclaimed = new AtomicReference<>();
        LeaseRecord holder = leases.compute(candidate.jobKey(), (key, current) -> {
            if (current == null) {
                return candidate;
            }
            if (current.isExpired(now)) {
                reclaimed.set(current);
                return candidate;
            }
            return current;
        });
        return new AcquireResult(holder == candidate, holder, reclaimed.get());
    }

    @Override
    public boolean renew(String jobKey, String sessionId, Instant newExpiry, Instant now) {
        AtomicBoolean renewed = new AtomicBoolean(false);
        leases.computeIfPresent(jobKey, (key, current) -> {
            if (current.sessionId().equals(sessionId) && !current.isExpired(now)) {
                renewed.set(true);
                return current.renewedUntil(now, newExpiry);
            }
            return current;
        });
        return renewed.get();
    }

    @Override
    public boolean release(String jobKey, String sessionId) {
        AtomicBoolean released = new AtomicBoolean(false);
        leases.computeIfPresent(jobKey, (key, current) -> {
            if (current.sessionId().equals(sessionId)) {
                released.set(true);
                return null;
            }
            return current;
        });
        return released.get();
    }

    @Override
    public Optional<LeaseRecord> reclaimIfExpired(String jobKey, Instant now) {
        AtomicReference<LeaseRecord> reclaimed = new AtomicReference<>();
        leases.computeIfPresent(jobKey, (key, current) -> {
            if (current.isExpired(now)) {
                reclaimed.set(current);
                return null;
            }
            return current;
        });
        return Optional.ofNullable(reclaimed.get());
    }

    @Override
    public Optional<LeaseRecord> find(String jobKey) {
        return Optional.ofNullable(leases.get(jobKey));
    }

    @Override
    public List<LeaseRecord> all() {
        return List.copyOf(leases.values());
    }
}
