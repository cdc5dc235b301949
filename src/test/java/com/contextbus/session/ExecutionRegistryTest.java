package com.contextbus.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionRegistryTest {

    private MutableClock clock;
    private ExecutionRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new ExecutionRegistry(new InMemoryLeaseStore(), clock, Duration.ofSeconds(30));
    }

    @Nested
    @DisplayName("Single active session per job key")
    class SingleSession {

        @Test
        void secondAcquire_isRejectedWithActiveSession() {
            ExecutionSession first = registry.acquire("ACM-1");

            AlreadyRunningException ex = assertThrows(AlreadyRunningException.class, () -> registry.acquire("ACM-1"));
            assertEquals(first.sessionId(), ex.getActiveSessionId());
            assertEquals("ACM-1", ex.getJobKey());
        }

        @Test
        void differentJobKeys_runSideBySide() {
            registry.acquire("ACM-1");
            assertDoesNotThrow(() -> registry.acquire("ACM-2"));
        }

        @Test
        @DisplayName("Concurrent acquires for one key: exactly one wins")
        void concurrentAcquire_atMostOneSucceeds() throws Exception {
            int contenders = 16;
            ExecutorService pool = Executors.newFixedThreadPool(contenders);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger winners = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < contenders; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        try {
                            registry.acquire("ACM-RACE");
                            winners.incrementAndGet();
                        } catch (AlreadyRunningException ex) {
                            rejected.incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(1, winners.get());
            assertEquals(contenders - 1, rejected.get());
        }

        @Test
        void releasedKey_canBeAcquiredAgain() {
            ExecutionSession first = registry.acquire("ACM-1");
            registry.release(first.sessionId(), SessionStatus.COMPLETED, "done");

            ExecutionSession second = registry.acquire("ACM-1");
            assertNotEquals(first.sessionId(), second.sessionId());
        }
    }

    @Nested
    @DisplayName("Lease expiry")
    class LeaseExpiry {

        @Test
        void heartbeat_extendsLease() {
            ExecutionSession session = started("ACM-1");
            clock.advance(Duration.ofSeconds(20));
            registry.heartbeat(session.sessionId());
            clock.advance(Duration.ofSeconds(20));

            assertDoesNotThrow(() -> registry.assertActive(session.sessionId()));
            assertThrows(AlreadyRunningException.class, () -> registry.acquire("ACM-1"));
        }

        @Test
        void expiredLease_isReclaimedByNextAcquire() {
            ExecutionSession stale = started("ACM-1");
            List<ExecutionSession> reclaimed = new CopyOnWriteArrayList<>();
            registry.onLeaseReclaimed(reclaimed::add);

            clock.advance(Duration.ofSeconds(31));
            ExecutionSession fresh = registry.acquire("ACM-1");

            assertEquals(1, reclaimed.size());
            assertEquals(stale.sessionId(), reclaimed.get(0).sessionId());
            ExecutionSession failed = registry.require(stale.sessionId());
            assertEquals(SessionStatus.FAILED, failed.status());
            assertEquals(ExecutionRegistry.LEASE_EXPIRED_REASON, failed.statusReason());
            assertTrue(registry.require(fresh.sessionId()).isRunning());
        }

        @Test
        void heartbeatAfterExpiry_throwsAndFailsSession() {
            ExecutionSession session = started("ACM-1");
            clock.advance(Duration.ofMinutes(1));

            assertThrows(LeaseExpiredException.class, () -> registry.heartbeat(session.sessionId()));
            assertEquals(SessionStatus.FAILED, registry.require(session.sessionId()).status());
            assertDoesNotThrow(() -> registry.acquire("ACM-1"));
        }

        @Test
        void sweep_reclaimsExpiredLeasesOnly() {
            ExecutionSession old = started("ACM-OLD");
            clock.advance(Duration.ofSeconds(25));
            ExecutionSession young = started("ACM-YOUNG");
            clock.advance(Duration.ofSeconds(10));

            registry.reclaimExpired();

            assertEquals(SessionStatus.FAILED, registry.require(old.sessionId()).status());
            assertTrue(registry.require(young.sessionId()).isRunning());
        }

        @Test
        @DisplayName("A session waiting for a pipeline thread keeps its lease until it begins")
        void queuedLease_doesNotExpireBeforeBegin() {
            ExecutionSession queued = registry.acquire("ACM-QUEUED");
            clock.advance(Duration.ofMinutes(10));

            registry.reclaimExpired();
            assertTrue(registry.require(queued.sessionId()).isRunning());
            assertThrows(AlreadyRunningException.class, () -> registry.acquire("ACM-QUEUED"));

            registry.begin(queued.sessionId());
            clock.advance(Duration.ofSeconds(29));
            registry.reclaimExpired();
            assertDoesNotThrow(() -> registry.assertActive(queued.sessionId()));

            clock.advance(Duration.ofSeconds(2));
            registry.reclaimExpired();
            assertEquals(SessionStatus.FAILED, registry.require(queued.sessionId()).status());
        }

        @Test
        void begin_afterRelease_isRefused() {
            ExecutionSession session = registry.acquire("ACM-1");
            registry.release(session.sessionId(), SessionStatus.FAILED, "shutdown");

            assertThrows(LeaseExpiredException.class, () -> registry.begin(session.sessionId()));
        }

        @Test
        void failingListener_doesNotStopOthers() {
            ExecutionSession session = started("ACM-1");
            List<String> seen = new CopyOnWriteArrayList<>();
            registry.onLeaseReclaimed(s -> { throw new IllegalStateException("boom"); });
            registry.onLeaseReclaimed(s -> seen.add(s.sessionId()));

            clock.advance(Duration.ofSeconds(31));
            registry.reclaimExpired();

            assertEquals(List.of(session.sessionId()), seen);
        }

        private ExecutionSession started(String jobKey) {
            ExecutionSession session = registry.acquire(jobKey);
            registry.begin(session.sessionId());
            return session;
        }
    }

    @Test
    void release_keepsFirstTerminalStatus() {
        ExecutionSession session = registry.acquire("ACM-1");
        registry.release(session.sessionId(), SessionStatus.HALTED, "minimum evidence");
        ExecutionSession again = registry.release(session.sessionId(), SessionStatus.COMPLETED, "late");

        assertEquals(SessionStatus.HALTED, again.status());
        assertEquals("minimum evidence", again.statusReason());
    }

    @Test
    void unknownSession_isReported() {
        assertThrows(UnknownSessionException.class, () -> registry.release("ses-missing", SessionStatus.FAILED, "x"));
        assertThrows(UnknownSessionException.class, () -> registry.heartbeat("ses-missing"));
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
