package org.tanzu.fleetinventory.collector;

import org.junit.jupiter.api.Test;
import org.tanzu.fleetinventory.identity.DeviceIdentity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedCollectorTest {

    private static DeviceIdentity device(String name) {
        return DeviceIdentity.of(name, null);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedCollector<String>("bad", 0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new BoundedCollector<String>("bad", 1, Duration.ZERO));
    }

    @Test
    void completesEveryTaskWithItsValue() {
        try (BoundedCollector<String> collector = new BoundedCollector<>("values", 4, Duration.ofSeconds(5))) {
            for (int i = 0; i < 20; i++) {
                collector.submit(device("VDA" + i), identity -> identity.getShortName().toLowerCase());
            }
            Map<DeviceIdentity, TaskOutcome<String>> outcomes = collector.drain();

            assertEquals(20, outcomes.size());
            assertEquals("vda7", outcomes.get(device("VDA7")).getValue());
            assertTrue(outcomes.values().stream().allMatch(TaskOutcome::isCompleted));
            assertEquals(20, collector.getStats().getCompleted());
            assertEquals(TaskState.COMPLETED, collector.stateOf(device("VDA0")));
        }
    }

    @Test
    void drainKeepsSubmissionOrder() {
        try (BoundedCollector<Integer> collector = new BoundedCollector<>("order", 3, Duration.ofSeconds(5))) {
            List<DeviceIdentity> submitted = new ArrayList<>();
            for (int i = 9; i >= 0; i--) {
                DeviceIdentity identity = device("SRV" + i);
                submitted.add(identity);
                int delay = i * 5;
                collector.submit(identity, id -> {
                    Thread.sleep(delay);
                    return delay;
                });
            }
            assertEquals(submitted, new ArrayList<>(collector.drain().keySet()));
        }
    }

    @Test
    void neverRunsMoreThanMaxConcurrency() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger observedPeak = new AtomicInteger();
        try (BoundedCollector<Integer> collector = new BoundedCollector<>("bounded", 3, Duration.ofSeconds(5))) {
            for (int i = 0; i < 12; i++) {
                collector.submit(device("VDA" + i), identity -> {
                    int now = running.incrementAndGet();
                    observedPeak.accumulateAndGet(now, Math::max);
                    Thread.sleep(50);
                    running.decrementAndGet();
                    return now;
                });
            }
            collector.drain();
            assertTrue(observedPeak.get() <= 3, "peak was " + observedPeak.get());
            assertTrue(collector.getStats().getPeakConcurrency() <= 3);
        }
    }

    @Test
    void wallTimeFollowsBatchesOfMaxConcurrency() {
        // 9 tasks of 200 ms with 3 slots run in three waves.
        try (BoundedCollector<Integer> collector = new BoundedCollector<>("waves", 3, Duration.ofSeconds(5))) {
            long start = System.nanoTime();
            for (int i = 0; i < 9; i++) {
                collector.submit(device("VDA" + i), identity -> {
                    Thread.sleep(200);
                    return 1;
                });
            }
            collector.drain();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(elapsedMs >= 550, "too fast: " + elapsedMs);
            assertTrue(elapsedMs < 2000, "too slow: " + elapsedMs);
        }
    }

    @Test
    void hungTaskTimesOutAndFreesItsSlot() {
        AtomicBoolean release = new AtomicBoolean();
        try (BoundedCollector<String> collector = new BoundedCollector<>("hung", 1, Duration.ofMillis(200))) {
            collector.submit(device("HUNG01"), identity -> {
                // Ignores interruption like a blocked remote call would.
                while (!release.get()) {
                    try {
                        Thread.sleep(20);
                    } catch (InterruptedException ignored) {
                    }
                }
                return "late";
            });
            collector.submit(device("FAST01"), identity -> "ok");

            long start = System.nanoTime();
            Map<DeviceIdentity, TaskOutcome<String>> outcomes = collector.drain();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(outcomes.get(device("HUNG01")).isTimedOut());
            assertTrue(outcomes.get(device("FAST01")).isCompleted());
            assertEquals("ok", outcomes.get(device("FAST01")).getValue());
            assertTrue(elapsedMs < 1500, "slot was not reassigned: " + elapsedMs);

            CollectorStats stats = collector.getStats();
            assertEquals(1, stats.getTimedOut());
            assertEquals(1, stats.getCompleted());
        } finally {
            release.set(true);
        }
    }

    @Test
    void timedOutOutcomeHasNoValue() {
        try (BoundedCollector<String> collector = new BoundedCollector<>("novalue", 1, Duration.ofMillis(50))) {
            collector.submit(device("SLOW01"), identity -> {
                Thread.sleep(2000);
                return "never";
            });
            TaskOutcome<String> outcome = collector.drain().get(device("SLOW01"));
            assertEquals(TaskState.TIMED_OUT, outcome.getState());
            assertThrows(IllegalStateException.class, outcome::getValue);
        }
    }

    @Test
    void failureIsRecordedWithItsCause() {
        try (BoundedCollector<String> collector = new BoundedCollector<>("failing", 2, Duration.ofSeconds(5))) {
            collector.submit(device("BAD01"), identity -> {
                throw new IllegalStateException("access denied");
            });
            collector.submit(device("GOOD01"), identity -> "fine");

            Map<DeviceIdentity, TaskOutcome<String>> outcomes = collector.drain();
            TaskOutcome<String> failed = outcomes.get(device("BAD01"));
            assertTrue(failed.isFailed());
            assertInstanceOf(IllegalStateException.class, failed.getError());
            assertEquals("access denied", failed.getError().getMessage());
            assertTrue(outcomes.get(device("GOOD01")).isCompleted());
            assertEquals(1, collector.getStats().getFailed());
        }
    }

    @Test
    void secondSubmissionForSameDeviceIsRejected() {
        try (BoundedCollector<String> collector = new BoundedCollector<>("dupes", 2, Duration.ofSeconds(5))) {
            assertTrue(collector.submit(DeviceIdentity.of("SRV01", "CORP"), identity -> "first"));
            assertFalse(collector.submit(DeviceIdentity.of("srv01", null), identity -> "second"));

            Map<DeviceIdentity, TaskOutcome<String>> outcomes = collector.drain();
            assertEquals(1, outcomes.size());
            assertEquals("first", outcomes.values().iterator().next().getValue());
            assertEquals(1, collector.getRejectedDuplicates().size());
            assertEquals(1, collector.getStats().getDuplicatesRejected());
        }
    }

    @Test
    void closeDropsQueuedTasks() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch never = new CountDownLatch(1);
        BoundedCollector<String> collector = new BoundedCollector<>("closing", 1, Duration.ofSeconds(30));
        collector.submit(device("RUN01"), identity -> {
            started.countDown();
            never.await();
            return "done";
        });
        collector.submit(device("QUEUED01"), identity -> "queued");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        collector.close();

        assertEquals(TaskState.FAILED, collector.stateOf(device("QUEUED01")));
        Map<DeviceIdentity, TaskOutcome<String>> outcomes = collector.drain();
        assertInstanceOf(CancellationException.class, outcomes.get(device("QUEUED01")).getError());
        assertThrows(IllegalStateException.class, () -> collector.submit(device("LATE01"), identity -> "late"));
    }
}
