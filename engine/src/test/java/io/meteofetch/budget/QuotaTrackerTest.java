package io.meteofetch.budget;

import io.meteofetch.core.ProviderProfile;
import io.meteofetch.error.ErrorKind;
import io.meteofetch.error.QuotaExceededException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class QuotaTrackerTest {
    private static final Instant MID_MAY = Instant.parse("2024-05-15T12:00:00Z");

    @Test
    void concurrentCallersNeverExceedSlotCount() throws Exception {
        ProviderProfile p = ProviderProfile.builder("open").maxConcurrent(5).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(20);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(pool.submit(() -> {
                    for (int j = 0; j < 10; j++) {
                        try (Permit ignored = tracker.reserve("open")) {
                            int now = inFlight.incrementAndGet();
                            peak.accumulateAndGet(now, Math::max);
                            Thread.sleep(1);
                            inFlight.decrementAndGet();
                            tracker.recordUsage("open");
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertTrue(peak.get() <= 5, "peak in-flight was " + peak.get());
        assertEquals(200, tracker.snapshot("open").used());
        assertEquals(0, tracker.snapshot("open").inFlight());
    }

    @Test
    void exhaustedMonthlyBudgetFailsFastWithResetTime() throws Exception {
        ProviderProfile p = ProviderProfile.builder("paid").monthlyQuota(3).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY));
        for (int i = 0; i < 3; i++) {
            try (Permit ignored = tracker.reserve("paid")) {
                tracker.recordUsage("paid");
            }
        }
        QuotaExceededException e = assertThrows(QuotaExceededException.class, () -> tracker.reserve("paid"));
        assertEquals(ErrorKind.QUOTA_EXCEEDED, e.kind());
        assertEquals("paid", e.providerId());
        assertEquals(Instant.parse("2024-06-01T00:00:00Z"), e.resetAt());
        assertTrue(tracker.snapshot("paid").isExhausted());
    }

    @Test
    void inFlightPermitsCountAgainstBudget() throws Exception {
        ProviderProfile p = ProviderProfile.builder("paid").maxConcurrent(5).monthlyQuota(2).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY));
        Permit a = tracker.reserve("paid");
        Permit b = tracker.reserve("paid");
        assertThrows(QuotaExceededException.class, () -> tracker.reserve("paid"));
        b.close();
        Permit c = tracker.reserve("paid");
        a.close();
        c.close();
        assertEquals(0, tracker.snapshot("paid").inFlight());
    }

    @Test
    void recordedCallOfAHeldPermitCountsOnce() throws Exception {
        ProviderProfile p = ProviderProfile.builder("paid").maxConcurrent(5).monthlyQuota(3).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY));
        Permit a = tracker.reserve("paid");
        tracker.recordUsage("paid");
        Permit b = tracker.reserve("paid");
        tracker.recordUsage("paid");

        QuotaState state = tracker.snapshot("paid");
        assertEquals(2, state.used());
        assertEquals(2, state.inFlight());
        assertEquals(0, state.unrecorded());
        assertEquals(1, state.remaining());

        Permit c = tracker.reserve("paid");
        assertThrows(QuotaExceededException.class, () -> tracker.reserve("paid"));
        c.close();
        b.close();
        a.close();
        assertEquals(2, tracker.snapshot("paid").used());
        assertEquals(1, tracker.snapshot("paid").remaining());
    }

    @Test
    void releasingWithoutRecordingFreesTheReservation() throws Exception {
        ProviderProfile p = ProviderProfile.builder("paid").maxConcurrent(5).monthlyQuota(1).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY));
        Permit a = tracker.reserve("paid");
        assertThrows(QuotaExceededException.class, () -> tracker.reserve("paid"));
        a.close();
        assertFalse(a.isRecorded());
        assertEquals(0, tracker.snapshot("paid").used());
        tracker.reserve("paid").close();
    }

    @Test
    void reportedRemainingAlreadyIncludesTheRecordedCall() throws Exception {
        ProviderProfile p = ProviderProfile.builder("paid").maxConcurrent(5).monthlyQuota(10_000).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY));
        try (Permit ignored = tracker.reserve("paid")) {
            tracker.recordUsage("paid");
            tracker.recordRemaining("paid", 1);
            assertEquals(1, tracker.snapshot("paid").remaining());
            try (Permit second = tracker.reserve("paid")) {
                assertEquals(0, tracker.snapshot("paid").remaining());
                assertThrows(QuotaExceededException.class, () -> tracker.reserve("paid"));
            }
        }
    }

    @Test
    void pacedProviderSpacesCallStarts() throws Exception {
        MutableClock clock = new MutableClock(MID_MAY);
        List<Duration> pauses = new ArrayList<>();
        QuotaTracker.Sleeper sleeper = d -> {
            pauses.add(d);
            clock.advance(d);
        };
        ProviderProfile p = ProviderProfile.builder("paced").maxConcurrent(4).minRequestInterval(Duration.ofMillis(100)).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), clock, sleeper);

        Permit a = tracker.reserve("paced");
        Permit b = tracker.reserve("paced");
        Permit c = tracker.reserve("paced");
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(100)), pauses);
        assertEquals(MID_MAY.plusMillis(200), clock.instant());

        clock.advance(Duration.ofSeconds(5));
        Permit d = tracker.reserve("paced");
        assertEquals(2, pauses.size());
        for (Permit permit : List.of(a, b, c, d)) permit.close();
        assertEquals(0, tracker.snapshot("paced").inFlight());
    }

    @Test
    void interruptedPacingWaitReturnsTheSlot() throws Exception {
        QuotaTracker.Sleeper interrupted = d -> { throw new InterruptedException("cancelled"); };
        ProviderProfile p = ProviderProfile.builder("paced").maxConcurrent(1).monthlyQuota(5)
                .minRequestInterval(Duration.ofSeconds(1)).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY), interrupted);
        tracker.reserve("paced").close();
        assertThrows(InterruptedException.class, () -> tracker.reserve("paced"));
        QuotaState state = tracker.snapshot("paced");
        assertEquals(0, state.inFlight());
        assertEquals(0, state.unrecorded());
    }

    @Test
    void rollingWindowFreesOldCalls() throws Exception {
        MutableClock clock = new MutableClock(MID_MAY);
        ProviderProfile p = ProviderProfile.builder("roll").rollingQuota(Duration.ofMinutes(1), 2).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), clock);

        tracker.recordUsage("roll");
        clock.advance(Duration.ofSeconds(30));
        tracker.recordUsage("roll");
        QuotaExceededException e = assertThrows(QuotaExceededException.class, () -> tracker.reserve("roll"));
        assertEquals(MID_MAY.plus(Duration.ofMinutes(1)), e.resetAt());

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, tracker.snapshot("roll").used());
        tracker.reserve("roll").close();
    }

    @Test
    void monthlyBudgetResetsWhenTheMonthChanges() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-31T23:59:00Z"));
        ProviderProfile p = ProviderProfile.builder("paid").monthlyQuota(10).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), clock);
        tracker.seedUsage("paid", 10);
        assertThrows(QuotaExceededException.class, () -> tracker.reserve("paid"));

        clock.advance(Duration.ofMinutes(2));
        assertEquals(0, tracker.snapshot("paid").used());
        tracker.reserve("paid").close();
    }

    @Test
    void providerReportedBudgetOfZeroBlocksCalls() {
        ProviderProfile p = ProviderProfile.builder("paid").monthlyQuota(10_000).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY));
        tracker.recordRemaining("paid", 0);
        assertThrows(QuotaExceededException.class, () -> tracker.reserve("paid"));
        assertEquals(0, tracker.snapshot("paid").remaining());
    }

    @Test
    void unlimitedProviderIsNeverExhausted() throws Exception {
        QuotaTracker tracker = new QuotaTracker(List.of(ProviderProfile.builder("free").build()));
        for (int i = 0; i < 100; i++) tracker.recordUsage("free");
        QuotaState state = tracker.snapshot("free");
        assertFalse(state.isLimited());
        assertFalse(state.isExhausted());
        assertNull(state.resetAt());
        tracker.reserve("free").close();
    }

    @Test
    void usageLevelsFollowThresholds() {
        ProviderProfile p = ProviderProfile.builder("paid").monthlyQuota(100).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p), new MutableClock(MID_MAY));
        tracker.seedUsage("paid", 79);
        assertEquals(UsageLevel.NORMAL, tracker.snapshot("paid").level());
        tracker.seedUsage("paid", 80);
        assertEquals(UsageLevel.WARNING, tracker.snapshot("paid").level());
        tracker.seedUsage("paid", 95);
        assertEquals(UsageLevel.CRITICAL, tracker.snapshot("paid").level());
        assertEquals(5, tracker.snapshot("paid").remaining());
    }

    @Test
    void waitingForSlotIsInterruptible() throws Exception {
        ProviderProfile p = ProviderProfile.builder("one").maxConcurrent(1).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p));
        Permit held = tracker.reserve("one");
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread waiter = new Thread(() -> {
            try {
                tracker.reserve("one").close();
            } catch (Throwable t) {
                thrown.set(t);
            } finally {
                done.countDown();
            }
        });
        waiter.start();
        Thread.sleep(50);
        waiter.interrupt();
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertInstanceOf(InterruptedException.class, thrown.get());
        held.close();
        assertEquals(0, tracker.snapshot("one").inFlight());
    }

    @Test
    void releasingTwiceReturnsOneSlot() throws Exception {
        ProviderProfile p = ProviderProfile.builder("one").maxConcurrent(1).build();
        QuotaTracker tracker = new QuotaTracker(List.of(p));
        Permit permit = tracker.reserve("one");
        permit.close();
        permit.close();
        assertTrue(permit.isReleased());
        Permit again = tracker.reserve("one");
        assertEquals(1, tracker.snapshot("one").inFlight());
        again.close();
    }

    @Test
    void unknownProviderIsRejected() {
        QuotaTracker tracker = new QuotaTracker(List.of(ProviderProfile.builder("a").build()));
        assertThrows(IllegalArgumentException.class, () -> tracker.snapshot("b"));
    }
}
