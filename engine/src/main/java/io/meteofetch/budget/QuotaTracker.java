package io.meteofetch.budget;

import io.meteofetch.core.ProviderProfile;
import io.meteofetch.error.QuotaExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Semaphore;

/**
 * Per-provider concurrency slots and periodic call budgets.
 * <p>
 * Slots are fair semaphores: {@link #reserve(String)} waits for one without spinning and the wait is interruptible.
 * A used-up budget fails fast with {@link QuotaExceededException} instead of waiting for the window to reset.
 * A reserved call counts against the budget until it is recorded with {@link #recordUsage(String)}, from then on it
 * counts only as used. Providers with a minimum request interval are paced: each reservation takes the next free
 * start time and waits for it.
 * Every counter mutation happens under a single lock. State lives in memory for the process lifetime.
 */
public class QuotaTracker {
    private static final Logger LOG = LoggerFactory.getLogger(QuotaTracker.class);

    private final Clock clock;
    private final Sleeper sleeper;
    // permit held by the calling thread, so recordUsage can tell which reservation it settles
    private final ThreadLocal<Permit> held = new ThreadLocal<>();
    private final Map<String, ProviderProfile> profiles = new LinkedHashMap<>();
    private final Map<String, Semaphore> slots = new LinkedHashMap<>();
    private final Object lock = new Object();
    // guarded by lock
    private final Map<String, Usage> usage = new LinkedHashMap<>();

    public QuotaTracker(Collection<ProviderProfile> profiles) {
        this(profiles, Clock.systemUTC());
    }

    public QuotaTracker(Collection<ProviderProfile> profiles, Clock clock) {
        this(profiles, clock, Sleeper.THREAD);
    }

    public QuotaTracker(Collection<ProviderProfile> profiles, Clock clock, Sleeper sleeper) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
        for (ProviderProfile p : profiles) {
            this.profiles.put(p.id(), p);
            this.slots.put(p.id(), new Semaphore(p.maxConcurrent(), true));
            this.usage.put(p.id(), new Usage());
        }
    }

    /** Blocking pause used for request pacing. */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = d -> Thread.sleep(d.toMillis(), d.toNanosPart() % 1_000_000);

        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Waits for a free concurrency slot of the provider, reserves one call of its budget and then waits until the
     * provider's pacing allows the next call to start.
     *
     * @throws QuotaExceededException if the budget of the current window is already used up
     * @throws InterruptedException   if the waiting thread is interrupted, e.g. by cancellation
     */
    public Permit reserve(String providerId) throws QuotaExceededException, InterruptedException {
        ProviderProfile profile = profile(providerId);
        // fail fast before queueing for a slot
        synchronized (lock) {
            Usage u = usage.get(providerId);
            roll(profile, u, clock.instant());
            if (u.exhausted(profile)) throw exceeded(profile, u);
        }
        Semaphore slot = slots.get(providerId);
        slot.acquire();
        Duration pause;
        synchronized (lock) {
            Usage u = usage.get(providerId);
            Instant now = clock.instant();
            roll(profile, u, now);
            if (u.exhausted(profile)) {
                slot.release();
                throw exceeded(profile, u);
            }
            u.inFlight++;
            u.unrecorded++;
            pause = nextStart(profile, u, now);
        }
        Permit permit = new Permit(this, providerId);
        if (!pause.isZero()) {
            LOG.debug("Pacing {}: next call starts in {} ms", providerId, pause.toMillis());
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                release(permit);
                throw e;
            }
        }
        held.set(permit);
        return permit;
    }

    /** Returns the permit's slot. Safe to call more than once. */
    public void release(Permit permit) {
        if (held.get() == permit) held.remove();
        synchronized (lock) {
            if (!permit.markReleased()) return;
            Usage u = usage.get(permit.providerId());
            u.inFlight = Math.max(0, u.inFlight - 1);
            if (!permit.isRecorded()) u.unrecorded = Math.max(0, u.unrecorded - 1);
        }
        slots.get(permit.providerId()).release();
    }

    /**
     * Counts one physical call against the provider's budget. When the calling thread holds a permit of the provider
     * the call settles that reservation.
     */
    public void recordUsage(String providerId) {
        ProviderProfile profile = profile(providerId);
        Permit permit = held.get();
        synchronized (lock) {
            Usage u = usage.get(providerId);
            Instant now = clock.instant();
            roll(profile, u, now);
            if (permit != null && permit.providerId().equals(providerId) && !permit.isReleased() && permit.markRecorded()) {
                u.unrecorded = Math.max(0, u.unrecorded - 1);
            }
            u.used++;
            if (profile.quotaPeriod() == ProviderProfile.QuotaPeriod.ROLLING) u.calls.addLast(now);
            if (profile.hasQuota() && u.used == profile.quotaCapacity()) {
                LOG.warn("Provider {} used its full budget of {} calls; window resets at {}", providerId, profile.quotaCapacity(), resetAt(profile, u));
            }
        }
    }

    /** Stores the remaining budget a provider reported in its own response metadata. */
    public void recordRemaining(String providerId, long remaining) {
        profile(providerId);
        synchronized (lock) {
            Usage u = usage.get(providerId);
            u.reportedRemaining = Math.max(0, remaining);
            u.reportedAt = clock.instant();
        }
    }

    /** Restores a usage count carried over from elsewhere, e.g. a previous run within the same window. */
    public void seedUsage(String providerId, long used) {
        ProviderProfile profile = profile(providerId);
        synchronized (lock) {
            Usage u = usage.get(providerId);
            Instant now = clock.instant();
            roll(profile, u, now);
            u.used = Math.max(0, used);
            if (profile.quotaPeriod() == ProviderProfile.QuotaPeriod.ROLLING) {
                u.calls.clear();
                for (long i = 0; i < u.used; i++) u.calls.addLast(now);
            }
        }
    }

    public QuotaState snapshot(String providerId) {
        ProviderProfile profile = profile(providerId);
        synchronized (lock) {
            Usage u = usage.get(providerId);
            roll(profile, u, clock.instant());
            return new QuotaState(providerId,
                    profile.hasQuota() ? profile.quotaCapacity() : -1,
                    u.used, u.inFlight, u.unrecorded, resetAt(profile, u), u.reportedRemaining);
        }
    }

    public Map<String, QuotaState> snapshots() {
        Map<String, QuotaState> out = new LinkedHashMap<>();
        for (String id : profiles.keySet()) out.put(id, snapshot(id));
        return out;
    }

    public ProviderProfile profile(String providerId) {
        ProviderProfile p = profiles.get(Objects.requireNonNull(providerId, "providerId"));
        if (p == null) throw new IllegalArgumentException("unknown provider: " + providerId);
        return p;
    }

    private QuotaExceededException exceeded(ProviderProfile profile, Usage u) {
        Instant reset = resetAt(profile, u);
        LOG.debug("Rejecting reservation for {}: used={} unrecorded={} reportedRemaining={}", profile.id(), u.used, u.unrecorded, u.reportedRemaining);
        return new QuotaExceededException(profile.id(), reset);
    }

    // Takes the next start time of a paced provider, returns how long the caller waits for it.
    private static Duration nextStart(ProviderProfile profile, Usage u, Instant now) {
        Duration interval = profile.minRequestInterval();
        if (interval.isZero()) return Duration.ZERO;
        Instant earliest = u.nextStart == null || u.nextStart.isBefore(now) ? now : u.nextStart;
        u.nextStart = earliest.plus(interval);
        return Duration.between(now, earliest);
    }

    // Drops calls and reported budgets that fell out of the current window.
    private static void roll(ProviderProfile profile, Usage u, Instant now) {
        switch (profile.quotaPeriod()) {
            case ROLLING -> {
                Instant cutoff = now.minus(profile.quotaWindow());
                while (!u.calls.isEmpty() && !u.calls.peekFirst().isAfter(cutoff)) u.calls.pollFirst();
                u.used = u.calls.size();
                if (u.reportedAt != null && !u.reportedAt.isAfter(cutoff)) u.clearReported();
            }
            case CALENDAR_MONTH -> {
                YearMonth month = YearMonth.from(now.atZone(ZoneOffset.UTC));
                if (!month.equals(u.month)) {
                    if (u.month != null) LOG.info("Quota window of {} rolled over to {}", profile.id(), month);
                    u.month = month;
                    u.used = 0;
                    u.clearReported();
                }
            }
            case NONE -> { }
        }
    }

    private static Instant resetAt(ProviderProfile profile, Usage u) {
        return switch (profile.quotaPeriod()) {
            case ROLLING -> u.calls.isEmpty() ? null : u.calls.peekFirst().plus(profile.quotaWindow());
            case CALENDAR_MONTH -> u.month == null ? null : u.month.plusMonths(1).atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
            case NONE -> null;
        };
    }

    private static final class Usage {
        long used;
        int inFlight;
        // reserved calls not yet recorded as used
        int unrecorded;
        Instant nextStart;
        final ArrayDeque<Instant> calls = new ArrayDeque<>();
        YearMonth month;
        Long reportedRemaining;
        Instant reportedAt;

        boolean exhausted(ProviderProfile profile) {
            if (profile.hasQuota() && used + unrecorded >= profile.quotaCapacity()) return true;
            return reportedRemaining != null && reportedRemaining - unrecorded <= 0;
        }

        void clearReported() {
            reportedRemaining = null;
            reportedAt = null;
        }
    }
}
