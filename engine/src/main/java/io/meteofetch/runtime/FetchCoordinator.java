package io.meteofetch.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.meteofetch.budget.Permit;
import io.meteofetch.budget.QuotaTracker;
import io.meteofetch.core.DailyRecord;
import io.meteofetch.core.DateSpan;
import io.meteofetch.core.FetchRequest;
import io.meteofetch.core.ProviderClient;
import io.meteofetch.core.ProviderProfile;
import io.meteofetch.core.Segment;
import io.meteofetch.core.SegmentOutcome;
import io.meteofetch.error.ErrorKind;
import io.meteofetch.error.FetchException;
import io.meteofetch.error.QuotaExceededException;
import io.meteofetch.metrics.Metrics;
import io.meteofetch.retry.ExponentialBackoffRetryPolicy;
import io.meteofetch.retry.RetryDecision;
import io.meteofetch.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * Fetches planned segments concurrently with retries and per-segment provider fallback.
 * <p>
 * Each segment tries the providers in order. Within one provider, failures are retried as the provider's
 * {@link RetryPolicy} allows; an exhausted quota, a non-retryable failure or running out of attempts moves the
 * segment to the next provider. A segment longer than a fallback provider accepts is split for that provider, and
 * every piece must succeed there. Outcomes are returned in segment order whatever the completion order was.
 */
public class FetchCoordinator {
    private static final Logger LOG = LoggerFactory.getLogger(FetchCoordinator.class);

    private final Map<String, ProviderClient> clients = new LinkedHashMap<>();
    private final Map<String, RetryPolicy> retryPolicies = new LinkedHashMap<>();
    private final QuotaTracker quota;
    private final int maxInFlight;
    private final Metrics metrics;
    private final Meter successMeter;
    private final Meter failedMeter;
    private final Meter cancelledMeter;
    private final Meter fallbackMeter;
    private final AtomicInteger poolSeq = new AtomicInteger();

    public FetchCoordinator(Collection<ProviderClient> clients, QuotaTracker quota, int maxInFlight, Metrics metrics) {
        this(clients, quota, ExponentialBackoffRetryPolicy::forProfile, maxInFlight, metrics);
    }

    public FetchCoordinator(Collection<ProviderClient> clients,
                            QuotaTracker quota,
                            Function<ProviderProfile, RetryPolicy> retryPolicyFactory,
                            int maxInFlight,
                            Metrics metrics) {
        for (ProviderClient c : clients) {
            this.clients.put(c.id(), c);
            this.retryPolicies.put(c.id(), retryPolicyFactory.apply(c.profile()));
        }
        this.quota = Objects.requireNonNull(quota);
        this.maxInFlight = Math.max(1, maxInFlight);
        this.metrics = metrics == null ? new Metrics(null) : metrics;
        this.successMeter = this.metrics.meter("acquisition.segment.success");
        this.failedMeter = this.metrics.meter("acquisition.segment.failed");
        this.cancelledMeter = this.metrics.meter("acquisition.segment.cancelled");
        this.fallbackMeter = this.metrics.meter("acquisition.fallbacks");
    }

    /**
     * Runs all segments and waits for them, or for cancellation. Never throws on cancellation: segments that had
     * not finished are reported as cancelled and in-flight calls are interrupted.
     */
    public List<SegmentOutcome> execute(List<Segment> segments,
                                        FetchRequest request,
                                        List<String> providerOrder,
                                        CancellationToken token,
                                        AcquisitionListener listener) {
        int total = segments.size();
        if (total == 0) return List.of();
        for (String id : providerOrder) {
            if (!clients.containsKey(id)) throw new IllegalArgumentException("no client registered for provider " + id);
        }
        AcquisitionListener events = listener == null ? AcquisitionListener.NONE : listener;
        AtomicReferenceArray<SegmentOutcome> results = new AtomicReferenceArray<>(total);
        AtomicInteger remaining = new AtomicInteger(total);
        AtomicInteger finished = new AtomicInteger();
        CompletableFuture<Void> done = new CompletableFuture<>();
        // set once the outcomes are collected; guarded by results
        AtomicBoolean closed = new AtomicBoolean();

        int workers = Math.min(total, poolSize(providerOrder));
        int poolId = poolSeq.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "segment-fetch-" + poolId + "-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        token.onCancel(() -> done.complete(null));
        try {
            for (int i = 0; i < total; i++) {
                final int pos = i;
                final Segment segment = segments.get(i);
                pool.execute(() -> {
                    try {
                        SegmentOutcome outcome = fetchSegment(segment, request, providerOrder, token, events);
                        synchronized (results) {
                            if (closed.get()) {
                                LOG.debug("{} finished after the acquisition was closed, dropping {}", segment, outcome.status());
                                return;
                            }
                            results.compareAndSet(pos, null, outcome);
                            mark(outcome);
                            notifyFinished(events, outcome, finished.incrementAndGet(), total);
                        }
                    } finally {
                        if (remaining.decrementAndGet() == 0) done.complete(null);
                    }
                });
            }
            awaitDone(done, token);
        } finally {
            if (token.isCancelled()) pool.shutdownNow(); else pool.shutdown();
        }

        List<SegmentOutcome> out = new ArrayList<>(total);
        synchronized (results) {
            closed.set(true);
            for (int i = 0; i < total; i++) {
                SegmentOutcome o = results.get(i);
                out.add(o != null ? o : SegmentOutcome.cancelled(segments.get(i)));
            }
        }
        return out;
    }

    private SegmentOutcome fetchSegment(Segment segment, FetchRequest request, List<String> providerOrder,
                                        CancellationToken token, AcquisitionListener events) {
        Map<String, ErrorKind> failures = new LinkedHashMap<>();
        ErrorKind lastError = null;
        String previous = null;
        for (String providerId : providerOrder) {
            if (token.isCancelled()) return SegmentOutcome.cancelled(segment);
            if (previous != null) {
                fallbackMeter.mark();
                LOG.warn("{} falling back from {} to {} after {}", segment, previous, providerId, lastError);
                notifyFallback(events, segment, previous, providerId, lastError);
            }
            ProviderClient client = clients.get(providerId);
            try {
                List<DailyRecord> records = fetchFromProvider(client, segment, request, token);
                return SegmentOutcome.success(segment, providerId, records, failures);
            } catch (QuotaExceededException e) {
                failures.put(providerId, e.kind());
                lastError = e.kind();
                LOG.info("{} skipped {}: {}", segment, providerId, e.getMessage());
            } catch (FetchException e) {
                failures.put(providerId, e.kind());
                lastError = e.kind();
                LOG.warn("{} failed on {}: {} ({})", segment, providerId, e.kind(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return SegmentOutcome.cancelled(segment);
            } catch (RuntimeException e) {
                failures.put(providerId, ErrorKind.MALFORMED_RESPONSE);
                lastError = ErrorKind.MALFORMED_RESPONSE;
                LOG.error("{} provider {} failed unexpectedly", segment, providerId, e);
            }
            previous = providerId;
        }
        if (token.isCancelled()) return SegmentOutcome.cancelled(segment);
        return SegmentOutcome.failed(segment, lastError, failures);
    }

    private List<DailyRecord> fetchFromProvider(ProviderClient client, Segment segment, FetchRequest request,
                                                CancellationToken token) throws FetchException, InterruptedException {
        int maxSpan = client.profile().maxSpanDays();
        if (segment.span().days() <= maxSpan) {
            return fetchWithRetry(client, segment, request, token);
        }
        List<DateSpan> pieces = BatchPlanner.split(segment.span(), maxSpan);
        LOG.debug("{} exceeds {} limit of {} days, splitting into {} calls", segment, client.id(), maxSpan, pieces.size());
        List<DailyRecord> out = new ArrayList<>();
        for (DateSpan piece : pieces) {
            out.addAll(fetchWithRetry(client, segment.withSpan(piece), request, token));
        }
        return out;
    }

    private List<DailyRecord> fetchWithRetry(ProviderClient client, Segment segment, FetchRequest request,
                                             CancellationToken token) throws FetchException, InterruptedException {
        String id = client.id();
        RetryPolicy policy = retryPolicies.get(id);
        Timer timer = metrics.providerTimer(id, "fetch.time");
        int attempt = 0;
        while (true) {
            attempt++;
            if (token.isCancelled()) throw new InterruptedException("acquisition cancelled");
            try (Permit ignored = quota.reserve(id); Timer.Context ignoredTime = timer.time()) {
                metrics.providerCounter(id, "calls").inc();
                return client.fetchSegment(segment, request.location(), request.parameters());
            } catch (QuotaExceededException e) {
                metrics.providerCounter(id, "quota.rejections").inc();
                throw e;
            } catch (FetchException e) {
                metrics.providerCounter(id, "errors." + e.kind().name().toLowerCase(Locale.ROOT)).inc();
                RetryDecision decision = policy.shouldRetry(attempt, e.kind());
                if (!decision.retry()) throw e;
                LOG.debug("{} attempt {} on {} failed with {}, retrying in {} ms", segment, attempt, id, e.kind(), decision.delay().toMillis());
                Thread.sleep(decision.delay().toMillis());
            }
        }
    }

    private int poolSize(List<String> providerOrder) {
        int size = maxInFlight;
        for (String id : providerOrder) size = Math.min(size, clients.get(id).profile().maxConcurrent());
        return Math.max(1, size);
    }

    private void mark(SegmentOutcome outcome) {
        switch (outcome.status()) {
            case SUCCESS -> successMeter.mark();
            case FAILED -> failedMeter.mark();
            case CANCELLED -> cancelledMeter.mark();
        }
    }

    private static void awaitDone(CompletableFuture<Void> done, CancellationToken token) {
        try {
            done.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
        } catch (ExecutionException e) {
            throw new IllegalStateException("segment completion tracking failed", e.getCause());
        }
    }

    private static void notifyFinished(AcquisitionListener events, SegmentOutcome outcome, int finished, int total) {
        try {
            events.onSegmentFinished(outcome, finished, total);
        } catch (RuntimeException e) {
            LOG.warn("progress listener failed on {}", outcome.segment(), e);
        }
    }

    private static void notifyFallback(AcquisitionListener events, Segment segment, String from, String to, ErrorKind reason) {
        try {
            events.onProviderFallback(segment, from, to, reason);
        } catch (RuntimeException e) {
            LOG.warn("progress listener failed on fallback of {}", segment, e);
        }
    }
}
