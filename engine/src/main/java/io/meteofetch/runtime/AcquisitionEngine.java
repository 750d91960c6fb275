package io.meteofetch.runtime;

import io.meteofetch.config.EngineConfig;
import io.meteofetch.core.DateSpan;
import io.meteofetch.core.FetchRequest;
import io.meteofetch.core.GapRange;
import io.meteofetch.core.GapReason;
import io.meteofetch.core.MergedSeries;
import io.meteofetch.core.ProviderClient;
import io.meteofetch.core.ProviderProfile;
import io.meteofetch.core.Segment;
import io.meteofetch.core.SegmentOutcome;
import io.meteofetch.error.AcquisitionFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for callers: plans a request, runs it in the background and delivers the merged series through the
 * handle's future. Range problems are reported synchronously by {@link #submit}; everything else is asynchronous.
 */
public class AcquisitionEngine implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AcquisitionEngine.class);

    private final ProviderRegistry registry;
    private final BatchPlanner planner;
    private final FetchCoordinator coordinator;
    private final ResultMerger merger;
    private final double lowCoverageWarning;
    private final ExecutorService executor;
    private final Map<String, AcquisitionHandle> active = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    public AcquisitionEngine(ProviderRegistry registry, BatchPlanner planner, FetchCoordinator coordinator,
                             ResultMerger merger, EngineConfig config) {
        this.registry = Objects.requireNonNull(registry);
        this.planner = Objects.requireNonNull(planner);
        this.coordinator = Objects.requireNonNull(coordinator);
        this.merger = Objects.requireNonNull(merger);
        this.lowCoverageWarning = config == null ? 0.8 : config.lowCoverageWarning();
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "acquisition-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public AcquisitionHandle submit(FetchRequest request) {
        return submit(request, AcquisitionListener.NONE);
    }

    /**
     * Starts an acquisition without blocking.
     *
     * @throws io.meteofetch.error.InvalidRangeException if the range is inverted or longer than allowed
     * @throws IllegalArgumentException                  if the preferred provider is unknown
     */
    public AcquisitionHandle submit(FetchRequest request, AcquisitionListener listener) {
        Objects.requireNonNull(request, "request");
        AcquisitionListener events = listener == null ? AcquisitionListener.NONE : listener;
        DateSpan range = request.range();
        List<ProviderClient> order = registry.order(request.providerPreference());
        String id = "acq-" + ids.incrementAndGet();
        CancellationToken token = new CancellationToken();
        CompletableFuture<AcquisitionResult> future = new CompletableFuture<>();
        AcquisitionHandle handle = new AcquisitionHandle(id, request, token, future);

        if (order.isEmpty()) {
            LOG.error("{}: no provider available for preference '{}'", id, request.providerPreference());
            future.completeExceptionally(new AcquisitionFailedException("no provider available for preference '" + request.providerPreference() + "'",
                    List.of(new GapRange(range, GapReason.ALL_PROVIDERS_FAILED))));
            return handle;
        }
        List<ProviderProfile> profiles = order.stream().map(ProviderClient::profile).toList();
        List<String> providerIds = profiles.stream().map(ProviderProfile::id).toList();
        List<Segment> segments = planner.plan(request, profiles);
        LOG.info("{}: {} {} for {} with {} segments, providers {}", id, range, request.parameters(), request.location(), segments.size(), providerIds);

        active.put(id, handle);
        executor.execute(() -> run(handle, range, segments, providerIds, events));
        return handle;
    }

    public boolean cancel(AcquisitionHandle handle) {
        return handle.cancel();
    }

    public Collection<AcquisitionHandle> active() { return List.copyOf(active.values()); }

    private void run(AcquisitionHandle handle, DateSpan range, List<Segment> segments, List<String> providerIds,
                     AcquisitionListener events) {
        FetchRequest request = handle.request();
        CancellationToken token = handle.token();
        try {
            safely(() -> events.onStarted(request, segments.size()));
            List<SegmentOutcome> outcomes = coordinator.execute(segments, request, providerIds, token, events);
            MergedSeries series = merger.merge(outcomes, range, request.parameters());
            boolean cancelled = token.isCancelled();
            AcquisitionResult result = AcquisitionResult.of(request, series, outcomes, cancelled);

            if (!cancelled && outcomes.stream().noneMatch(SegmentOutcome::isSuccess)) {
                List<GapRange> gaps = series.gapRanges();
                LOG.error("{}: every segment failed on every provider: {}", handle.id(), gaps);
                handle.result().completeExceptionally(new AcquisitionFailedException("all segments failed on all providers", gaps));
                return;
            }
            if (!cancelled && series.coverage() < lowCoverageWarning) {
                LOG.warn("{}: low coverage {} of {} days ({}%)", handle.id(), series.records().size(), range.days(),
                        String.format(Locale.ROOT, "%.1f", series.coverage() * 100));
            }
            LOG.info("{}: {} with {} records, {} gap days, served by {}", handle.id(), result.status(),
                    series.records().size(), series.gaps().size(), result.servedBy());
            handle.result().complete(result);
            safely(() -> events.onFinished(result));
        } catch (RuntimeException e) {
            LOG.error("{}: acquisition aborted", handle.id(), e);
            handle.result().completeExceptionally(e);
        } finally {
            active.remove(handle.id());
        }
    }

    private static void safely(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("progress listener failed", e);
        }
    }

    /** Cancels running acquisitions and stops the background threads. */
    @Override
    public void close() {
        for (AcquisitionHandle h : active.values()) h.cancel();
        executor.shutdown();
    }
}
