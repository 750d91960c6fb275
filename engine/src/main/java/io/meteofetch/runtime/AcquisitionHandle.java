package io.meteofetch.runtime;

import io.meteofetch.core.FetchRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Caller-side reference to a submitted acquisition.
 */
public final class AcquisitionHandle {
    private final String id;
    private final FetchRequest request;
    private final CancellationToken token;
    private final CompletableFuture<AcquisitionResult> result;

    AcquisitionHandle(String id, FetchRequest request, CancellationToken token, CompletableFuture<AcquisitionResult> result) {
        this.id = id;
        this.request = request;
        this.token = token;
        this.result = result;
    }

    public String id() { return id; }
    public FetchRequest request() { return request; }

    /**
     * Completes with the final result, including on cancellation. Completes exceptionally only with
     * {@link io.meteofetch.error.AcquisitionFailedException} or an unexpected engine error.
     */
    public CompletableFuture<AcquisitionResult> result() { return result; }

    /** Requests cancellation; idempotent. */
    public boolean cancel() { return token.cancel(); }

    public boolean isCancelled() { return token.isCancelled(); }

    public boolean isDone() { return result.isDone(); }

    CancellationToken token() { return token; }

    @Override
    public String toString() { return "AcquisitionHandle{" + id + '}'; }
}
