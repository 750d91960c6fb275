package io.meteofetch.core;

import io.meteofetch.error.FetchException;

import java.util.List;
import java.util.Set;

/**
 * A historical weather source able to serve one segment per call.
 * Implementations report every physical call to the quota tracker exactly once, success or failure.
 */
public interface ProviderClient {
    String id();

    ProviderProfile profile();

    /** Whether the provider can be used at all, e.g. credentials are configured. */
    default boolean isAvailable() { return true; }

    /**
     * Fetches daily records for the segment's span. Every returned record carries every requested parameter key.
     */
    List<DailyRecord> fetchSegment(Segment segment, Location location, Set<WeatherParameter> parameters)
            throws FetchException, InterruptedException;
}
