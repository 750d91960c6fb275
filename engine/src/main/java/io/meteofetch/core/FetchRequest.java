package io.meteofetch.core;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One user-initiated acquisition: where, which metrics, which days and which provider to prefer.
 * The date order is not checked here; planning rejects inverted or oversized ranges.
 */
public record FetchRequest(Location location,
                           Set<WeatherParameter> parameters,
                           LocalDate start,
                           LocalDate end,
                           String providerPreference) {
    public static final String AUTO = "auto";

    public FetchRequest {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (parameters == null || parameters.isEmpty()) {
            throw new IllegalArgumentException("at least one weather parameter is required");
        }
        parameters = Collections.unmodifiableSet(EnumSet.copyOf(parameters));
        providerPreference = (providerPreference == null || providerPreference.isBlank()) ? AUTO : providerPreference.trim();
    }

    public FetchRequest(Location location, Set<WeatherParameter> parameters, LocalDate start, LocalDate end) {
        this(location, parameters, start, end, AUTO);
    }

    public boolean isAuto() { return AUTO.equalsIgnoreCase(providerPreference); }

    /** The requested range; throws {@link io.meteofetch.error.InvalidRangeException} when start is after end. */
    public DateSpan range() { return DateSpan.of(start, end); }
}
