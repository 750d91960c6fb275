package io.meteofetch.config;

import java.util.Arrays;
import java.util.List;

public record EngineConfig(
        int maxInFlight,
        int maxRangeYears,
        List<String> defaultProviderOrder,
        double lowCoverageWarning
) {
    public EngineConfig {
        maxInFlight = Math.max(1, maxInFlight);
        maxRangeYears = Math.max(1, maxRangeYears);
        defaultProviderOrder = List.copyOf(defaultProviderOrder);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(8, 60, List.of(), 0.8);
    }

    public static EngineConfig fromEnv() {
        int inflight = Integer.parseInt(System.getProperty("meteofetch.maxInFlight", System.getenv().getOrDefault("METEOFETCH_MAX_INFLIGHT", "8")));
        int years = Integer.parseInt(System.getProperty("meteofetch.maxRangeYears", System.getenv().getOrDefault("METEOFETCH_MAX_RANGE_YEARS", "60")));
        String order = System.getProperty("meteofetch.providerOrder", System.getenv().getOrDefault("METEOFETCH_PROVIDER_ORDER", ""));
        double lowCoverage = Double.parseDouble(System.getProperty("meteofetch.lowCoverage", System.getenv().getOrDefault("METEOFETCH_LOW_COVERAGE", "0.8")));
        List<String> ids = Arrays.stream(order.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        return new EngineConfig(inflight, years, ids, lowCoverage);
    }
}
