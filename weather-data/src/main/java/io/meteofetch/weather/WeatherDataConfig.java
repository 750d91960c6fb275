package io.meteofetch.weather;

import io.meteofetch.config.EngineConfig;
import io.meteofetch.core.ProviderProfile;

import java.net.URI;
import java.time.Duration;

public record WeatherDataConfig(
        EngineConfig engine,
        URI openMeteoBaseUrl,
        int openMeteoMaxSpanDays,
        int openMeteoMaxConcurrent,
        Duration openMeteoTimeout,
        Duration openMeteoMinInterval,
        URI meteostatBaseUrl,
        String meteostatApiKey,
        int meteostatMaxSpanDays,
        int meteostatMaxConcurrent,
        long meteostatMonthlyLimit,
        Duration meteostatTimeout,
        Duration meteostatMinInterval,
        int maxAttempts
) {
    public static final URI OPEN_METEO_ARCHIVE = URI.create("https://archive-api.open-meteo.com/v1/archive");
    public static final URI METEOSTAT_RAPIDAPI = URI.create("https://meteostat.p.rapidapi.com");

    public static WeatherDataConfig defaults() {
        return new WeatherDataConfig(EngineConfig.defaults(), OPEN_METEO_ARCHIVE, 90, 4, Duration.ofSeconds(30), Duration.ofMillis(600),
                METEOSTAT_RAPIDAPI, "", 3650, 5, 10_000, Duration.ofSeconds(30), Duration.ofMillis(100), 3);
    }

    public static WeatherDataConfig fromEnv() {
        URI omUrl = URI.create(System.getProperty("meteofetch.openMeteo.baseUrl", System.getenv().getOrDefault("OPEN_METEO_BASE_URL", OPEN_METEO_ARCHIVE.toString())));
        int omSpan = Integer.parseInt(System.getProperty("meteofetch.openMeteo.maxSpanDays", System.getenv().getOrDefault("OPEN_METEO_MAX_SPAN_DAYS", "90")));
        int omConc = Integer.parseInt(System.getProperty("meteofetch.openMeteo.maxConcurrent", System.getenv().getOrDefault("OPEN_METEO_MAX_CONCURRENT", "4")));
        long omTimeout = Long.parseLong(System.getProperty("meteofetch.openMeteo.timeoutSeconds", System.getenv().getOrDefault("OPEN_METEO_TIMEOUT_SECONDS", "30")));
        long omInterval = Long.parseLong(System.getProperty("meteofetch.openMeteo.minIntervalMillis", System.getenv().getOrDefault("OPEN_METEO_MIN_INTERVAL_MILLIS", "600")));
        URI msUrl = URI.create(System.getProperty("meteofetch.meteostat.baseUrl", System.getenv().getOrDefault("METEOSTAT_BASE_URL", METEOSTAT_RAPIDAPI.toString())));
        String msKey = System.getProperty("meteofetch.meteostat.apiKey", System.getenv().getOrDefault("METEOSTAT_API_KEY", ""));
        int msSpan = Integer.parseInt(System.getProperty("meteofetch.meteostat.maxSpanDays", System.getenv().getOrDefault("METEOSTAT_MAX_SPAN_DAYS", "3650")));
        int msConc = Integer.parseInt(System.getProperty("meteofetch.meteostat.maxConcurrent", System.getenv().getOrDefault("METEOSTAT_MAX_CONCURRENT", "5")));
        long msLimit = Long.parseLong(System.getProperty("meteofetch.meteostat.monthlyLimit", System.getenv().getOrDefault("METEOSTAT_MONTHLY_LIMIT", "10000")));
        long msTimeout = Long.parseLong(System.getProperty("meteofetch.meteostat.timeoutSeconds", System.getenv().getOrDefault("METEOSTAT_TIMEOUT_SECONDS", "30")));
        long msInterval = Long.parseLong(System.getProperty("meteofetch.meteostat.minIntervalMillis", System.getenv().getOrDefault("METEOSTAT_MIN_INTERVAL_MILLIS", "100")));
        int attempts = Integer.parseInt(System.getProperty("meteofetch.maxAttempts", System.getenv().getOrDefault("METEOFETCH_MAX_ATTEMPTS", "3")));
        return new WeatherDataConfig(EngineConfig.fromEnv(), omUrl, omSpan, omConc, Duration.ofSeconds(omTimeout), Duration.ofMillis(omInterval),
                msUrl, msKey.trim(), msSpan, msConc, msLimit, Duration.ofSeconds(msTimeout), Duration.ofMillis(msInterval), attempts);
    }

    public ProviderProfile openMeteoProfile() {
        return ProviderProfile.builder(OpenMeteoClient.ID)
                .maxSpanDays(openMeteoMaxSpanDays)
                .maxConcurrent(openMeteoMaxConcurrent)
                .unlimited()
                .maxAttempts(maxAttempts)
                .requestTimeout(openMeteoTimeout)
                .minRequestInterval(openMeteoMinInterval)
                .build();
    }

    public ProviderProfile meteostatProfile() {
        return ProviderProfile.builder(MeteostatClient.ID)
                .maxSpanDays(meteostatMaxSpanDays)
                .maxConcurrent(meteostatMaxConcurrent)
                .monthlyQuota(meteostatMonthlyLimit)
                .maxAttempts(maxAttempts)
                .requestTimeout(meteostatTimeout)
                .minRequestInterval(meteostatMinInterval)
                .build();
    }
}
