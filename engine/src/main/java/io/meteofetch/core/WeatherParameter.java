package io.meteofetch.core;

import java.util.Arrays;
import java.util.Optional;

/**
 * Daily metrics the engine recognizes. The key is the canonical name used in every {@link DailyRecord}.
 */
public enum WeatherParameter {
    TEMPERATURE_MAX("temperature_2m_max"),
    TEMPERATURE_MIN("temperature_2m_min"),
    TEMPERATURE_MEAN("temperature_2m_mean"),
    PRECIPITATION_SUM("precipitation_sum"),
    WINDSPEED_MAX("windspeed_10m_max"),
    WINDGUSTS_MAX("windgusts_10m_max"),
    WINDDIRECTION_DOMINANT("winddirection_10m_dominant"),
    SUNSHINE_DURATION("sunshine_duration");

    private final String key;

    WeatherParameter(String key) { this.key = key; }

    public String key() { return key; }

    public static Optional<WeatherParameter> fromKey(String key) {
        if (key == null) return Optional.empty();
        String k = key.trim();
        return Arrays.stream(values()).filter(p -> p.key.equals(k) || p.name().equalsIgnoreCase(k)).findFirst();
    }
}
