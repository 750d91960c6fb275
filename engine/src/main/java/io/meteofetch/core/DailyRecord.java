package io.meteofetch.core;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Values for one day keyed by {@link WeatherParameter#key()}. A parameter the provider did not deliver is
 * present with a {@code null} value.
 */
public final class DailyRecord {
    private final LocalDate date;
    private final Map<String, Double> values;
    private final String source;

    public DailyRecord(LocalDate date, Map<String, Double> values, String source) {
        this.date = Objects.requireNonNull(date, "date");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.source = source;
    }

    /**
     * Builds a record holding exactly the requested parameters, filling absent ones with null.
     */
    public static DailyRecord of(LocalDate date, Set<WeatherParameter> parameters, Map<String, Double> raw, String source) {
        Map<String, Double> vals = new LinkedHashMap<>();
        for (WeatherParameter p : parameters) {
            vals.put(p.key(), raw.get(p.key()));
        }
        return new DailyRecord(date, vals, source);
    }

    public LocalDate date() { return date; }
    public Map<String, Double> values() { return values; }
    public String source() { return source; }

    public Double value(WeatherParameter parameter) { return values.get(parameter.key()); }

    public boolean hasKey(WeatherParameter parameter) { return values.containsKey(parameter.key()); }

    /** Daily max minus min, or null when either is missing. */
    public Double temperatureRange() {
        Double max = value(WeatherParameter.TEMPERATURE_MAX);
        Double min = value(WeatherParameter.TEMPERATURE_MIN);
        return (max == null || min == null) ? null : max - min;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DailyRecord that)) return false;
        return date.equals(that.date) && values.equals(that.values) && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() { return Objects.hash(date, values, source); }

    @Override
    public String toString() {
        return "DailyRecord{" + date + ", " + values + ", source=" + source + '}';
    }
}
