package io.meteofetch.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meteofetch.budget.QuotaTracker;
import io.meteofetch.core.DailyRecord;
import io.meteofetch.core.Location;
import io.meteofetch.core.ProviderProfile;
import io.meteofetch.core.Segment;
import io.meteofetch.core.WeatherParameter;
import io.meteofetch.error.ErrorKind;
import io.meteofetch.error.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Meteostat point data through RapidAPI. Needs an API key and is billed per call against a monthly allowance.
 * Meteostat field names are translated to the common parameter keys; sunshine minutes become seconds.
 */
public class MeteostatClient extends HttpProviderClient {
    private static final Logger LOG = LoggerFactory.getLogger(MeteostatClient.class);

    public static final String ID = "meteostat";
    static final String RAPIDAPI_HOST = "meteostat.p.rapidapi.com";
    static final String REMAINING_HEADER = "X-RateLimit-Requests-Remaining";
    static final int MIN_KEY_LENGTH = 32;

    private static final Map<WeatherParameter, String> FIELDS = new EnumMap<>(WeatherParameter.class);

    static {
        FIELDS.put(WeatherParameter.TEMPERATURE_MEAN, "tavg");
        FIELDS.put(WeatherParameter.TEMPERATURE_MIN, "tmin");
        FIELDS.put(WeatherParameter.TEMPERATURE_MAX, "tmax");
        FIELDS.put(WeatherParameter.PRECIPITATION_SUM, "prcp");
        FIELDS.put(WeatherParameter.WINDSPEED_MAX, "wspd");
        FIELDS.put(WeatherParameter.WINDGUSTS_MAX, "wpgt");
        FIELDS.put(WeatherParameter.WINDDIRECTION_DOMINANT, "wdir");
        FIELDS.put(WeatherParameter.SUNSHINE_DURATION, "tsun");
    }

    private final String apiKey;

    public MeteostatClient(ProviderProfile profile, URI baseUri, String apiKey, HttpClient http, ObjectMapper mapper, QuotaTracker quota) {
        super(profile, baseUri, http, mapper, quota);
        this.apiKey = apiKey == null ? "" : apiKey.trim();
    }

    /** Unavailable without a plausible RapidAPI key. */
    @Override
    public boolean isAvailable() { return apiKey.length() >= MIN_KEY_LENGTH; }

    @Override
    protected URI requestUri(Segment segment, Location location, Set<WeatherParameter> parameters) {
        return URI.create(baseUri + "/point/daily?lat=" + coordinate(location.latitude())
                + "&lon=" + coordinate(location.longitude())
                + "&start=" + segment.start()
                + "&end=" + segment.end());
    }

    @Override
    protected void decorate(HttpRequest.Builder request) {
        request.header("X-RapidAPI-Key", apiKey);
        request.header("X-RapidAPI-Host", RAPIDAPI_HOST);
    }

    @Override
    protected void onResponse(HttpResponse<String> response) {
        Optional<String> remaining = response.headers().firstValue(REMAINING_HEADER);
        if (remaining.isEmpty()) return;
        try {
            quota.recordRemaining(id(), Long.parseLong(remaining.get().trim()));
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring unparseable {} header '{}'", REMAINING_HEADER, remaining.get());
        }
    }

    @Override
    protected List<DailyRecord> parse(JsonNode root, Segment segment, Set<WeatherParameter> parameters) throws FetchException {
        JsonNode data = root.path("data");
        if (data.isMissingNode() || data.isNull()) return List.of();
        if (!data.isArray()) {
            throw new FetchException(id(), ErrorKind.MALFORMED_RESPONSE, "'data' is not an array");
        }
        List<DailyRecord> out = new ArrayList<>(data.size());
        for (JsonNode row : data) {
            String rawDate = row.path("date").asText("");
            LocalDate date;
            try {
                // dates may carry a time part
                date = LocalDate.parse(rawDate.length() > 10 ? rawDate.substring(0, 10) : rawDate);
            } catch (DateTimeParseException e) {
                throw new FetchException(id(), ErrorKind.MALFORMED_RESPONSE, "bad date '" + rawDate + "'", e);
            }
            Map<String, Double> values = new HashMap<>();
            for (WeatherParameter p : parameters) {
                values.put(p.key(), number(row.get(FIELDS.get(p))));
            }
            if (parameters.contains(WeatherParameter.TEMPERATURE_MEAN) && values.get(WeatherParameter.TEMPERATURE_MEAN.key()) == null) {
                Double max = number(row.get("tmax"));
                Double min = number(row.get("tmin"));
                if (max != null && min != null) values.put(WeatherParameter.TEMPERATURE_MEAN.key(), (max + min) / 2);
            }
            Double sunshine = values.get(WeatherParameter.SUNSHINE_DURATION.key());
            if (sunshine != null) values.put(WeatherParameter.SUNSHINE_DURATION.key(), sunshine * 60);
            out.add(DailyRecord.of(date, parameters, values, id()));
        }
        return out;
    }
}
