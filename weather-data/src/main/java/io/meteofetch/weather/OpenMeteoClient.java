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

import java.net.URI;
import java.net.http.HttpClient;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Open-Meteo historical archive. Free and keyless; the response is columnar, one array per daily variable
 * aligned with {@code daily.time}.
 *
 * @see <a href="https://open-meteo.com/en/docs/historical-weather-api">Historical Weather API</a>
 */
public class OpenMeteoClient extends HttpProviderClient {
    public static final String ID = "open-meteo";

    public OpenMeteoClient(ProviderProfile profile, URI baseUri, HttpClient http, ObjectMapper mapper, QuotaTracker quota) {
        super(profile, baseUri, http, mapper, quota);
    }

    @Override
    protected URI requestUri(Segment segment, Location location, Set<WeatherParameter> parameters) {
        String daily = parameters.stream().map(WeatherParameter::key).collect(Collectors.joining(","));
        return URI.create(baseUri + "?latitude=" + coordinate(location.latitude())
                + "&longitude=" + coordinate(location.longitude())
                + "&start_date=" + segment.start()
                + "&end_date=" + segment.end()
                + "&daily=" + daily
                + "&timezone=auto");
    }

    @Override
    protected List<DailyRecord> parse(JsonNode root, Segment segment, Set<WeatherParameter> parameters) throws FetchException {
        if (root.path("error").asBoolean(false)) {
            throw new FetchException(id(), ErrorKind.INVALID_REQUEST, "rejected: " + root.path("reason").asText("no reason"));
        }
        JsonNode daily = root.path("daily");
        JsonNode times = daily.path("time");
        if (!times.isArray()) {
            throw new FetchException(id(), ErrorKind.MALFORMED_RESPONSE, "response has no daily.time array");
        }
        List<DailyRecord> out = new ArrayList<>(times.size());
        for (int i = 0; i < times.size(); i++) {
            LocalDate date;
            try {
                date = LocalDate.parse(times.get(i).asText());
            } catch (DateTimeParseException e) {
                throw new FetchException(id(), ErrorKind.MALFORMED_RESPONSE, "bad date '" + times.get(i).asText() + "'", e);
            }
            Map<String, Double> values = new HashMap<>();
            for (WeatherParameter p : parameters) {
                values.put(p.key(), number(daily.path(p.key()).get(i)));
            }
            out.add(DailyRecord.of(date, parameters, values, id()));
        }
        return out;
    }
}
