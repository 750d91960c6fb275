package io.meteofetch.weather;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meteofetch.budget.QuotaTracker;
import io.meteofetch.core.DailyRecord;
import io.meteofetch.core.Location;
import io.meteofetch.core.ProviderClient;
import io.meteofetch.core.ProviderProfile;
import io.meteofetch.core.Segment;
import io.meteofetch.core.WeatherParameter;
import io.meteofetch.error.ErrorKind;
import io.meteofetch.error.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * JSON-over-HTTP provider: one GET per segment, status codes mapped to {@link ErrorKind}, body parsed with Jackson.
 * Every call that reaches {@link HttpClient#send} counts once against the provider's quota.
 */
public abstract class HttpProviderClient implements ProviderClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpProviderClient.class);
    private static final int MAX_ERROR_BODY = 200;

    protected final ProviderProfile profile;
    protected final URI baseUri;
    protected final QuotaTracker quota;
    private final HttpClient http;
    private final ObjectMapper mapper;

    protected HttpProviderClient(ProviderProfile profile, URI baseUri, HttpClient http, ObjectMapper mapper, QuotaTracker quota) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.http = http == null ? HttpClient.newHttpClient() : http;
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.quota = Objects.requireNonNull(quota, "quota");
    }

    @Override
    public String id() { return profile.id(); }

    @Override
    public ProviderProfile profile() { return profile; }

    protected abstract URI requestUri(Segment segment, Location location, Set<WeatherParameter> parameters);

    /** Adds provider specific headers such as credentials. */
    protected void decorate(HttpRequest.Builder request) {}

    /** Inspects response metadata before the status is checked. */
    protected void onResponse(HttpResponse<String> response) {}

    protected abstract List<DailyRecord> parse(JsonNode root, Segment segment, Set<WeatherParameter> parameters) throws FetchException;

    @Override
    public List<DailyRecord> fetchSegment(Segment segment, Location location, Set<WeatherParameter> parameters)
            throws FetchException, InterruptedException {
        URI uri = requestUri(segment, location, parameters);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(profile.requestTimeout())
                .header("Accept", "application/json")
                .GET();
        decorate(builder);
        LOG.debug("{} GET {}", id(), uri);

        HttpResponse<String> resp;
        try {
            resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchException(id(), ErrorKind.TIMEOUT, "no response within " + profile.requestTimeout().toSeconds() + "s", e);
        } catch (ConnectException e) {
            throw new FetchException(id(), ErrorKind.CONNECTION, "cannot connect to " + uri.getHost(), e);
        } catch (IOException e) {
            throw new FetchException(id(), ErrorKind.CONNECTION, "transport failure: " + e.getMessage(), e);
        } finally {
            quota.recordUsage(id());
        }

        onResponse(resp);
        int status = resp.statusCode();
        if (status != 200) {
            throw new FetchException(id(), ErrorKind.fromHttpStatus(status), "HTTP " + status + ": " + abbreviate(resp.body()));
        }
        JsonNode root;
        try {
            root = mapper.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new FetchException(id(), ErrorKind.MALFORMED_RESPONSE, "response is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new FetchException(id(), ErrorKind.MALFORMED_RESPONSE, "response is not a JSON object");
        }
        List<DailyRecord> parsed = parse(root, segment, parameters);
        List<DailyRecord> records = parsed.stream().filter(r -> segment.span().contains(r.date())).toList();
        if (records.size() < parsed.size()) {
            LOG.debug("{} dropped {} days outside {}", id(), parsed.size() - records.size(), segment);
        }
        LOG.debug("{} returned {} days for {}", id(), records.size(), segment);
        return records;
    }

    /** Numeric cell or null for JSON null, missing and non-numeric values. */
    protected static Double number(JsonNode node) {
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    /** Query value of a coordinate, plain decimal notation. */
    protected static String coordinate(double degrees) {
        return String.format(Locale.ROOT, "%.4f", degrees);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        String s = body.strip();
        return s.length() <= MAX_ERROR_BODY ? s : s.substring(0, MAX_ERROR_BODY) + "...";
    }
}
