package io.meteofetch.core;

import io.meteofetch.error.InvalidRangeException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FetchRequestTest {
    private static final Location PARIS = new Location(48.8566, 2.3522);

    @Test
    void blankPreferenceMeansAuto() {
        FetchRequest r = new FetchRequest(PARIS, Set.of(WeatherParameter.TEMPERATURE_MEAN), LocalDate.of(2020, 1, 1), LocalDate.of(2020, 1, 1), " ");
        assertEquals(FetchRequest.AUTO, r.providerPreference());
        assertTrue(r.isAuto());
        assertEquals(1, r.range().days());
    }

    @Test
    void parametersAreRequiredAndCopied() {
        LocalDate d = LocalDate.of(2020, 1, 1);
        assertThrows(IllegalArgumentException.class, () -> new FetchRequest(PARIS, Set.of(), d, d));
        Set<WeatherParameter> params = EnumSet.of(WeatherParameter.PRECIPITATION_SUM);
        FetchRequest r = new FetchRequest(PARIS, params, d, d);
        params.add(WeatherParameter.SUNSHINE_DURATION);
        assertEquals(Set.of(WeatherParameter.PRECIPITATION_SUM), r.parameters());
    }

    @Test
    void invertedRangeIsReportedByRange() {
        FetchRequest r = new FetchRequest(PARIS, Set.of(WeatherParameter.TEMPERATURE_MAX), LocalDate.of(2020, 1, 2), LocalDate.of(2020, 1, 1));
        assertThrows(InvalidRangeException.class, r::range);
    }

    @Test
    void coordinatesAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new Location(91, 0));
        assertThrows(IllegalArgumentException.class, () -> new Location(0, -181));
        assertThrows(IllegalArgumentException.class, () -> new Location(Double.NaN, 0));
        assertEquals("48.8566,2.3522", PARIS.toString());
    }

    @Test
    void dateSpanCountsInclusiveDays() {
        DateSpan leap = DateSpan.of(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));
        assertEquals(29, leap.days());
        assertEquals(29, leap.dates().size());
        assertTrue(leap.contains(LocalDate.of(2024, 2, 29)));
        assertFalse(leap.contains(LocalDate.of(2024, 3, 1)));
    }

    @Test
    void parametersResolveByKeyOrName() {
        assertEquals(Optional.of(WeatherParameter.WINDGUSTS_MAX), WeatherParameter.fromKey("windgusts_10m_max"));
        assertEquals(Optional.of(WeatherParameter.WINDGUSTS_MAX), WeatherParameter.fromKey("windgusts_max"));
        assertTrue(WeatherParameter.fromKey("humidity").isEmpty());
    }
}
