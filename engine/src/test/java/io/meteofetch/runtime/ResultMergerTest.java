package io.meteofetch.runtime;

import io.meteofetch.core.DailyRecord;
import io.meteofetch.core.DateSpan;
import io.meteofetch.core.GapRange;
import io.meteofetch.core.GapReason;
import io.meteofetch.core.MergedSeries;
import io.meteofetch.core.Segment;
import io.meteofetch.core.SegmentOutcome;
import io.meteofetch.core.WeatherParameter;
import io.meteofetch.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResultMergerTest {
    private static final Set<WeatherParameter> PARAMS = Set.of(WeatherParameter.TEMPERATURE_MAX, WeatherParameter.PRECIPITATION_SUM);
    private static final LocalDate JAN_1 = LocalDate.of(2023, 1, 1);

    private final ResultMerger merger = new ResultMerger();

    private static Segment segment(int index, int fromDay, int toDay) {
        return new Segment(index, DateSpan.of(JAN_1.plusDays(fromDay), JAN_1.plusDays(toDay)), List.of("a", "b"));
    }

    private static SegmentOutcome served(Segment segment, String provider) {
        return SegmentOutcome.success(segment, provider, FakeProviderClient.recordsFor(segment, PARAMS, provider), Map.of());
    }

    private static DateSpan days(int fromDay, int toDay) {
        return DateSpan.of(JAN_1.plusDays(fromDay), JAN_1.plusDays(toDay));
    }

    @Test
    void successfulSegmentsProduceOneAscendingRecordPerDay() {
        List<SegmentOutcome> outcomes = List.of(served(segment(1, 10, 19), "b"), served(segment(0, 0, 9), "a"));
        MergedSeries series = merger.merge(outcomes, days(0, 19), PARAMS);

        assertTrue(series.isComplete());
        assertEquals(20, series.records().size());
        assertEquals(1.0, series.coverage());
        for (int i = 0; i < 20; i++) assertEquals(JAN_1.plusDays(i), series.records().get(i).date());
        assertEquals("a", series.records().get(9).source());
        assertEquals("b", series.records().get(10).source());
    }

    @Test
    void boundaryDateReturnedTwiceKeepsFirstSegmentValue() {
        Segment first = segment(0, 0, 9);
        Segment second = segment(1, 10, 19);
        List<DailyRecord> overlapping = new ArrayList<>(FakeProviderClient.recordsFor(segment(1, 9, 19), PARAMS, "b"));
        List<SegmentOutcome> outcomes = List.of(served(first, "a"), SegmentOutcome.success(second, "b", overlapping, Map.of()));

        MergedSeries series = merger.merge(outcomes, days(0, 19), PARAMS);

        assertEquals(20, series.records().size());
        assertEquals("a", series.records().get(9).source());
        assertTrue(series.isComplete());
    }

    @Test
    void recordsOutsideTheRequestedRangeAreDropped() {
        Segment only = segment(0, 0, 4);
        List<DailyRecord> spill = new ArrayList<>(FakeProviderClient.recordsFor(segment(0, -2, 6), PARAMS, "a"));
        MergedSeries series = merger.merge(List.of(SegmentOutcome.success(only, "a", spill, Map.of())), days(0, 4), PARAMS);

        assertEquals(5, series.records().size());
        assertEquals(JAN_1, series.records().get(0).date());
        assertEquals(JAN_1.plusDays(4), series.records().get(4).date());
    }

    @Test
    void failedAndCancelledSegmentsBecomeGapsWithTheirReason() {
        Segment ok = segment(0, 0, 9);
        Segment quota = segment(1, 10, 19);
        Segment broken = segment(2, 20, 29);
        Segment cancelled = segment(3, 30, 39);
        List<SegmentOutcome> outcomes = List.of(
                served(ok, "a"),
                SegmentOutcome.failed(quota, ErrorKind.QUOTA_EXCEEDED, Map.of("a", ErrorKind.QUOTA_EXCEEDED, "b", ErrorKind.QUOTA_EXCEEDED)),
                SegmentOutcome.failed(broken, ErrorKind.SERVER_ERROR, Map.of("a", ErrorKind.QUOTA_EXCEEDED, "b", ErrorKind.SERVER_ERROR)),
                SegmentOutcome.cancelled(cancelled));

        MergedSeries series = merger.merge(outcomes, days(0, 39), PARAMS);

        assertEquals(10, series.records().size());
        assertEquals(30, series.gaps().size());
        assertEquals(0.25, series.coverage());
        List<GapRange> gaps = series.gapRanges();
        assertEquals(List.of(
                new GapRange(days(10, 19), GapReason.QUOTA_EXHAUSTED),
                new GapRange(days(20, 29), GapReason.ALL_PROVIDERS_FAILED),
                new GapRange(days(30, 39), GapReason.CANCELLED)), gaps);
    }

    @Test
    void daysMissingFromASuccessfulResponseAreNoData() {
        Segment seg = segment(0, 0, 4);
        List<DailyRecord> partial = new ArrayList<>(FakeProviderClient.recordsFor(seg, PARAMS, "a"));
        partial.remove(2);
        MergedSeries series = merger.merge(List.of(SegmentOutcome.success(seg, "a", partial, Map.of())), days(0, 4), PARAMS);

        assertEquals(4, series.records().size());
        assertEquals(Map.of(JAN_1.plusDays(2), GapReason.NO_DATA), series.gaps());
        assertFalse(series.isComplete());
    }

    @Test
    void requestedKeysWithoutValueStayAsNull() {
        Segment seg = segment(0, 0, 0);
        DailyRecord sparse = DailyRecord.of(JAN_1, PARAMS, Map.of(WeatherParameter.TEMPERATURE_MAX.key(), 3.5), "a");
        MergedSeries series = merger.merge(List.of(SegmentOutcome.success(seg, "a", List.of(sparse), Map.of())), days(0, 0), PARAMS);

        DailyRecord r = series.records().get(0);
        assertEquals(3.5, r.value(WeatherParameter.TEMPERATURE_MAX));
        assertTrue(r.hasKey(WeatherParameter.PRECIPITATION_SUM));
        assertNull(r.value(WeatherParameter.PRECIPITATION_SUM));
    }

    @Test
    void recordLackingARequestedKeyIsRejected() {
        Segment seg = segment(0, 0, 0);
        DailyRecord narrow = DailyRecord.of(JAN_1, Set.of(WeatherParameter.TEMPERATURE_MAX), Map.of(), "a");
        List<SegmentOutcome> outcomes = List.of(SegmentOutcome.success(seg, "a", List.of(narrow), Map.of()));
        assertThrows(IllegalStateException.class, () -> merger.merge(outcomes, days(0, 0), PARAMS));
    }

    @Test
    void mergingTheSameOutcomesTwiceGivesEqualSeries() {
        List<SegmentOutcome> outcomes = List.of(served(segment(0, 0, 9), "a"),
                SegmentOutcome.failed(segment(1, 10, 19), ErrorKind.TIMEOUT, Map.of("a", ErrorKind.TIMEOUT)));
        assertEquals(merger.merge(outcomes, days(0, 19), PARAMS), merger.merge(outcomes, days(0, 19), PARAMS));
    }

    @Test
    void temperatureRangeNeedsBothBounds() {
        Set<WeatherParameter> temps = Set.of(WeatherParameter.TEMPERATURE_MAX, WeatherParameter.TEMPERATURE_MIN);
        DailyRecord both = DailyRecord.of(JAN_1, temps, Map.of("temperature_2m_max", 12.5, "temperature_2m_min", 2.0), "a");
        DailyRecord oneSided = DailyRecord.of(JAN_1, temps, Map.of("temperature_2m_max", 12.5), "a");
        assertEquals(10.5, both.temperatureRange());
        assertNull(oneSided.temperatureRange());
    }
}
