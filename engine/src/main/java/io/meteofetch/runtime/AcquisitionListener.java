package io.meteofetch.runtime;

import io.meteofetch.core.FetchRequest;
import io.meteofetch.core.Segment;
import io.meteofetch.core.SegmentOutcome;
import io.meteofetch.error.ErrorKind;

/**
 * Progress notifications of one acquisition. Callbacks run on engine threads and must not block.
 */
public interface AcquisitionListener {
    AcquisitionListener NONE = new AcquisitionListener() {};

    default void onStarted(FetchRequest request, int totalSegments) {}

    /** A segment reached its final outcome; {@code finished} counts outcomes so far, including this one. */
    default void onSegmentFinished(SegmentOutcome outcome, int finished, int total) {}

    default void onProviderFallback(Segment segment, String fromProvider, String toProvider, ErrorKind reason) {}

    default void onFinished(AcquisitionResult result) {}
}
