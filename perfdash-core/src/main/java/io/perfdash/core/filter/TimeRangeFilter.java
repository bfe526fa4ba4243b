package io.perfdash.core.filter;

import io.perfdash.api.error.InvalidRangeException;
import io.perfdash.api.sample.Sample;
import io.perfdash.core.support.Timestamps;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Restricts a sample sequence to an inclusive time window.
 * <p>
 * Either bound may be omitted. The input order is preserved and never
 * re-sorted; sorting is done once when the samples are loaded.
 */
public class TimeRangeFilter {

    /**
     * @param samples samples sorted ascending by timestamp
     * @param start   inclusive lower bound, or null for none
     * @param end     inclusive upper bound, or null for none
     * @return the samples inside the window; the input itself when no bound is given
     * @throws InvalidRangeException if {@code start} is after {@code end}
     */
    public List<Sample> filter(List<Sample> samples, LocalDateTime start, LocalDateTime end) {
        validate(start, end);
        if (start == null && end == null) {
            return samples;
        }

        List<Sample> filtered = new ArrayList<>();
        for (Sample sample : samples) {
            LocalDateTime ts = sample.timestamp();
            if (start != null && ts.isBefore(start)) continue;
            if (end != null && ts.isAfter(end)) continue;
            filtered.add(sample);
        }
        return filtered;
    }

    /**
     * Same as {@link #filter(List, LocalDateTime, LocalDateTime)} with bounds given as text.
     * Blank text means no bound.
     *
     * @throws InvalidRangeException if a bound is not a timestamp or the window is inverted
     */
    public List<Sample> filter(List<Sample> samples, String start, String end) {
        return filter(samples, parseBound("start_time", start), parseBound("end_time", end));
    }

    /**
     * @throws InvalidRangeException if {@code start} is after {@code end}
     */
    public void validate(LocalDateTime start, LocalDateTime end) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidRangeException("start_time " + Timestamps.format(start)
                    + " is after end_time " + Timestamps.format(end));
        }
    }

    /**
     * Parse one bound of a window.
     *
     * @return the bound, or null when the text is null or blank
     * @throws InvalidRangeException if the text is not a timestamp
     */
    public static LocalDateTime parseBound(String name, String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Timestamps.parse(text);
        } catch (DateTimeException e) {
            throw new InvalidRangeException(name + " is not a timestamp: '" + text + "'", e);
        }
    }
}
