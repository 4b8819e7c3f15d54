package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Keeps calls whose origination time lies in an inclusive UTC window.
 * Only the call's own origination time counts, never the timestamps of its quality records.
 */
@Getter
@Log4j2
public class DateRangeFilter {

    private final Instant start;
    private final Instant end;

    public DateRangeFilter(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start cannot be null");
        this.end = Objects.requireNonNull(end, "end cannot be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start " + start + " is after end " + end);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }

    public List<Call> apply(Collection<Call> calls) {
        List<Call> inRange = calls.stream()
                .filter(call -> contains(call.getOriginationTime()))
                .toList();
        log.debug("{} of {} calls originate between {} and {}", inRange.size(), calls.size(), start, end);
        return inRange;
    }
}
