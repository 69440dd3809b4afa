package com.changesentinel.core.source;

import com.changesentinel.core.model.MetricDefinition;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Time range of one fetch, with the time the source may take to answer.
 *
 * @since 1.0.0
 */
public final class WindowSpec {

    private final Instant start;
    private final Instant end;
    private final Duration timeout;

    /**
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    public WindowSpec(Instant start, Instant end, Duration timeout) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    /**
     * @return {@code [now - window, now]}
     */
    public static WindowSpec current(MetricDefinition definition, Instant now, Duration timeout) {
        return new WindowSpec(now.minus(definition.window()), now, timeout);
    }

    /**
     * @return the current window shifted back by the baseline look-back
     */
    public static WindowSpec baseline(MetricDefinition definition, Instant now, Duration timeout) {
        return current(definition, now.minus(definition.baselineLookback()), timeout);
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WindowSpec that))
            return false;
        return start.equals(that.start) && end.equals(that.end) && timeout.equals(that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, timeout);
    }

    @Override
    public String toString() {
        return "WindowSpec{" + start + " .. " + end + ", timeout=" + timeout + '}';
    }
}
