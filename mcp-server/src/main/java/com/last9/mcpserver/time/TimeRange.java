package com.last9.mcpserver.time;

import java.time.Duration;
import java.time.Instant;

/**
 * Resolved query window in UTC. Construction goes through {@link TimeRangeResolver}, which
 * enforces ordering and the maximum span.
 */
public record TimeRange(Instant start, Instant end) {

    public Duration duration() {
        return Duration.between(start, end);
    }
}
