package com.last9.mcpserver.time;

import com.last9.mcpserver.config.properties.Last9Properties;
import com.last9.mcpserver.utility.TimestampFormatUtility;
import com.last9.shared.telemetry.exception.ValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Service for resolving a query window from optional relative and absolute inputs
 *
 * Logic:
 * - end defaults to now
 * - start defaults to end - lookback
 * - if only start is given, end = start + lookback (not now)
 * - the window must be ordered and no longer than the configured maximum
 */
@Service
@Log4j2
public class TimeRangeResolver {

    private final Clock clock;
    private final int maxLookbackMinutes;
    private final Duration maxWindow;

    public TimeRangeResolver(Clock clock, Last9Properties properties) {
        this(clock, properties.getQuery().getMaxLookbackMinutes(),
                Duration.ofHours(properties.getQuery().getMaxWindowHours()));
    }

    TimeRangeResolver(Clock clock, int maxLookbackMinutes, Duration maxWindow) {
        this.clock = clock;
        this.maxLookbackMinutes = maxLookbackMinutes;
        this.maxWindow = maxWindow;
    }

    /**
     * Resolve the window for a tool call
     *
     * @param params          caller inputs, all optional
     * @param defaultLookback minutes to use when the caller gave no lookback
     * @return ordered UTC window
     * @throws ValidationException on an out of range lookback, an unparseable timestamp,
     *                             start after end, or a window longer than the maximum
     */
    public TimeRange resolve(TimeRangeParams params, int defaultLookback) {
        TimeRangeParams p = params != null ? params : new TimeRangeParams(null, null, null);

        int lookback = p.lookbackMinutes() != null ? p.lookbackMinutes() : defaultLookback;
        if (lookback < 1) {
            throw new ValidationException("lookback_minutes must be at least 1");
        }
        if (lookback > maxLookbackMinutes) {
            throw new ValidationException(String.format("lookback_minutes cannot exceed %d (%s)",
                    maxLookbackMinutes, describe(Duration.ofMinutes(maxLookbackMinutes))));
        }
        Duration lookbackDuration = Duration.ofMinutes(lookback);

        boolean hasStart = StringUtils.hasText(p.startTime());
        boolean hasEnd = StringUtils.hasText(p.endTime());

        Instant start = hasStart ? parse("start_time", p.startTime()) : null;
        Instant end;
        if (hasEnd) {
            end = parse("end_time", p.endTime());
        } else if (hasStart) {
            end = start.plus(lookbackDuration);
        } else {
            end = clock.instant();
        }
        if (start == null) {
            start = end.minus(lookbackDuration);
        }

        if (start.isAfter(end)) {
            throw new ValidationException("start_time cannot be after end_time");
        }
        if (Duration.between(start, end).compareTo(maxWindow) > 0) {
            throw new ValidationException("time range cannot exceed " + describe(maxWindow));
        }

        log.debug("Resolved time range {} - {} (lookback {}m)", start, end, lookback);
        return new TimeRange(start, end);
    }

    private Instant parse(String name, String value) {
        try {
            return TimestampFormatUtility.parseInstant(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid " + name + ": " + e.getMessage(), e);
        }
    }

    private static String describe(Duration d) {
        long hours = d.toHours();
        if (d.equals(Duration.ofHours(hours))) {
            return hours + (hours == 1 ? " hour" : " hours");
        }
        return d.toMinutes() + " minutes";
    }
}
