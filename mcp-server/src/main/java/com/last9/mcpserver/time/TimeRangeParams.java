package com.last9.mcpserver.time;

/**
 * Optional window inputs as received from a tool call. Any field may be null.
 *
 * @param lookbackMinutes minutes before the end of the window
 * @param startTime       absolute start, "YYYY-MM-DD HH:MM:SS" or RFC3339
 * @param endTime         absolute end, same formats as {@code startTime}
 */
public record TimeRangeParams(Integer lookbackMinutes, String startTime, String endTime) {

    public static TimeRangeParams lookback(int minutes) {
        return new TimeRangeParams(minutes, null, null);
    }

    public static TimeRangeParams absolute(String startTime, String endTime) {
        return new TimeRangeParams(null, startTime, endTime);
    }
}
