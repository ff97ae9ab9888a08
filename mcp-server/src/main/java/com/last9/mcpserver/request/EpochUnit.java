package com.last9.mcpserver.request;

import java.time.Instant;

/**
 * Unit of an epoch timestamp on the wire. Conversions between {@link Instant} and backend
 * numbers go through here and nowhere else.
 */
public enum EpochUnit {

    SECONDS {
        @Override
        public long fromInstant(Instant instant) {
            return instant.getEpochSecond();
        }

        @Override
        public Instant toInstant(long value) {
            return Instant.ofEpochSecond(value);
        }
    },
    NANOSECONDS {
        @Override
        public long fromInstant(Instant instant) {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
        }

        @Override
        public Instant toInstant(long value) {
            return Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000_000L), Math.floorMod(value, 1_000_000_000L));
        }
    };

    public abstract long fromInstant(Instant instant);

    public abstract Instant toInstant(long value);
}
