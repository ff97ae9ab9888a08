package com.last9.mcpserver.request;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EpochUnitTest {

    private static final Instant INSTANT = Instant.parse("2024-06-01T10:00:00.250Z");

    @Test
    void secondsDropSubSecondPart() {
        assertThat(EpochUnit.SECONDS.fromInstant(INSTANT)).isEqualTo(1717236000L);
        assertThat(EpochUnit.SECONDS.toInstant(1717236000L)).isEqualTo(Instant.parse("2024-06-01T10:00:00Z"));
    }

    @Test
    void nanosecondsKeepFullPrecision() {
        assertThat(EpochUnit.NANOSECONDS.fromInstant(INSTANT)).isEqualTo(1717236000250000000L);
        assertThat(EpochUnit.NANOSECONDS.toInstant(1717236000250000000L)).isEqualTo(INSTANT);
    }

    @Test
    void pipelineEndpointsUseSeconds() {
        assertThat(BackendEndpoint.LOGS_QUERY_RANGE.getTimeUnit()).isEqualTo(EpochUnit.SECONDS);
        assertThat(BackendEndpoint.TRACES_QUERY_RANGE.getTimeUnit()).isEqualTo(EpochUnit.SECONDS);
    }
}
