package com.lendledger.unit.clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.lendledger.clock.SystemBlockClock;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SystemBlockClockTest {

    private static final Instant GENESIS = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("Height is whole block intervals since genesis")
    void heightFromElapsedTime() {
        Clock fixed = Clock.fixed(GENESIS.plusSeconds(6_599), ZoneOffset.UTC);

        assertThat(new SystemBlockClock(fixed, GENESIS, 600).currentHeight()).isEqualTo(10);
    }

    @Test
    @DisplayName("Before genesis the height is zero")
    void beforeGenesis() {
        Clock fixed = Clock.fixed(GENESIS.minusSeconds(3_600), ZoneOffset.UTC);

        assertThat(new SystemBlockClock(fixed, GENESIS, 600).currentHeight()).isZero();
    }

    @Test
    @DisplayName("Height never decreases when the wall clock steps back")
    void monotonic() {
        Clock clock = mock(Clock.class);
        when(clock.instant())
                .thenReturn(GENESIS.plusSeconds(6_000))
                .thenReturn(GENESIS.plusSeconds(1_200))
                .thenReturn(GENESIS.plusSeconds(7_200));
        SystemBlockClock blockClock = new SystemBlockClock(clock, GENESIS, 600);

        assertThat(blockClock.currentHeight()).isEqualTo(10);
        assertThat(blockClock.currentHeight()).isEqualTo(10);
        assertThat(blockClock.currentHeight()).isEqualTo(12);
    }

    @Test
    @DisplayName("Non-positive block interval is rejected")
    void invalidInterval() {
        assertThatThrownBy(() -> new SystemBlockClock(Clock.systemUTC(), GENESIS, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
