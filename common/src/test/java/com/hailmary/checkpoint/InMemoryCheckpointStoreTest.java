package com.hailmary.checkpoint;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCheckpointStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Instant T1000 = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void unknownSource_startsAtEpoch() {
        assertThat(store.get("prospect")).isEqualTo(Instant.EPOCH);
        assertThat(store.describe("prospect").getLastSyncedAt()).isNull();
    }

    @Test
    void advance_neverMovesBackward() {
        assertThat(store.advance("prospect", T1000)).isTrue();
        assertThat(store.advance("prospect", T1000.minusSeconds(1))).isFalse();
        assertThat(store.advance("prospect", T1000)).isTrue();

        assertThat(store.get("prospect")).isEqualTo(T1000);
        assertThat(store.describe("prospect").getLastSyncedAt()).isEqualTo(NOW);
    }

    @Test
    void reset_returnsToEpochForOneSourceOnly() {
        store.advance("prospect", T1000);
        store.advance("company", T1000);

        store.reset("prospect");

        assertThat(store.get("prospect")).isEqualTo(Instant.EPOCH);
        assertThat(store.get("company")).isEqualTo(T1000);
        assertThat(store.advance("prospect", T1000.minusSeconds(60))).isTrue();
    }
}
