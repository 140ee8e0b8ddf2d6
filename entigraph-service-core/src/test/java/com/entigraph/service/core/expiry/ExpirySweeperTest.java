package com.entigraph.service.core.expiry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.entigraph.service.core.config.EngineProperties;
import com.entigraph.service.core.store.EntityStore;
import com.entigraph.service.core.store.ExpiryReport;
import com.entigraph.service.core.store.StoreUnavailableException;
import com.entigraph.service.core.telemetry.EngineTelemetryRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class ExpirySweeperTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final EntityStore store = mock(EntityStore.class);
    private final EngineTelemetryRegistry telemetry = new EngineTelemetryRegistry();
    private final EngineProperties properties = new EngineProperties();
    private final ExpirySweeper sweeper =
            new ExpirySweeper(store, telemetry, properties, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void sweepsAtClockTimeAndCountsRemovals() {
        when(store.expireOlderThan(NOW)).thenReturn(new ExpiryReport(2, 3, 1));

        ExpiryReport report = sweeper.sweep();

        assertThat(report).isEqualTo(new ExpiryReport(2, 3, 1));
        assertThat(telemetry.snapshot().expiredEntities()).isEqualTo(2);
        assertThat(telemetry.snapshot().expiredRelationships()).isEqualTo(3);
        assertThat(telemetry.snapshot().expiredTags()).isEqualTo(1);
    }

    @Test
    void disabledSweepDoesNotTouchTheStore() {
        properties.getExpiry().setEnabled(false);

        sweeper.scheduledSweep();

        verify(store, never()).expireOlderThan(any());
    }

    @Test
    void storeFailureIsReportedAsEmptySweep() {
        when(store.expireOlderThan(NOW)).thenThrow(new StoreUnavailableException("down"));

        assertThat(sweeper.sweep().isEmpty()).isTrue();
        when(store.expireOlderThan(NOW)).thenReturn(ExpiryReport.empty());
        assertThat(sweeper.sweep()).isEqualTo(ExpiryReport.empty());
    }
}
