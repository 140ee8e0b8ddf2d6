package com.entigraph.service.core.expiry;

import com.entigraph.service.core.config.EngineProperties;
import com.entigraph.service.core.store.EntityStore;
import com.entigraph.service.core.store.ExpiryReport;
import com.entigraph.service.core.store.StoreUnavailableException;
import com.entigraph.service.core.telemetry.EngineTelemetry;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically removes expired entities, relationships and tag values from the store. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExpirySweeper {

    private final EntityStore store;
    private final EngineTelemetry telemetry;
    private final EngineProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean();

    @Scheduled(
            fixedDelayString = "${entigraph.expiry.sweep-rate:60000}",
            initialDelayString = "${entigraph.expiry.sweep-rate:60000}")
    public void scheduledSweep() {
        if (!properties.getExpiry().isEnabled()) {
            log.debug("Expiry sweep disabled; skip");
            return;
        }
        sweep();
    }

    public ExpiryReport sweep() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Expiry sweep already running; skip");
            return ExpiryReport.empty();
        }
        long t0 = System.nanoTime();
        try {
            ExpiryReport report = store.expireOlderThan(clock.instant());
            telemetry.expired(report.entitiesRemoved(), report.relationshipsRemoved(), report.tagsRemoved());
            long ms = (System.nanoTime() - t0) / 1_000_000L;
            if (report.isEmpty()) {
                log.debug("Expiry sweep removed nothing in {} ms", ms);
            } else {
                log.info(
                        "Expiry sweep removed entities={} relationships={} tags={} in {} ms",
                        report.entitiesRemoved(),
                        report.relationshipsRemoved(),
                        report.tagsRemoved(),
                        ms);
            }
            return report;
        } catch (StoreUnavailableException ex) {
            log.warn("Expiry sweep skipped, store unavailable: {}", ex.getMessage());
            return ExpiryReport.empty();
        } finally {
            running.set(false);
        }
    }
}
