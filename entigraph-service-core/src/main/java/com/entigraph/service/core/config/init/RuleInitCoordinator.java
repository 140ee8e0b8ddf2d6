package com.entigraph.service.core.config.init;

import com.entigraph.service.core.config.EngineProperties;
import com.entigraph.service.core.config.RuleMaterializer;
import com.entigraph.service.core.config.RuleRegistry;
import com.entigraph.service.core.config.RuleSnapshot;
import com.entigraph.service.core.config.init.ResourceRuleSource.LoadedRuleFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Loads rule files at startup and re-scans them on a schedule. A load that fails to parse or
 * validate is rejected as a whole and the previously active snapshot stays in place.
 */
@Component
public class RuleInitCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RuleInitCoordinator.class);

    private final boolean enabled;
    private final String location; // e.g. "classpath:/entity-rules/" OR "file:/etc/entigraph/rules/"
    private final RuleRegistry registry;
    private final RuleMaterializer materializer;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile String lastFileFingerprint;

    public RuleInitCoordinator(
            RuleRegistry registry,
            ObjectMapper objectMapper,
            EngineProperties properties,
            Clock clock,
            @Value("${entigraph.rules.enabled:true}") boolean enabled,
            @Value("${entigraph.rules.location:classpath:/entity-rules/}") String location) {
        this.registry = registry;
        this.materializer = new RuleMaterializer(
                objectMapper,
                properties.getSynthesis().getDefaultEntityExpiration(),
                properties.getSynthesis().getAccountAttribute());
        this.clock = clock;
        this.enabled = enabled;
        this.location = location;
        if (log.isDebugEnabled()) {
            log.debug("RuleInitCoordinator constructed: enabled={}, location={}", enabled, location);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        log.info("Rule init startup: enabled={}, location={}", enabled, location);
        runOnce("startup", true);
    }

    /** Every minute (default); unchanged files are not re-materialized. */
    @Scheduled(cron = "${entigraph.rules.reload-cron:0 * * * * *}")
    public void scheduled() {
        runOnce("scheduled", false);
    }

    /** Forced reload, e.g. from the admin endpoint. */
    public ReloadResult reload() {
        return runOnce("manual", true);
    }

    ReloadResult runOnce(String reason, boolean force) {
        if (!enabled) {
            log.debug("Rule init disabled; skip ({})", reason);
            return ReloadResult.of(ReloadStatus.DISABLED, registry.current(), null);
        }
        if (!lock.tryLock()) {
            log.debug("Rule init already running; skip ({})", reason);
            return ReloadResult.of(ReloadStatus.SKIPPED, registry.current(), "reload already in progress");
        }
        long t0 = System.nanoTime();
        try {
            List<LoadedRuleFile> files = new ResourceRuleSource(resolve(location)).load();
            String fingerprint = fingerprint(files);
            if (!force && fingerprint.equals(lastFileFingerprint)) {
                log.debug("Rule files unchanged; skip ({})", reason);
                return ReloadResult.of(ReloadStatus.UNCHANGED, registry.current(), null);
            }
            RuleSnapshot next = registry.update(current -> materializer.materialize(
                    ResourceRuleSource.ruleSets(files), current.version() + 1, clock.instant()));
            lastFileFingerprint = fingerprint;
            log.info(
                    "Rule init ({}) loaded {} rule sets from {} files: synthesisRules={} relationshipRules={} version={}",
                    reason,
                    next.ruleSets().size(),
                    files.size(),
                    next.synthesisRuleCount(),
                    next.relationshipRuleCount(),
                    next.version());
            return ReloadResult.of(ReloadStatus.LOADED, next, null);
        } catch (Exception ex) {
            log.warn(
                    "Rule init failed ({}); keeping rule snapshot version {}: {}",
                    reason,
                    registry.current().version(),
                    ex.getMessage());
            log.debug("Rule init failure stacktrace", ex);
            return ReloadResult.of(ReloadStatus.FAILED, registry.current(), ex.getMessage());
        } finally {
            lock.unlock();
            long ms = (System.nanoTime() - t0) / 1_000_000L;
            log.debug("Rule init finished (reason={}) in {} ms", reason, ms);
        }
    }

    private static String resolve(String loc) {
        String resolved = loc;
        if (!resolved.matches("^[a-zA-Z]+:.*")) {
            Path p = Paths.get(resolved).toAbsolutePath().normalize();
            resolved = "file:" + p;
        }
        return resolved.endsWith("/") ? resolved : resolved + "/";
    }

    private static String fingerprint(List<LoadedRuleFile> files) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (LoadedRuleFile file : files) {
                digest.update(file.name().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
                digest.update(file.content().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
            }
            byte[] sha = digest.digest();
            StringBuilder sb = new StringBuilder(sha.length * 2);
            for (byte b : sha) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute hash for rule files", e);
        }
    }

    public enum ReloadStatus {
        LOADED,
        UNCHANGED,
        SKIPPED,
        DISABLED,
        FAILED
    }

    public record ReloadResult(ReloadStatus status, long version, int ruleSets, String message) {
        static ReloadResult of(ReloadStatus status, RuleSnapshot snapshot, String message) {
            return new ReloadResult(status, snapshot.version(), snapshot.ruleSets().size(), message);
        }
    }
}
