package com.entigraph.service.core.pipeline;

import com.entigraph.entity.model.EntityDelta;
import com.entigraph.entity.model.RelationshipDelta;
import com.entigraph.service.core.config.EngineProperties;
import com.entigraph.service.core.deadletter.DeadLetterSink;
import com.entigraph.service.core.relationship.RelationshipEngine;
import com.entigraph.service.core.store.EntityStore;
import com.entigraph.service.core.store.StoreUnavailableException;
import com.entigraph.service.core.synthesis.SynthesisEngine;
import com.entigraph.service.core.synthesis.SynthesisResult;
import com.entigraph.service.core.telemetry.EngineTelemetry;
import com.entigraph.telemetry.model.TelemetryEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs events through synthesis, entity upsert, relationship discovery and relationship upsert.
 * Events are either processed on the caller's thread ({@link #process}) or queued for the worker
 * pool ({@link #submit}).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TelemetryPipeline {

    private final SynthesisEngine synthesisEngine;
    private final RelationshipEngine relationshipEngine;
    private final EntityStore store;
    private final DeadLetterSink deadLetters;
    private final EngineTelemetry telemetry;
    private final EngineProperties properties;

    private int queueCapacity;
    private BlockingQueue<TelemetryEvent> queue;
    private ExecutorService executor;
    private final AtomicInteger activeJobs = new AtomicInteger();
    private volatile boolean accepting;
    // submitters hold the read side while enqueueing; stop takes the write side to close intake
    private final ReadWriteLock intake = new ReentrantReadWriteLock();

    @PostConstruct
    void start() {
        EngineProperties.Pipeline pipeline = properties.getPipeline();
        init(pipeline.getQueueCapacity(), pipeline.getWorkers());
    }

    void init(int capacity, int workers) {
        this.queueCapacity = capacity;
        queue = new ArrayBlockingQueue<>(capacity);
        executor = Executors.newFixedThreadPool(workers);
        accepting = true;
        for (int i = 0; i < workers; i++) {
            executor.submit(this::drainLoop);
        }
        log.info("Telemetry pipeline started workers={}, queueCapacity={}", workers, capacity);
    }

    /**
     * Stops intake, then lets queued and in-flight events finish within the shutdown timeout.
     * Whatever is still queued afterwards is dead-lettered as {@code shutdown-dropped}.
     */
    @PreDestroy
    void stop() {
        intake.writeLock().lock();
        try {
            accepting = false;
        } finally {
            intake.writeLock().unlock();
        }
        if (executor == null) {
            return;
        }
        executor.shutdown();
        Duration timeout = properties.getPipeline().getShutdownTimeout();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Telemetry pipeline shutdown timed out after {}", timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        List<TelemetryEvent> leftovers = new ArrayList<>();
        queue.drainTo(leftovers);
        if (!leftovers.isEmpty()) {
            log.warn("Telemetry pipeline stopped with {} queued events; dead-lettering them", leftovers.size());
            leftovers.forEach(event -> deadLetters.deadLetter(event, "shutdown-dropped", null));
        }
        log.info("Telemetry pipeline stopped");
    }

    /**
     * Queues an event for asynchronous processing, waiting up to {@code submitTimeout} for space.
     *
     * @return false when the pipeline is stopping or the queue stayed full
     */
    public boolean submit(TelemetryEvent event) {
        Duration timeout = properties.getPipeline().getSubmitTimeout();
        intake.readLock().lock();
        try {
            if (!accepting) {
                return false;
            }
            boolean queued = queue.offer(event, timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!queued) {
                log.warn("Telemetry pipeline queue full ({}); rejected eventType={}", queueCapacity, event.getEventType());
            } else if (log.isDebugEnabled()) {
                log.debug("Telemetry pipeline queue depth={}/{}", queue.size(), queueCapacity);
            }
            return queued;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        } finally {
            intake.readLock().unlock();
        }
    }

    /** Processes one event synchronously. Never throws for per-event failures. */
    public ProcessingOutcome process(TelemetryEvent event) {
        telemetry.eventReceived();
        SynthesisResult synthesis = synthesisEngine.synthesize(event);
        String entityGuid = null;
        if (synthesis.isMatch()) {
            EntityDelta delta = synthesis.delta();
            try {
                entityGuid = withRetry(() -> store.upsertEntity(delta), "entity " + delta.guid());
            } catch (StoreUnavailableException ex) {
                deadLetters.deadLetter(event, "entity-upsert-failed", ex);
                return new ProcessingOutcome(null, null, 0, true);
            }
        }

        List<RelationshipDelta> discovered = relationshipEngine.discover(event);
        int applied = 0;
        boolean deadLettered = false;
        for (RelationshipDelta relationship : discovered) {
            try {
                withRetry(
                        () -> {
                            store.upsertRelationship(relationship);
                            return relationship.key();
                        },
                        "relationship " + relationship.type());
                applied++;
            } catch (StoreUnavailableException ex) {
                if (!deadLettered) {
                    deadLetters.deadLetter(event, "relationship-upsert-failed", ex);
                }
                deadLettered = true;
            }
        }
        return new ProcessingOutcome(entityGuid, synthesis.reason(), applied, deadLettered);
    }

    private <T> T withRetry(Supplier<T> write, String what) {
        EngineProperties.StoreRetry retry = properties.getPipeline().getStoreRetry();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        long backoffMs = retry.getInitialBackoff().toMillis();
        for (int attempt = 1; ; attempt++) {
            try {
                return write.get();
            } catch (StoreUnavailableException ex) {
                if (attempt >= maxAttempts) {
                    log.warn("Store write for {} failed after {} attempts: {}", what, attempt, ex.getMessage());
                    throw ex;
                }
                telemetry.storeRetry();
                log.warn("Store write for {} failed (attempt {}/{}), retrying in {} ms", what, attempt, maxAttempts, backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
                backoffMs = backoffMs * 2;
            }
        }
    }

    void drainLoop() {
        while (true) {
            TelemetryEvent event;
            try {
                event = queue.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                if (!accepting || Thread.currentThread().isInterrupted()) {
                    return;
                }
                continue;
            }
            activeJobs.incrementAndGet();
            try {
                process(event);
            } catch (RuntimeException ex) {
                log.error("Telemetry pipeline worker failed on eventType={}", event.getEventType(), ex);
                deadLetters.deadLetter(event, "pipeline-error", ex);
            } finally {
                activeJobs.decrementAndGet();
            }
        }
    }

    public int queueDepth() {
        return queue == null ? 0 : queue.size();
    }

    /** Blocks until the queue is empty or the thread is interrupted. Intended for tests. */
    public void waitForDrain() {
        while (!queue.isEmpty() || activeJobs.get() > 0) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }
}
