package com.urbanzen.analytics.pipeline;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.exception.MalformedEventException;
import com.urbanzen.analytics.exception.ModelNotReadyException;
import com.urbanzen.analytics.features.FeatureExtractor;
import com.urbanzen.analytics.features.FeatureVector;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import com.urbanzen.analytics.scoring.ScoreResult;
import com.urbanzen.analytics.severity.SeverityClassifier;
import com.urbanzen.analytics.sink.AlertSink;
import com.urbanzen.analytics.sink.CacheUpdate;
import com.urbanzen.analytics.sink.DeviceCache;
import com.urbanzen.analytics.state.DeviceHistory;
import com.urbanzen.analytics.state.DeviceStateStore;
import com.urbanzen.common.dto.alert.AlertEvent;
import com.urbanzen.common.dto.anomaly.AnomalyResult;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;
import com.urbanzen.common.model.SeverityTier;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Drives each telemetry event through extraction, scoring, classification and
 * emission.
 *
 * Events are routed to single-threaded lanes by device id, so one device's
 * events are always handled in order by one thread while different devices
 * proceed in parallel. A failure while handling an event is logged and counted
 * and never stops the lane.
 */
public class StreamingCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StreamingCoordinator.class);

    static final String ALERT_SINK = "alert";
    static final String CACHE_SINK = "cache";

    private static final long POLL_TIMEOUT_MS = 200;
    private static final long OFFER_TIMEOUT_MS = 100;

    private final DeviceStateStore stateStore;
    private final FeatureExtractor extractor;
    private final AnomalyScorer scorer;
    private final SeverityClassifier classifier;
    private final AlertSink alertSink;
    private final DeviceCache deviceCache;
    private final EmissionRetrier retrier;
    private final PipelineMetrics metrics;
    private final Validator validator;
    private final Settings settings;

    private final Object lifecycleLock = new Object();
    private volatile List<Lane> lanes = List.of();
    private volatile boolean accepting;
    private volatile boolean draining;

    /**
     * Lane and emission settings.
     */
    public record Settings(int workers, int queueCapacity, Duration shutdownTimeout, Duration cacheTtl) {
        public Settings {
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be positive: " + workers);
            }
            if (queueCapacity < 1) {
                throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
            }
        }
    }

    public StreamingCoordinator(DeviceStateStore stateStore,
                                FeatureExtractor extractor,
                                AnomalyScorer scorer,
                                SeverityClassifier classifier,
                                AlertSink alertSink,
                                DeviceCache deviceCache,
                                EmissionRetrier retrier,
                                PipelineMetrics metrics,
                                Validator validator,
                                Settings settings) {
        this.stateStore = stateStore;
        this.extractor = extractor;
        this.scorer = scorer;
        this.classifier = classifier;
        this.alertSink = alertSink;
        this.deviceCache = deviceCache;
        this.retrier = retrier;
        this.metrics = metrics;
        this.validator = validator;
        this.settings = settings;
    }

    /**
     * Starts the worker lanes. Calling it on a running coordinator has no effect.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (accepting) {
                return;
            }
            ThreadFactory threadFactory = new ThreadFactoryBuilder()
                    .setNameFormat("analytics-lane-%d")
                    .setUncaughtExceptionHandler((thread, error) ->
                            log.error("Lane thread {} died unexpectedly", thread.getName(), error))
                    .build();

            List<Lane> started = new ArrayList<>(settings.workers());
            for (int i = 0; i < settings.workers(); i++) {
                Lane lane = new Lane(settings.queueCapacity());
                lane.thread = threadFactory.newThread(lane::run);
                started.add(lane);
            }
            draining = false;
            lanes = List.copyOf(started);
            accepting = true;
            lanes.forEach(lane -> lane.thread.start());
            log.info("Streaming coordinator started with {} lanes (queue capacity {})",
                    settings.workers(), settings.queueCapacity());
        }
    }

    /**
     * Validates and enqueues an event on its device's lane, blocking while the
     * lane is full.
     *
     * @return {@code false} if the event was malformed or the coordinator is not accepting events
     */
    public boolean submit(TelemetryEvent event) {
        metrics.eventReceived();
        try {
            validate(event);
        } catch (MalformedEventException e) {
            rejectMalformed(e);
            return false;
        }

        List<Lane> current = lanes;
        if (!accepting || current.isEmpty()) {
            log.warn("Coordinator not accepting events; dropping event for device={}", event.deviceId());
            return false;
        }
        Lane lane = current.get(laneIndex(event.deviceId(), current.size()));
        try {
            while (accepting) {
                if (lane.queue.offer(event, OFFER_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.warn("Event for device={} not enqueued; coordinator is shutting down", event.deviceId());
        return false;
    }

    /**
     * Handles one event synchronously on the calling thread.
     *
     * @return the scoring outcome, or empty if the event was malformed or could not be scored
     */
    public Optional<AnomalyResult> process(TelemetryEvent event) {
        metrics.eventReceived();
        try {
            validate(event);
        } catch (MalformedEventException e) {
            rejectMalformed(e);
            return Optional.empty();
        }
        return handle(event);
    }

    /**
     * Counts and logs a message that could not be decoded into an event.
     */
    public void rejectUndecodable(MalformedEventException e) {
        metrics.eventReceived();
        rejectMalformed(e);
    }

    /**
     * Stops intake, lets the lanes drain their queues, then flushes the sinks.
     * Draining and flushing share one deadline: lanes still busy when it
     * expires are interrupted, and a flush still running is abandoned.
     *
     * @return {@code true} if everything drained and flushed within the timeout
     */
    public boolean shutdown() {
        List<Lane> stopping;
        synchronized (lifecycleLock) {
            if (!accepting) {
                return true;
            }
            accepting = false;
            draining = true;
            stopping = lanes;
        }
        log.info("Shutting down streaming coordinator, draining {} queued events", queuedEvents());

        long deadline = System.nanoTime() + settings.shutdownTimeout().toNanos();
        boolean clean = true;
        try {
            for (Lane lane : stopping) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                lane.thread.join(Math.max(1, remainingMs));
                if (lane.thread.isAlive()) {
                    clean = false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clean = false;
        }

        if (!clean) {
            log.warn("Lanes did not drain within {}; interrupting", settings.shutdownTimeout());
            stopping.forEach(lane -> lane.thread.interrupt());
        }
        int abandoned = stopping.stream().mapToInt(lane -> lane.queue.size()).sum();
        if (abandoned > 0) {
            log.warn("{} queued events were not processed before shutdown", abandoned);
        }

        boolean flushed = flushSinks(deadline);
        log.info("Streaming coordinator stopped");
        return clean && abandoned == 0 && flushed;
    }

    public boolean isRunning() {
        return accepting;
    }

    public PipelineStats stats() {
        return new PipelineStats(
                metrics.received(),
                metrics.malformed(),
                metrics.failed(),
                metrics.anomalies(),
                metrics.dropped(),
                stateStore.trackedDevices(),
                queuedEvents(),
                accepting);
    }

    static int laneIndex(String deviceId, int laneCount) {
        return Math.floorMod(deviceId.hashCode(), laneCount);
    }

    private Optional<AnomalyResult> handle(TelemetryEvent event) {
        ProcessingStage reached = ProcessingStage.RECEIVED;
        AnomalyResult result = null;
        try {
            DeviceHistory history = stateStore.record(event);
            // one artifact for both the schema and the model
            ModelArtifact artifact = scorer.requireArtifact();

            FeatureVector features = extractor.extract(
                    event, history, artifact.knownDeviceTypes(), artifact.qualityBounds());
            reached = ProcessingStage.FEATURE_EXTRACTED;

            ScoreResult score = metrics.timeScoring(() -> scorer.score(features, artifact));
            reached = ProcessingStage.SCORED;

            SeverityTier severity = classifier.classify(score.score());
            result = new AnomalyResult(
                    event.deviceId(),
                    event.deviceType(),
                    score.score(),
                    score.anomaly(),
                    severity,
                    event.timestamp(),
                    event.metrics());
            reached = ProcessingStage.CLASSIFIED;

            if (result.anomaly()) {
                metrics.anomalyDetected(event.deviceType(), severity);
                log.info("Anomaly detected: device={}, type={}, score={}, severity={}",
                        event.deviceId(), event.deviceType(), score.score(), severity.getValue());
                emitAlert(result);
            }
            reached = ProcessingStage.EMITTED;
        } catch (ModelNotReadyException e) {
            metrics.eventFailed(reached);
            log.debug("Not scoring event for device={}: {}", event.deviceId(), e.getMessage());
        } catch (RuntimeException e) {
            metrics.eventFailed(reached);
            log.error("Failed to process event for device={} after stage {}: {}",
                    event.deviceId(), reached.tag(), e.getMessage(), e);
        }

        writeCache(event, result, reached);
        return Optional.ofNullable(result);
    }

    private void emitAlert(AnomalyResult result) {
        AlertEvent alert = AlertEvent.from(result);
        if (!retrier.run(ALERT_SINK, () -> alertSink.publish(alert))) {
            metrics.emissionDropped(ALERT_SINK);
        }
    }

    private void writeCache(TelemetryEvent event, AnomalyResult result, ProcessingStage reached) {
        CacheUpdate update = CacheUpdate.of(event, result, settings.cacheTtl());
        try {
            if (!retrier.run(CACHE_SINK, () -> deviceCache.write(update))) {
                metrics.emissionDropped(CACHE_SINK);
            }
        } catch (RuntimeException e) {
            metrics.eventFailed(reached);
            log.error("Failed to update cache for device={}: {}", event.deviceId(), e.getMessage(), e);
        }
    }

    private void validate(TelemetryEvent event) {
        if (event == null) {
            throw new MalformedEventException("Event is null");
        }
        Set<ConstraintViolation<TelemetryEvent>> violations = validator.validate(event);
        if (!violations.isEmpty()) {
            String reasons = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new MalformedEventException("Invalid telemetry event: " + reasons);
        }
    }

    private void rejectMalformed(MalformedEventException e) {
        metrics.eventMalformed();
        log.warn("Skipping malformed telemetry event: {}", e.getMessage());
    }

    private int queuedEvents() {
        return lanes.stream().mapToInt(lane -> lane.queue.size()).sum();
    }

    private boolean flushSinks(long deadline) {
        long remainingMs = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
        ExecutorService flusher = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("analytics-flush-%d")
                .setDaemon(true)
                .build());
        Future<?> flush = flusher.submit(() -> {
            flushQuietly(ALERT_SINK, alertSink::flush);
            flushQuietly(CACHE_SINK, deviceCache::flush);
        });
        try {
            flush.get(remainingMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Sink flush did not finish within the remaining {} ms of the shutdown timeout", remainingMs);
            flush.cancel(true);
            return false;
        } catch (ExecutionException e) {
            log.error("Sink flush failed on shutdown: {}", e.getCause().getMessage(), e.getCause());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            flush.cancel(true);
            return false;
        } finally {
            flusher.shutdownNow();
        }
    }

    private void flushQuietly(String sink, Runnable flush) {
        try {
            flush.run();
        } catch (RuntimeException e) {
            log.error("Failed to flush {} sink on shutdown: {}", sink, e.getMessage(), e);
        }
    }

    private final class Lane {
        private final BlockingQueue<TelemetryEvent> queue;
        private Thread thread;

        private Lane(int capacity) {
            this.queue = new ArrayBlockingQueue<>(capacity);
        }

        private void run() {
            try {
                while (!draining || !queue.isEmpty()) {
                    TelemetryEvent event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                    if (event != null) {
                        handle(event);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Lane {} interrupted with {} events queued", Thread.currentThread().getName(), queue.size());
            }
        }
    }
}
