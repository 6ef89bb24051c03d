package com.urbanzen.analytics.pipeline;

import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.exception.TransientEmissionException;
import com.urbanzen.analytics.features.DeviceProfileRegistry;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import com.urbanzen.analytics.severity.SeverityClassifier;
import com.urbanzen.analytics.severity.SeverityThresholds;
import com.urbanzen.analytics.sink.AlertSink;
import com.urbanzen.analytics.sink.CacheUpdate;
import com.urbanzen.analytics.sink.DeviceCache;
import com.urbanzen.analytics.state.InMemoryDeviceStateStore;
import com.urbanzen.common.dto.alert.AlertEvent;
import com.urbanzen.common.dto.anomaly.AnomalyResult;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;
import com.urbanzen.common.model.SeverityTier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.urbanzen.analytics.TelemetryFixtures.START;
import static com.urbanzen.analytics.TelemetryFixtures.extractor;
import static com.urbanzen.analytics.TelemetryFixtures.normalWaterHistory;
import static com.urbanzen.analytics.TelemetryFixtures.reading;
import static com.urbanzen.analytics.TelemetryFixtures.trainer;
import static com.urbanzen.analytics.TelemetryFixtures.vectorsOf;
import static com.urbanzen.analytics.TelemetryFixtures.water;
import static org.assertj.core.api.Assertions.assertThat;

class StreamingCoordinatorTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private static ModelArtifact artifact;

    private SimpleMeterRegistry meterRegistry;
    private PipelineMetrics metrics;
    private AnomalyScorer scorer;
    private RecordingAlertSink alertSink;
    private RecordingDeviceCache deviceCache;
    private StreamingCoordinator coordinator;

    @BeforeAll
    static void train() {
        DeviceProfileRegistry registry = DeviceProfileRegistry.builtIn();
        artifact = trainer().fit(vectorsOf(normalWaterHistory(5, 60, 7L), extractor()),
                registry.knownDeviceTypes(), registry.qualityBounds());
    }

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(meterRegistry);
        scorer = new AnomalyScorer();
        scorer.activate(artifact);
        alertSink = new RecordingAlertSink();
        deviceCache = new RecordingDeviceCache();
        coordinator = coordinator(alertSink, 4);
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    void shouldFlagSpikeAfterNormalReadings() {
        // Given five normal readings
        double[] normal = {15.1, 14.9, 15.2, 14.8, 15.0};
        for (int i = 0; i < normal.length; i++) {
            coordinator.process(water("WS-TEST", START.plus(Duration.ofMinutes(5L * i)), normal[i], 2.5));
        }

        // When a spike arrives
        Optional<AnomalyResult> result = coordinator.process(
                water("WS-TEST", START.plus(Duration.ofMinutes(25)), 150.0, 2.5));

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().anomaly()).isTrue();
        assertThat(result.get().severity().isAtLeast(SeverityTier.HIGH)).isTrue();
        assertThat(result.get().metrics()).containsEntry("flow_rate", 150.0);

        AlertEvent alert = alertSink.published.get(alertSink.published.size() - 1);
        assertThat(alert.deviceId()).isEqualTo("WS-TEST");
        assertThat(alert.type()).isEqualTo(AlertEvent.ANOMALY_DETECTED);
        assertThat(alert.severity()).isEqualTo(result.get().severity());
        assertThat(deviceCache.writes).hasSize(6);
        assertThat(deviceCache.writes.get(5).key()).isEqualTo("device:WS-TEST:latest");
        assertThat(deviceCache.writes.get(5).payload().result()).isEqualTo(result.get());
    }

    @Test
    void shouldEmitAtMostOneAlertPerAnomalousEvent() {
        for (int i = 0; i < 5; i++) {
            coordinator.process(water("WS-ONE", START.plus(Duration.ofMinutes(5L * i)), 15.0, 2.5));
        }
        int alertsBefore = alertSink.published.size();

        coordinator.process(water("WS-ONE", START.plus(Duration.ofMinutes(25)), 150.0, 2.5));

        assertThat(alertSink.published.size() - alertsBefore).isEqualTo(1);
        assertThat(alertSink.attempts.get()).isEqualTo(alertSink.published.size());
    }

    @Test
    void shouldHandleUnseenDeviceTypeWithoutFailing() {
        Optional<AnomalyResult> result = coordinator.process(
                reading("GM-1", "gas_meter", START, Map.of("flow_rate", 15.0, "pressure", 2.5)));

        assertThat(result).isPresent();
        assertThat(result.get().deviceType()).isEqualTo("gas_meter");
        assertThat(metrics.failed()).isZero();
        assertThat(deviceCache.writes).hasSize(1);
    }

    @Test
    void shouldStillUpdateCacheWhenModelNotReady() {
        AnomalyScorer idle = new AnomalyScorer();
        StreamingCoordinator notReady = new StreamingCoordinator(new InMemoryDeviceStateStore(6), extractor(), idle,
                new SeverityClassifier(SeverityThresholds.DEFAULTS), alertSink, deviceCache,
                retrier(3), metrics, VALIDATOR, settings(1));

        Optional<AnomalyResult> result = notReady.process(water("WS-1", START, 15.0, 2.5));

        assertThat(result).isEmpty();
        assertThat(deviceCache.writes).hasSize(1);
        assertThat(deviceCache.writes.get(0).payload().result()).isNull();
        assertThat(meterRegistry.get("analytics.events.failed").tag("stage", "received").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldDropAlertAfterExhaustingRetries() {
        FailingAlertSink failing = new FailingAlertSink();
        StreamingCoordinator flaky = coordinator(failing, 1);
        for (int i = 0; i < 5; i++) {
            flaky.process(water("WS-2", START.plus(Duration.ofMinutes(5L * i)), 15.0, 2.5));
        }
        int attemptsBefore = failing.attempts.get();

        Optional<AnomalyResult> result = flaky.process(
                water("WS-2", START.plus(Duration.ofMinutes(25)), 150.0, 2.5));

        assertThat(result).isPresent();
        assertThat(failing.attempts.get() - attemptsBefore).isEqualTo(3);
        assertThat(metrics.dropped("alert")).isGreaterThanOrEqualTo(1);
        // the coordinator keeps going
        assertThat(flaky.process(water("WS-2", START.plus(Duration.ofMinutes(30)), 15.0, 2.5))).isPresent();
    }

    @Test
    void shouldSkipMalformedEventsWithoutSideEffects() {
        TelemetryEvent noDevice = water(" ", START, 15.0, 2.5);
        TelemetryEvent noTimestamp = TelemetryEvent.of("WS-1", "water_sensor", null, Map.of("flow_rate", 1.0));

        assertThat(coordinator.process(noDevice)).isEmpty();
        assertThat(coordinator.process(noTimestamp)).isEmpty();
        assertThat(coordinator.submit(noDevice)).isFalse();

        assertThat(metrics.malformed()).isEqualTo(3);
        assertThat(deviceCache.writes).isEmpty();
        assertThat(coordinator.stats().trackedDevices()).isZero();
    }

    @Test
    void shouldProcessSubmittedEventsInPerDeviceOrderAndDrainOnShutdown() {
        coordinator.start();
        List<TelemetryEvent> submitted = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            for (int d = 0; d < 6; d++) {
                TelemetryEvent event = water("LANE-" + d, START.plusSeconds(i), 15.0, 2.5);
                submitted.add(event);
                assertThat(coordinator.submit(event)).isTrue();
            }
        }

        boolean clean = coordinator.shutdown();

        assertThat(clean).isTrue();
        assertThat(deviceCache.writes).hasSize(submitted.size());
        assertThat(deviceCache.flushed.get()).isEqualTo(1);
        for (int d = 0; d < 6; d++) {
            String key = CacheUpdate.keyFor("LANE-" + d);
            List<Instant> seen = deviceCache.writes.stream()
                    .filter(update -> update.key().equals(key))
                    .map(update -> update.payload().event().timestamp())
                    .toList();
            assertThat(seen).hasSize(50).isSorted();
        }
        assertThat(coordinator.submit(water("LANE-0", START.plusSeconds(99), 15.0, 2.5))).isFalse();
    }

    @Test
    void shouldTrackAndCacheHeartbeatWithoutMeasurements() {
        // Given an event that only reports battery and signal
        TelemetryEvent heartbeat = new TelemetryEvent("WS-HB", "water_sensor", START, null, 90.0, -60.0, null);

        // When
        Optional<AnomalyResult> result = coordinator.process(heartbeat);

        // Then
        assertThat(result).isPresent();
        assertThat(result.get().metrics()).isEmpty();
        assertThat(metrics.malformed()).isZero();
        assertThat(deviceCache.writes).hasSize(1);
        assertThat(deviceCache.writes.get(0).key()).isEqualTo("device:WS-HB:latest");
        assertThat(coordinator.stats().trackedDevices()).isEqualTo(1);
    }

    @Test
    void shouldCountCacheFailureAfterEmissionAtEmittedStage() {
        DeviceCache broken = new DeviceCache() {
            @Override
            public void write(CacheUpdate update) {
                throw new IllegalStateException("serializer exploded");
            }
        };
        StreamingCoordinator failing = new StreamingCoordinator(new InMemoryDeviceStateStore(6), extractor(), scorer,
                new SeverityClassifier(SeverityThresholds.DEFAULTS), alertSink, broken,
                retrier(3), metrics, VALIDATOR, settings(1));

        Optional<AnomalyResult> result = failing.process(water("WS-3", START, 15.0, 2.5));

        assertThat(result).isPresent();
        assertThat(meterRegistry.get("analytics.events.failed").tag("stage", "emitted").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldInterruptBusyLaneWhenShutdownTimesOut() throws InterruptedException {
        // Given a lane stuck in a cache write and two more events queued behind it
        BlockingDeviceCache stuck = new BlockingDeviceCache();
        StreamingCoordinator slow = new StreamingCoordinator(new InMemoryDeviceStateStore(6), extractor(), scorer,
                new SeverityClassifier(SeverityThresholds.DEFAULTS), alertSink, stuck,
                retrier(1), metrics, VALIDATOR, settings(1, Duration.ofMillis(200)));
        slow.start();
        for (int i = 0; i < 3; i++) {
            assertThat(slow.submit(water("WS-SLOW", START.plusSeconds(i), 15.0, 2.5))).isTrue();
        }
        assertThat(stuck.entered.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        long started = System.nanoTime();
        boolean clean = slow.shutdown();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // Then
        assertThat(clean).isFalse();
        assertThat(elapsedMs).isLessThan(2_000);
        assertThat(stuck.interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(slow.stats().queuedEvents()).isEqualTo(2);
        assertThat(slow.isRunning()).isFalse();
    }

    @Test
    void shouldAbandonSinkFlushThatOutlivesShutdownTimeout() {
        BlockingFlushAlertSink hanging = new BlockingFlushAlertSink();
        StreamingCoordinator stopping = new StreamingCoordinator(new InMemoryDeviceStateStore(6), extractor(), scorer,
                new SeverityClassifier(SeverityThresholds.DEFAULTS), hanging, deviceCache,
                retrier(1), metrics, VALIDATOR, settings(1, Duration.ofMillis(200)));
        stopping.start();

        long started = System.nanoTime();
        boolean clean = stopping.shutdown();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(clean).isFalse();
        assertThat(elapsedMs).isLessThan(2_000);
    }

    @Test
    void shouldRouteDeviceToStableLane() {
        int lane = StreamingCoordinator.laneIndex("WS-42", 4);

        assertThat(StreamingCoordinator.laneIndex("WS-42", 4)).isEqualTo(lane);
        assertThat(lane).isBetween(0, 3);
    }

    private StreamingCoordinator coordinator(AlertSink sink, int workers) {
        return new StreamingCoordinator(new InMemoryDeviceStateStore(6), extractor(), scorer,
                new SeverityClassifier(SeverityThresholds.DEFAULTS), sink, deviceCache,
                retrier(3), metrics, VALIDATOR, settings(workers));
    }

    private static EmissionRetrier retrier(int attempts) {
        return new EmissionRetrier(attempts, Duration.ofMillis(10), 2.0, Duration.ofMillis(40), duration -> { });
    }

    private static StreamingCoordinator.Settings settings(int workers) {
        return settings(workers, Duration.ofSeconds(10));
    }

    private static StreamingCoordinator.Settings settings(int workers, Duration shutdownTimeout) {
        return new StreamingCoordinator.Settings(workers, 16, shutdownTimeout, Duration.ofHours(1));
    }

    static final class RecordingAlertSink implements AlertSink {
        final List<AlertEvent> published = new CopyOnWriteArrayList<>();
        final AtomicInteger attempts = new AtomicInteger();

        @Override
        public void publish(AlertEvent alert) {
            attempts.incrementAndGet();
            published.add(alert);
        }
    }

    static final class FailingAlertSink implements AlertSink {
        final AtomicInteger attempts = new AtomicInteger();

        @Override
        public void publish(AlertEvent alert) {
            attempts.incrementAndGet();
            throw new TransientEmissionException("alert", "broker unavailable", null);
        }
    }

    static final class RecordingDeviceCache implements DeviceCache {
        final List<CacheUpdate> writes = new CopyOnWriteArrayList<>();
        final AtomicInteger flushed = new AtomicInteger();

        @Override
        public void write(CacheUpdate update) {
            writes.add(update);
        }

        @Override
        public void flush() {
            flushed.incrementAndGet();
        }
    }

    static final class BlockingDeviceCache implements DeviceCache {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch interrupted = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public void write(CacheUpdate update) {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
                throw new TransientEmissionException("cache", "interrupted", e);
            }
        }
    }

    static final class BlockingFlushAlertSink implements AlertSink {

        @Override
        public void publish(AlertEvent alert) {
        }

        @Override
        public void flush() {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
