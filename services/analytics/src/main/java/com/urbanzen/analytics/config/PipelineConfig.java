package com.urbanzen.analytics.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urbanzen.analytics.artifact.ModelArtifactManager;
import com.urbanzen.analytics.features.DeviceProfileRegistry;
import com.urbanzen.analytics.features.FeatureExtractor;
import com.urbanzen.analytics.ingest.TelemetryEventDecoder;
import com.urbanzen.analytics.pipeline.EmissionRetrier;
import com.urbanzen.analytics.pipeline.PipelineLifecycle;
import com.urbanzen.analytics.pipeline.PipelineMetrics;
import com.urbanzen.analytics.pipeline.StreamingCoordinator;
import com.urbanzen.analytics.scoring.AnomalyModelTrainer;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import com.urbanzen.analytics.scoring.ForestSettings;
import com.urbanzen.analytics.severity.SeverityClassifier;
import com.urbanzen.analytics.severity.SeverityThresholds;
import com.urbanzen.analytics.sink.AlertSink;
import com.urbanzen.analytics.sink.DeviceCache;
import com.urbanzen.analytics.sink.KafkaAlertSink;
import com.urbanzen.analytics.sink.RedisDeviceCache;
import com.urbanzen.analytics.state.DeviceStateStore;
import com.urbanzen.analytics.state.InMemoryDeviceStateStore;
import com.urbanzen.analytics.training.JsonLinesHistorySource;
import com.urbanzen.analytics.training.OfflineTrainingService;
import com.urbanzen.analytics.training.TelemetryHistorySource;
import com.urbanzen.common.dto.alert.AlertEvent;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Validator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the feature, scoring and streaming components from {@link AnalyticsProperties}.
 */
@Configuration
@EnableScheduling
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DeviceProfileRegistry deviceProfileRegistry(AnalyticsProperties properties) {
        return DeviceProfileRegistry.from(properties.getFeatures());
    }

    @Bean
    public FeatureExtractor featureExtractor(AnalyticsProperties properties, DeviceProfileRegistry profiles) {
        AnalyticsProperties.Features features = properties.getFeatures();
        return new FeatureExtractor(features.getWindowSize(), features.getEpsilon(),
                ZoneId.of(features.getZoneId()), profiles);
    }

    @Bean
    public DeviceStateStore deviceStateStore(AnalyticsProperties properties, Clock clock) {
        return new InMemoryDeviceStateStore(properties.getFeatures().getWindowSize(), clock);
    }

    @Bean
    public SeverityClassifier severityClassifier(AnalyticsProperties properties) {
        return new SeverityClassifier(SeverityThresholds.from(properties.getSeverity()));
    }

    @Bean
    public AnomalyScorer anomalyScorer() {
        return new AnomalyScorer();
    }

    @Bean
    public AnomalyModelTrainer anomalyModelTrainer(AnalyticsProperties properties, Clock clock) {
        AnalyticsProperties.Scoring scoring = properties.getScoring();
        return new AnomalyModelTrainer(scoring.getContamination(), ForestSettings.from(scoring),
                scoring.getMinTrainingSamples(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(TelemetryHistorySource.class)
    public TelemetryHistorySource telemetryHistorySource(AnalyticsProperties properties,
                                                         TelemetryEventDecoder decoder) {
        return new JsonLinesHistorySource(Path.of(properties.getTraining().getHistoryLocation()), decoder);
    }

    @Bean
    public OfflineTrainingService offlineTrainingService(AnalyticsProperties properties,
                                                         DeviceProfileRegistry profiles,
                                                         FeatureExtractor extractor,
                                                         AnomalyModelTrainer trainer,
                                                         ModelArtifactManager artifactManager,
                                                         AnomalyScorer scorer,
                                                         TelemetryHistorySource historySource,
                                                         Clock clock) {
        return new OfflineTrainingService(profiles, extractor, trainer, artifactManager, scorer, historySource,
                Path.of(properties.getScoring().getArtifactLocation()),
                properties.getTraining().getLookback(), clock);
    }

    @Bean
    public AlertSink alertSink(KafkaTemplate<String, AlertEvent> alertKafkaTemplate, AnalyticsProperties properties) {
        AnalyticsProperties.Kafka kafka = properties.getKafka();
        return new KafkaAlertSink(alertKafkaTemplate, kafka.getAlertTopic(), kafka.getSendTimeout());
    }

    @Bean
    public DeviceCache deviceCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisDeviceCache(redisTemplate, objectMapper);
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry, DeviceStateStore stateStore) {
        Gauge.builder("analytics.devices.tracked", stateStore, DeviceStateStore::trackedDevices)
                .description("Number of devices with rolling history in memory")
                .register(meterRegistry);
        return new PipelineMetrics(meterRegistry);
    }

    @Bean
    public StreamingCoordinator streamingCoordinator(AnalyticsProperties properties,
                                                     DeviceStateStore stateStore,
                                                     FeatureExtractor extractor,
                                                     AnomalyScorer scorer,
                                                     SeverityClassifier classifier,
                                                     AlertSink alertSink,
                                                     DeviceCache deviceCache,
                                                     PipelineMetrics metrics,
                                                     Validator validator) {
        AnalyticsProperties.Pipeline pipeline = properties.getPipeline();
        return new StreamingCoordinator(stateStore, extractor, scorer, classifier, alertSink, deviceCache,
                EmissionRetrier.from(pipeline), metrics, validator,
                new StreamingCoordinator.Settings(pipeline.getWorkers(), pipeline.getQueueCapacity(),
                        pipeline.getShutdownTimeout(), properties.getCache().getTtl()));
    }

    @Bean
    public PipelineLifecycle pipelineLifecycle(StreamingCoordinator coordinator) {
        return new PipelineLifecycle(coordinator);
    }
}
