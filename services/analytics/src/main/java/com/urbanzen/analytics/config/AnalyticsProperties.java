package com.urbanzen.analytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for the analytics pipeline, bound from the {@code analytics.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsProperties {

    private final Features features = new Features();
    private final Scoring scoring = new Scoring();
    private final Severity severity = new Severity();
    private final Pipeline pipeline = new Pipeline();
    private final State state = new State();
    private final Cache cache = new Cache();
    private final Kafka kafka = new Kafka();
    private final Training training = new Training();

    @Data
    public static class Features {
        /** Rolling window length in samples, the current event included. */
        private int windowSize = 6;
        private double epsilon = 1e-8;
        private String zoneId = "UTC";
        /** Device profiles layered on top of the built-in ones, keyed by device type. */
        private Map<String, Profile> profiles = new LinkedHashMap<>();
        /** Min-max bounds for quality fields; overrides the built-in bounds per field. */
        private Map<String, Range> qualityBounds = new LinkedHashMap<>();
    }

    @Data
    public static class Profile {
        private List<String> channels = new ArrayList<>();
        /** Bounds for this type only; fields not listed fall back to the fleet-wide bounds. */
        private Map<String, Range> qualityBounds = new LinkedHashMap<>();
    }

    @Data
    public static class Range {
        private double min;
        private double max;
    }

    @Data
    public static class Scoring {
        private double contamination = 0.1;
        private int numberOfTrees = 100;
        private int sampleSize = 256;
        private long randomSeed = 42L;
        private int minTrainingSamples = 100;
        private String artifactLocation = "./models/anomaly-detector.json";
    }

    @Data
    public static class Severity {
        private double critical = -0.5;
        private double high = -0.3;
        private double medium = -0.1;
    }

    @Data
    public static class Pipeline {
        private int workers = Runtime.getRuntime().availableProcessors();
        private int queueCapacity = 1000;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(2);
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class State {
        /** Devices silent for longer than this are dropped; unset keeps history forever. */
        private Duration idleTtl;
        private long evictionIntervalMs = 60_000L;
    }

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class Kafka {
        private String telemetryTopic = "device-telemetry";
        private String alertTopic = "alerts";
        private Duration sendTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Training {
        private boolean trainOnStartup = false;
        private String historyLocation = "./data/telemetry-history.jsonl";
        private Duration lookback = Duration.ofDays(30);
    }
}
